package com.expektra.opendata.domain.interval;

import com.expektra.opendata.domain.model.TimeRange;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Minimal set of disjoint half-open ranges kept in ascending order.
 * Adjacent or overlapping ranges are merged on {@link #add}. Not thread-safe; callers own the locking.
 */
public final class IntervalSet {

    private final List<TimeRange> ranges = new ArrayList<>();

    public IntervalSet() {
    }

    public static IntervalSet of(Collection<TimeRange> ranges) {
        IntervalSet set = new IntervalSet();
        ranges.forEach(set::add);
        return set;
    }

    /**
     * Add a range, merging with any overlapping or adjacent ranges. Empty ranges are ignored.
     */
    public void add(TimeRange range) {
        if (range.isEmpty()) {
            return;
        }

        List<TimeRange> merged = new ArrayList<>();
        TimeRange current = range;

        for (TimeRange existing : ranges) {
            if (existing.intersects(current) || existing.adjacentTo(current)) {
                current = current.span(existing);
            } else {
                merged.add(existing);
            }
        }

        merged.add(current);
        merged.sort(Comparator.comparing(TimeRange::start));

        ranges.clear();
        ranges.addAll(merged);
    }

    /**
     * Sub-ranges of {@code requested} not covered by this set, ascending and clipped to {@code requested}.
     */
    public List<TimeRange> gaps(TimeRange requested) {
        if (requested.isEmpty()) {
            return Collections.emptyList();
        }

        List<TimeRange> gaps = new ArrayList<>();
        var cursor = requested.start();

        for (TimeRange range : ranges) {
            if (!range.end().isAfter(cursor)) {
                continue; // entirely before the cursor
            }
            if (!range.start().isBefore(requested.end())) {
                break; // past the request
            }
            if (range.start().isAfter(cursor)) {
                gaps.add(TimeRange.of(cursor, range.start()));
            }
            cursor = range.end();
            if (!cursor.isBefore(requested.end())) {
                return gaps;
            }
        }

        if (cursor.isBefore(requested.end())) {
            gaps.add(TimeRange.of(cursor, requested.end()));
        }
        return gaps;
    }

    public boolean encloses(TimeRange requested) {
        return gaps(requested).isEmpty();
    }

    public List<TimeRange> ranges() {
        return List.copyOf(ranges);
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    @Override
    public String toString() {
        return "IntervalSet" + ranges;
    }
}
