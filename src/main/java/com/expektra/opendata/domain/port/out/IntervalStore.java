package com.expektra.opendata.domain.port.out;

import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.TimeRange;

import java.util.List;

/**
 * Tracks which time ranges of a series-key are fully present in the time-series store.
 * Ranges handed in are expected to be aligned to the series granularity.
 */
public interface IntervalStore {

    /**
     * All cached intervals of the key, ascending and pairwise disjoint.
     */
    List<TimeRange> covered(SeriesKey key);

    /**
     * Sub-ranges of {@code requested} that are not cached yet, ascending and disjoint.
     * An empty request yields no gaps.
     */
    List<TimeRange> gaps(SeriesKey key, TimeRange requested);

    /**
     * Record {@code range} as cached, merging with adjacent or overlapping intervals.
     * Must only be called once the rows of the range are durably written.
     */
    void markCovered(SeriesKey key, TimeRange range);
}
