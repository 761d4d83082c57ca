package com.expektra.opendata.infrastructure.adapter.provider;

import com.expektra.opendata.domain.model.TimeRange;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Lazy sequence of upstream pages covering a range.
 * eSett has no cursor paging, so a page is one request for a window of at most {@code maxWindow};
 * the sequence is exhausted once the window cursor reaches the end of the range.
 * Each call to {@link #iterator()} starts over from the beginning, and no page is requested
 * before {@code next()} asks for it.
 */
public final class UpstreamPageSequence implements Iterable<UpstreamPage> {

    private final TimeRange range;
    private final Duration maxWindow;
    private final Function<TimeRange, UpstreamPage> pageFetcher;

    public UpstreamPageSequence(TimeRange range, Duration maxWindow, Function<TimeRange, UpstreamPage> pageFetcher) {
        if (maxWindow.isZero() || maxWindow.isNegative()) {
            throw new IllegalArgumentException("maxWindow must be positive: " + maxWindow);
        }
        this.range = range;
        this.maxWindow = maxWindow;
        this.pageFetcher = pageFetcher;
    }

    /**
     * Windows the sequence will request, in order.
     */
    public List<TimeRange> windows() {
        List<TimeRange> windows = new ArrayList<>();
        Instant cursor = range.start();
        while (cursor.isBefore(range.end())) {
            TimeRange window = windowFrom(cursor);
            windows.add(window);
            cursor = window.end();
        }
        return windows;
    }

    @Override
    public Iterator<UpstreamPage> iterator() {
        return new Iterator<>() {
            private Instant cursor = range.start();

            @Override
            public boolean hasNext() {
                return cursor.isBefore(range.end());
            }

            @Override
            public UpstreamPage next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("Range " + range + " exhausted");
                }
                TimeRange window = windowFrom(cursor);
                UpstreamPage page = pageFetcher.apply(window);
                cursor = window.end();
                return page;
            }
        };
    }

    private TimeRange windowFrom(Instant cursor) {
        Instant windowEnd = cursor.plus(maxWindow);
        if (windowEnd.isAfter(range.end())) {
            windowEnd = range.end();
        }
        return TimeRange.of(cursor, windowEnd);
    }
}
