package com.expektra.opendata.application;

import com.expektra.opendata.domain.interval.IntervalSet;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.TimeRange;
import com.expektra.opendata.domain.port.out.IntervalStore;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

class InMemoryIntervalStore implements IntervalStore {

    private final Map<SeriesKey, IntervalSet> intervals = new ConcurrentHashMap<>();

    private IntervalSet setOf(SeriesKey key) {
        return intervals.computeIfAbsent(key, k -> new IntervalSet());
    }

    @Override
    public List<TimeRange> covered(SeriesKey key) {
        IntervalSet set = setOf(key);
        synchronized (set) {
            return set.ranges();
        }
    }

    @Override
    public List<TimeRange> gaps(SeriesKey key, TimeRange requested) {
        IntervalSet set = setOf(key);
        synchronized (set) {
            return set.gaps(requested);
        }
    }

    @Override
    public void markCovered(SeriesKey key, TimeRange range) {
        IntervalSet set = setOf(key);
        synchronized (set) {
            set.add(range);
        }
    }
}
