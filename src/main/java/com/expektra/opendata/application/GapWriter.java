package com.expektra.opendata.application;

import com.expektra.opendata.domain.model.Row;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.TimeRange;
import com.expektra.opendata.domain.port.out.IntervalStore;
import com.expektra.opendata.domain.port.out.TimeSeriesStore;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Writes the rows of a fetched gap and marks the gap cached in one transaction,
 * so an interval is never recorded without its rows.
 */
@Component
public class GapWriter {

    private final TimeSeriesStore timeSeriesStore;
    private final IntervalStore intervalStore;

    public GapWriter(TimeSeriesStore timeSeriesStore, IntervalStore intervalStore) {
        this.timeSeriesStore = timeSeriesStore;
        this.intervalStore = intervalStore;
    }

    @Transactional
    public int commit(SeriesKey key, TimeRange range, List<Row> rows) {
        int written = rows.isEmpty() ? 0 : timeSeriesStore.upsert(rows);
        intervalStore.markCovered(key, range);
        return written;
    }
}
