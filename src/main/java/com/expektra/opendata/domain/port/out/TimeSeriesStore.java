package com.expektra.opendata.domain.port.out;

import com.expektra.opendata.domain.model.Row;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.TimeRange;

import java.util.List;

/**
 * Row storage keyed by series-key and time.
 */
public interface TimeSeriesStore {

    /**
     * Insert or overwrite rows. Writing the same row twice is a no-op; a changed value wins.
     *
     * @return number of rows written
     */
    int upsert(List<Row> rows);

    /**
     * Rows of the key inside {@code range}, ascending by time.
     */
    List<Row> readRange(SeriesKey key, TimeRange range);

    /**
     * At most {@code limit} rows of the key inside {@code range}, ascending by time.
     */
    List<Row> readRange(SeriesKey key, TimeRange range, int limit);

    long count(SeriesKey key, TimeRange range);
}
