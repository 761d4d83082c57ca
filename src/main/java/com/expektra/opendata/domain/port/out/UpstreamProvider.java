package com.expektra.opendata.domain.port.out;

import com.expektra.opendata.domain.model.Row;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.TimeRange;

import java.util.List;

/**
 * Port for fetching series data from the external provider.
 * Domain doesn't care about HTTP, paging windows or JSON.
 */
public interface UpstreamProvider {

    /**
     * Fetch every row of {@code range}, following upstream paging to the end.
     * Either the whole range is returned or the call fails; partial results are never returned.
     */
    List<Row> fetchRows(SeriesKey key, TimeRange range);
}
