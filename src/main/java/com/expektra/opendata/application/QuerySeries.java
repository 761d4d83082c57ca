package com.expektra.opendata.application;

import com.expektra.opendata.domain.model.SeriesPage;
import com.expektra.opendata.domain.model.SeriesQuery;

/**
 * Read-through access to a cached series.
 */
public interface QuerySeries {

    /**
     * Returns one page of the requested range. Missing parts of the range are fetched from upstream
     * and cached before the page is read, so the page always reflects the complete range.
     *
     * @param query series, zone, time range, page size and optional continuation token
     * @return the page, with a continuation token when more rows follow
     * @throws com.expektra.opendata.domain.exception.EnergyDataException if the range is invalid
     *         or a missing part could not be fetched or stored
     */
    SeriesPage execute(SeriesQuery query);
}
