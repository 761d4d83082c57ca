package com.expektra.opendata.domain.model;

import java.util.Objects;

/**
 * A read request against the cache.
 *
 * @param pageToken opaque continuation token from a previous page, or {@code null} for the first page
 * @param mga       metering grid area filter, empty for the zone-wide series
 */
public record SeriesQuery(Series series, Zone zone, TimeRange range, int pageSize, String pageToken, String mga) {

    public SeriesQuery {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(range, "range");
        mga = SeriesKey.requireValidMga(series, mga);
    }

    public SeriesQuery(Series series, Zone zone, TimeRange range, int pageSize, String pageToken) {
        this(series, zone, range, pageSize, pageToken, SeriesKey.NO_MGA);
    }

    public SeriesKey key() {
        return SeriesKey.of(series, zone, mga);
    }
}
