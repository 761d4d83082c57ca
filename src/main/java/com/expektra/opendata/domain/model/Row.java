package com.expektra.opendata.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One normalized, immutable time bucket of a series in a zone.
 * {@code values} holds every schema field of the series in schema order; absent values are {@code null}.
 *
 * @param mgaCode metering grid area of the row, {@link SeriesKey#NO_MGA} for zone-wide rows
 * @param mgaName display name of the metering grid area as published, may be {@code null}
 */
public record Row(Series series, Zone zone, String mgaCode, String mgaName, Instant time, Map<String, Double> values) {

    public Row {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(time, "time");
        mgaCode = mgaCode != null ? mgaCode : SeriesKey.NO_MGA;
        Map<String, Double> ordered = new LinkedHashMap<>();
        for (String field : series.fieldNames()) {
            ordered.put(field, values != null ? values.get(field) : null);
        }
        values = Collections.unmodifiableMap(ordered);
    }

    public Row(Series series, Zone zone, Instant time, Map<String, Double> values) {
        this(series, zone, SeriesKey.NO_MGA, null, time, values);
    }

    public SeriesKey key() {
        return SeriesKey.of(series, zone, mgaCode);
    }

    public boolean belongsTo(SeriesKey key) {
        return series == key.series() && zone == key.zone() && mgaCode.equals(key.mga());
    }

    public Double value(String field) {
        return values.get(field);
    }
}
