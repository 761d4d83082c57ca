package com.expektra.opendata.domain.model;

import com.expektra.opendata.domain.exception.InvalidRangeException;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Unit of caching and fetch coordination: one series in one zone, narrowed to one metering grid area
 * for series published per MGA. An empty {@code mga} means the zone-wide series.
 */
public record SeriesKey(Series series, Zone zone, String mga) {

    public static final String NO_MGA = "";

    private static final Pattern MGA_CODE = Pattern.compile("[A-Za-z0-9-]{1,32}");

    public SeriesKey {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(zone, "zone");
        mga = requireValidMga(series, mga);
    }

    public static SeriesKey of(Series series, Zone zone) {
        return new SeriesKey(series, zone, NO_MGA);
    }

    public static SeriesKey of(Series series, Zone zone, String mga) {
        return new SeriesKey(series, zone, mga);
    }

    /**
     * Normalizes an MGA filter: {@code null} and blank become {@link #NO_MGA}.
     *
     * @throws InvalidRangeException if the code is malformed or the series is not published per MGA
     */
    public static String requireValidMga(Series series, String mga) {
        if (mga == null || mga.isBlank()) {
            return NO_MGA;
        }
        String code = mga.trim();
        if (!series.hasMeteringGridAreas()) {
            throw new InvalidRangeException("Series " + series.slug() + " has no metering grid areas");
        }
        if (!MGA_CODE.matcher(code).matches()) {
            throw new InvalidRangeException("Invalid MGA code: " + mga);
        }
        return code;
    }

    public boolean hasMga() {
        return !mga.isEmpty();
    }

    /**
     * Numeric id used for database advisory locks. Distinct MGA codes may share an id.
     */
    public long lockId() {
        return ((long) mga.hashCode() << 32) | ((long) series.ordinal() << 16) | zone.ordinal();
    }

    @Override
    public String toString() {
        String base = series.slug() + "/" + zone.name();
        return hasMga() ? base + "/" + mga : base;
    }
}
