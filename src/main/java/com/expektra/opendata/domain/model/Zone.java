package com.expektra.opendata.domain.model;

import com.expektra.opendata.domain.exception.InvalidRangeException;

import java.util.Arrays;

/**
 * Nordic market balance areas (MBA) published by eSett, with the EIC code upstream expects.
 */
public enum Zone {

    SE1("10Y1001A1001A44P"),
    SE2("10Y1001A1001A45N"),
    SE3("10Y1001A1001A46L"),
    SE4("10Y1001A1001A47J"),
    FI("10YFI-1--------U"),
    NO1("10YNO-1--------2"),
    NO2("10YNO-2--------T"),
    NO3("10YNO-3--------J"),
    NO4("10YNO-4--------9"),
    NO5("10Y1001A1001A48H"),
    DK1("10YDK-1--------W"),
    DK2("10YDK-2--------M");

    private final String eicCode;

    Zone(String eicCode) {
        this.eicCode = eicCode;
    }

    public String eicCode() {
        return eicCode;
    }

    public static Zone parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRangeException("Zone is required");
        }
        return Arrays.stream(values())
                .filter(zone -> zone.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new InvalidRangeException("Unknown MBA: " + value));
    }
}
