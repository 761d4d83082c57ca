package com.expektra.opendata.infrastructure.web;

import com.expektra.opendata.domain.exception.InvalidRangeException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parses query-string timestamps. Accepts ISO-8601 with an offset, naive date-times and plain dates;
 * anything without an offset is taken as UTC.
 */
final class TimestampParams {

    static final Instant EARLIEST = Instant.parse("0001-01-01T00:00:00Z");
    static final Instant LATEST = Instant.parse("9999-12-31T23:59:59Z");

    private TimestampParams() {
    }

    static Instant parse(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRangeException("Parameter '" + name + "' is required");
        }
        Instant instant = parseInstant(name, value.trim());
        if (instant.isBefore(EARLIEST) || instant.isAfter(LATEST)) {
            throw new InvalidRangeException("Timestamp for '" + name + "' is outside years 1-9999: " + value);
        }
        return instant;
    }

    private static Instant parseInstant(String name, String text) {
        try {
            if (!text.contains("T")) {
                return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidRangeException("Invalid timestamp for '" + name + "': " + text, e);
        }
    }
}
