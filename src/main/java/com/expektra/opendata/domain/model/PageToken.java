package com.expektra.opendata.domain.model;

import com.expektra.opendata.domain.exception.InvalidRangeException;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Base64;

/**
 * Continuation cursor: the timestamp of the next row to return and how many rows at that timestamp
 * were already returned. Serialized as opaque URL-safe Base64.
 */
public record PageToken(Instant time, int ordinal) {

    public PageToken {
        if (ordinal < 0) {
            throw new InvalidRangeException("Page token ordinal must not be negative");
        }
    }

    public String encode() {
        String raw = time.getEpochSecond() + ":" + ordinal;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static PageToken decode(String token) {
        try {
            String raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
            int separator = raw.indexOf(':');
            if (separator < 1) {
                throw new InvalidRangeException("Malformed page token");
            }
            long epochSecond = Long.parseLong(raw.substring(0, separator));
            int ordinal = Integer.parseInt(raw.substring(separator + 1));
            return new PageToken(Instant.ofEpochSecond(epochSecond), ordinal);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new InvalidRangeException("Malformed page token", e);
        }
    }
}
