package com.expektra.opendata.domain.model;

import com.expektra.opendata.domain.exception.ErrorKind;

import java.time.Instant;

/**
 * Outcome of the last upstream fetch for a series-key.
 *
 * @param errorKind failure kind, {@code null} on success
 */
public record SyncRecord(
        SeriesKey key,
        Status status,
        Instant syncedAt,
        TimeRange range,
        int rowCount,
        ErrorKind errorKind
) {
    public enum Status { SUCCESS, FAILURE }

    public static SyncRecord success(SeriesKey key, TimeRange range, int rowCount, Instant syncedAt) {
        return new SyncRecord(key, Status.SUCCESS, syncedAt, range, rowCount, null);
    }

    public static SyncRecord failure(SeriesKey key, TimeRange range, ErrorKind errorKind, Instant syncedAt) {
        return new SyncRecord(key, Status.FAILURE, syncedAt, range, 0, errorKind);
    }
}
