package com.expektra.opendata.domain.model;

import com.expektra.opendata.domain.exception.InvalidRangeException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open UTC time range {@code [start, end)}.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new InvalidRangeException("start " + start + " is after end " + end);
        }
    }

    public static TimeRange of(Instant start, Instant end) {
        return new TimeRange(start, end);
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant time) {
        return !time.isBefore(start) && time.isBefore(end);
    }

    public boolean encloses(TimeRange other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    /**
     * True when the two ranges share at least one instant.
     */
    public boolean intersects(TimeRange other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean adjacentTo(TimeRange other) {
        return end.equals(other.start) || other.end.equals(start);
    }

    public TimeRange intersection(TimeRange other) {
        Instant from = start.isAfter(other.start) ? start : other.start;
        Instant to = end.isBefore(other.end) ? end : other.end;
        return from.isBefore(to) ? new TimeRange(from, to) : new TimeRange(from, from);
    }

    public TimeRange span(TimeRange other) {
        Instant from = start.isBefore(other.start) ? start : other.start;
        Instant to = end.isAfter(other.end) ? end : other.end;
        return new TimeRange(from, to);
    }

    /**
     * Widens the range to whole buckets: start floored, end ceiled, both relative to the epoch.
     */
    public TimeRange alignOutward(Duration bucket) {
        return new TimeRange(floor(start, bucket), ceil(end, bucket));
    }

    public static boolean isAligned(Instant time, Duration bucket) {
        return floor(time, bucket).equals(time);
    }

    static Instant floor(Instant time, Duration bucket) {
        long bucketMillis = bucket.toMillis();
        long millis;
        try {
            millis = time.toEpochMilli();
        } catch (ArithmeticException e) {
            throw new InvalidRangeException("Time " + time + " is out of range", e);
        }
        return Instant.ofEpochMilli(Math.floorDiv(millis, bucketMillis) * bucketMillis);
    }

    static Instant ceil(Instant time, Duration bucket) {
        Instant floored = floor(time, bucket);
        if (floored.equals(time)) {
            return floored;
        }
        return floored.plus(bucket);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
