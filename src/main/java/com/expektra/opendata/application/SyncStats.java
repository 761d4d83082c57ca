package com.expektra.opendata.application;

/**
 * Counters of the cache synchronizer since startup.
 */
public record SyncStats(
        long queries,
        long cacheHits,
        long ownedFetches,
        long joinedFetches,
        long fetchFailures,
        int inFlightFetches
) {
    public double hitRatio() {
        return queries > 0 ? (double) cacheHits / queries : 0.0;
    }

    public String summary() {
        return String.format("Hit ratio: %.1f%%, fetches: %d owned / %d joined, failures: %d",
                hitRatio() * 100, ownedFetches, joinedFetches, fetchFailures);
    }
}
