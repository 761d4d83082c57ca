package com.expektra.opendata.application;

import com.expektra.opendata.domain.model.TimeRange;

import java.util.concurrent.CompletableFuture;

/**
 * A caller's stake in filling part of a gap.
 * The owner performs the fetch and resolves {@code completion}; a joiner only waits on it.
 *
 * @param range      the part of the caller's gap this claim covers
 * @param owner      whether the caller must run the fetch
 * @param completion completes normally once the range is committed, exceptionally if the fetch failed
 */
public record FetchClaim(TimeRange range, boolean owner, CompletableFuture<Void> completion) {

    static FetchClaim owner(TimeRange range, CompletableFuture<Void> completion) {
        return new FetchClaim(range, true, completion);
    }

    static FetchClaim join(TimeRange range, CompletableFuture<Void> completion) {
        return new FetchClaim(range, false, completion);
    }
}
