package com.expektra.opendata.application;

import com.expektra.opendata.domain.interval.IntervalSet;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry of in-flight upstream fetches per series-key.
 * Guarantees that no two fetches for overlapping ranges of the same key run at once: a caller whose
 * gap overlaps a registered fetch joins it, and only the uncovered remainder is handed out for fetching.
 */
@Component
public class FetchCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(FetchCoordinator.class);

    private final Map<SeriesKey, KeyState> states = new ConcurrentHashMap<>();

    /**
     * Split {@code gap} into claims ordered by start time. Parts already being fetched become join claims,
     * the rest become owner claims which the caller must fetch and then {@link #resolve}.
     */
    public List<FetchClaim> acquireOrJoin(SeriesKey key, TimeRange gap) {
        if (gap.isEmpty()) {
            return List.of();
        }

        List<FetchClaim> claims = new ArrayList<>();

        states.compute(key, (k, existing) -> {
            KeyState state = existing != null ? existing : new KeyState();
            synchronized (state) {
                IntervalSet pending = new IntervalSet();
                for (InFlight fetch : state.inFlight) {
                    if (fetch.range.intersects(gap)) {
                        // copy so that a waiter giving up never cancels the owner's future
                        claims.add(FetchClaim.join(fetch.range.intersection(gap), fetch.completion.copy()));
                        pending.add(fetch.range);
                    }
                }
                for (TimeRange remainder : pending.gaps(gap)) {
                    InFlight fetch = new InFlight(remainder, new CompletableFuture<>());
                    state.inFlight.add(fetch);
                    claims.add(FetchClaim.owner(remainder, fetch.completion));
                }
            }
            return state;
        });

        claims.sort(Comparator.comparing(claim -> claim.range().start()));
        logger.debug("Claims for {} {}: {}", key, gap, claims.size());
        return claims;
    }

    /**
     * Complete the fetch registered for exactly {@code range} and release it.
     *
     * @param failure the failure to hand to every waiter, or {@code null} on success
     */
    public void resolve(SeriesKey key, TimeRange range, Throwable failure) {
        AtomicReference<InFlight> match = new AtomicReference<>();
        states.computeIfPresent(key, (k, state) -> {
            synchronized (state) {
                Iterator<InFlight> it = state.inFlight.iterator();
                while (it.hasNext()) {
                    InFlight fetch = it.next();
                    if (fetch.range.equals(range)) {
                        it.remove();
                        match.set(fetch);
                        break;
                    }
                }
                // idle keys are dropped
                return state.inFlight.isEmpty() ? null : state;
            }
        });

        InFlight resolved = match.get();
        if (resolved == null) {
            logger.warn("No in-flight fetch {} for {}", range, key);
            return;
        }
        if (failure == null) {
            resolved.completion.complete(null);
        } else {
            resolved.completion.completeExceptionally(failure);
        }
    }

    public int inFlightCount() {
        int count = 0;
        for (KeyState state : states.values()) {
            synchronized (state) {
                count += state.inFlight.size();
            }
        }
        return count;
    }

    int trackedKeys() {
        return states.size();
    }

    private static final class KeyState {
        private final List<InFlight> inFlight = new ArrayList<>();
    }

    private record InFlight(TimeRange range, CompletableFuture<Void> completion) {
    }
}
