package com.expektra.opendata.application;

import com.expektra.opendata.domain.exception.EnergyDataException;
import com.expektra.opendata.domain.exception.InvalidRangeException;
import com.expektra.opendata.domain.exception.StoreException;
import com.expektra.opendata.domain.exception.UpstreamUnavailableException;
import com.expektra.opendata.domain.model.PageToken;
import com.expektra.opendata.domain.model.Row;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.SeriesPage;
import com.expektra.opendata.domain.model.SeriesQuery;
import com.expektra.opendata.domain.model.SyncRecord;
import com.expektra.opendata.domain.model.TimeRange;
import com.expektra.opendata.domain.port.out.IntervalStore;
import com.expektra.opendata.domain.port.out.SyncMetadataService;
import com.expektra.opendata.domain.port.out.TimeSeriesStore;
import com.expektra.opendata.domain.port.out.UpstreamProvider;
import com.expektra.opendata.infrastructure.config.SyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read-through cache in front of the upstream provider.
 * A query is served from the store once every aligned part of its range is cached; missing parts are
 * fetched first, with concurrent queries for the same key sharing fetches through {@link FetchCoordinator}.
 */
@Service
public class CacheSynchronizer implements QuerySeries {

    private static final Logger logger = LoggerFactory.getLogger(CacheSynchronizer.class);

    private final UpstreamProvider upstreamProvider;
    private final TimeSeriesStore timeSeriesStore;
    private final IntervalStore intervalStore;
    private final GapWriter gapWriter;
    private final FetchCoordinator coordinator;
    private final SyncMetadataService syncMetadata;
    private final SyncProperties properties;
    private final Executor fetchExecutor;
    private final Clock clock;

    private final AtomicLong queries = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong ownedFetches = new AtomicLong();
    private final AtomicLong joinedFetches = new AtomicLong();
    private final AtomicLong fetchFailures = new AtomicLong();

    public CacheSynchronizer(UpstreamProvider upstreamProvider,
                             TimeSeriesStore timeSeriesStore,
                             IntervalStore intervalStore,
                             GapWriter gapWriter,
                             FetchCoordinator coordinator,
                             SyncMetadataService syncMetadata,
                             SyncProperties properties,
                             @Qualifier("fetchExecutor") Executor fetchExecutor,
                             Clock clock) {
        this.upstreamProvider = upstreamProvider;
        this.timeSeriesStore = timeSeriesStore;
        this.intervalStore = intervalStore;
        this.gapWriter = gapWriter;
        this.coordinator = coordinator;
        this.syncMetadata = syncMetadata;
        this.properties = properties;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
    }

    @Override
    public SeriesPage execute(SeriesQuery query) {
        queries.incrementAndGet();
        validate(query);

        if (query.range().isEmpty()) {
            cacheHits.incrementAndGet();
            return SeriesPage.empty();
        }

        SeriesKey key = query.key();
        TimeRange aligned = query.range().alignOutward(key.series().granularity());
        PageToken cursor = query.pageToken() != null ? PageToken.decode(query.pageToken()) : null;
        if (cursor != null && (!aligned.contains(cursor.time())
                || !TimeRange.isAligned(cursor.time(), key.series().granularity()))) {
            throw new InvalidRangeException("Page token does not belong to range " + query.range());
        }

        List<TimeRange> gaps = intervalStore.gaps(key, aligned);
        boolean cached = gaps.isEmpty();
        if (cached) {
            cacheHits.incrementAndGet();
            logger.debug("Cache hit for {} {}", key, aligned);
        } else {
            logger.info("Filling {} gap(s) of {} {}", gaps.size(), key, aligned);
            fill(key, gaps);
        }

        return readPage(key, aligned, cursor, query.pageSize(), cached);
    }

    public SyncStats stats() {
        return new SyncStats(queries.get(), cacheHits.get(), ownedFetches.get(),
                joinedFetches.get(), fetchFailures.get(), coordinator.inFlightCount());
    }

    private void validate(SeriesQuery query) {
        int pageSize = query.pageSize();
        if (pageSize < 1 || pageSize > properties.getMaxPageSize()) {
            throw new InvalidRangeException(
                    "page_size must be between 1 and " + properties.getMaxPageSize() + ", got " + pageSize);
        }
    }

    private void fill(SeriesKey key, List<TimeRange> gaps) {
        List<FetchClaim> claims = new ArrayList<>();
        for (TimeRange gap : gaps) {
            claims.addAll(coordinator.acquireOrJoin(key, gap));
        }

        for (FetchClaim claim : claims) {
            if (claim.owner()) {
                ownedFetches.incrementAndGet();
                submit(key, claim.range());
            } else {
                joinedFetches.incrementAndGet();
                logger.debug("Joining in-flight fetch of {} {}", key, claim.range());
            }
        }

        awaitAll(key, claims);
    }

    private void submit(SeriesKey key, TimeRange range) {
        try {
            fetchExecutor.execute(() -> runOwnedFetch(key, range));
        } catch (RejectedExecutionException e) {
            logger.error("Fetch executor rejected fetch of {} {}", key, range);
            fetchFailures.incrementAndGet();
            coordinator.resolve(key, range, new UpstreamUnavailableException("Fetch capacity exhausted", e));
        }
    }

    private void runOwnedFetch(SeriesKey key, TimeRange range) {
        EnergyDataException failure = null;
        try {
            if (intervalStore.gaps(key, range).isEmpty()) {
                // committed by a fetch that finished between the gap lookup and the claim
                logger.debug("Range {} of {} already cached, skipping fetch", range, key);
                return;
            }

            List<Row> rows = upstreamProvider.fetchRows(key, range).stream()
                    .filter(row -> row.belongsTo(key) && range.contains(row.time()))
                    .toList();
            int written = gapWriter.commit(key, range, rows);

            logger.info("Cached {} rows of {} {}", written, key, range);
            recordSuccess(key, range, rows.size());
        } catch (EnergyDataException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new StoreException("Failed to cache " + key + " " + range, e);
        } catch (Error e) {
            failure = new UpstreamUnavailableException("Fetch of " + key + " " + range + " aborted", e);
            throw e;
        } finally {
            if (failure != null) {
                fetchFailures.incrementAndGet();
                logger.error("Fetch of {} {} failed: {}", key, range, failure.getMessage());
                recordFailure(key, range, failure);
            }
            coordinator.resolve(key, range, failure);
        }
    }

    private void recordSuccess(SeriesKey key, TimeRange range, int rowCount) {
        try {
            syncMetadata.recordSuccess(SyncRecord.success(key, range, rowCount, clock.instant()));
        } catch (RuntimeException e) {
            logger.warn("Could not record sync of {}: {}", key, e.getMessage());
        }
    }

    private void recordFailure(SeriesKey key, TimeRange range, EnergyDataException failure) {
        try {
            syncMetadata.recordFailure(SyncRecord.failure(key, range, failure.kind(), clock.instant()));
        } catch (RuntimeException e) {
            logger.warn("Could not record failed sync of {}: {}", key, e.getMessage());
        }
    }

    private void awaitAll(SeriesKey key, List<FetchClaim> claims) {
        long deadline = System.nanoTime() + properties.getWaitTimeout().toNanos();

        for (FetchClaim claim : claims) {
            long remaining = deadline - System.nanoTime();
            try {
                claim.completion().get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
            } catch (ExecutionException e) {
                throw unwrap(key, claim.range(), e.getCause());
            } catch (TimeoutException e) {
                throw new UpstreamUnavailableException("Timed out waiting for " + key + " " + claim.range()
                        + " after " + format(properties.getWaitTimeout()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamUnavailableException("Interrupted waiting for " + key + " " + claim.range(), e);
            }
        }
    }

    private static EnergyDataException unwrap(SeriesKey key, TimeRange range, Throwable cause) {
        if (cause instanceof EnergyDataException energyDataException) {
            return energyDataException;
        }
        return new UpstreamUnavailableException("Fetch of " + key + " " + range + " failed", cause);
    }

    private SeriesPage readPage(SeriesKey key, TimeRange aligned, PageToken cursor, int pageSize, boolean cached) {
        TimeRange window = cursor != null ? TimeRange.of(cursor.time(), aligned.end()) : aligned;
        int skip = cursor != null ? cursor.ordinal() : 0;
        if (skip > 0) {
            // at most one row per bucket, so only the rows at the cursor bucket may be skipped
            long atCursor = timeSeriesStore.count(key,
                    TimeRange.of(cursor.time(), cursor.time().plus(key.series().granularity())));
            if (skip > atCursor) {
                throw new InvalidRangeException("Page token does not belong to range " + aligned);
            }
        }

        int limit = (int) Math.min((long) skip + pageSize + 1, Integer.MAX_VALUE);
        List<Row> rows = timeSeriesStore.readRange(key, window, limit);
        long total = timeSeriesStore.count(key, aligned);

        if (rows.size() <= skip) {
            return new SeriesPage(List.of(), null, total, cached);
        }

        int to = Math.min(rows.size(), skip + pageSize);
        List<Row> page = rows.subList(skip, to);

        String nextToken = null;
        if (rows.size() > to) {
            Row next = rows.get(to);
            int ordinal = 0;
            for (int i = to - 1; i >= 0 && rows.get(i).time().equals(next.time()); i--) {
                ordinal++;
            }
            nextToken = new PageToken(next.time(), ordinal).encode();
        }

        return new SeriesPage(page, nextToken, total, cached);
    }

    private static String format(Duration duration) {
        return duration.toMillis() + "ms";
    }
}
