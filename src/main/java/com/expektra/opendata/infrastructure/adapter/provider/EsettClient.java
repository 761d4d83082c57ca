package com.expektra.opendata.infrastructure.adapter.provider;

import com.expektra.opendata.domain.exception.DecodeException;
import com.expektra.opendata.domain.exception.UpstreamRejectedException;
import com.expektra.opendata.domain.exception.UpstreamUnavailableException;
import com.expektra.opendata.domain.model.Row;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.TimeRange;
import com.expektra.opendata.domain.port.out.UpstreamProvider;
import com.expektra.opendata.infrastructure.adapter.mapper.RowCodec;
import com.expektra.opendata.infrastructure.config.EsettProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import retrofit2.Call;
import retrofit2.Response;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link UpstreamProvider} backed by the eSett Open Data API.
 * A range is fetched as a sequence of windowed pages; every page is retried on transient failures
 * and guarded by a circuit breaker, and the whole fetch runs against a deadline.
 */
@Component
public class EsettClient implements UpstreamProvider {

    private static final Logger logger = LoggerFactory.getLogger(EsettClient.class);

    public static final String RESILIENCE_INSTANCE = "esett";

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.000'Z'").withZone(ZoneOffset.UTC);

    private final EsettApi esettApi;
    private final RowCodec rowCodec;
    private final EsettProperties properties;
    private final Retry retry;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    public EsettClient(EsettApi esettApi,
                       RowCodec rowCodec,
                       EsettProperties properties,
                       RetryRegistry retryRegistry,
                       CircuitBreakerRegistry circuitBreakerRegistry,
                       Clock clock) {
        this.esettApi = esettApi;
        this.rowCodec = rowCodec;
        this.properties = properties;
        this.retry = retryRegistry.retry(RESILIENCE_INSTANCE);
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(RESILIENCE_INSTANCE);
        this.clock = clock;
    }

    @Override
    public List<Row> fetchRows(SeriesKey key, TimeRange range) {
        logger.info("Fetching {} {} from eSett", key, range);

        List<Row> rows = new ArrayList<>();
        int pageCount = 0;
        for (UpstreamPage page : fetchPageSequence(key, range)) {
            // only rows of the requested window
            rowCodec.decodeAll(key.series(), key.zone(), page.records()).stream()
                    .filter(row -> page.window().contains(row.time()))
                    .forEach(rows::add);
            pageCount++;
        }

        logger.info("Fetched {} rows of {} {} in {} page(s)", rows.size(), key, range, pageCount);
        return rows;
    }

    /**
     * Lazy page sequence over {@code range}. The fetch deadline starts when the sequence is created.
     */
    public UpstreamPageSequence fetchPageSequence(SeriesKey key, TimeRange range) {
        Instant deadline = clock.instant().plus(properties.getFetchTimeout());
        return new UpstreamPageSequence(range, properties.getMaxWindow(),
                window -> fetchPageGuarded(key, window, deadline));
    }

    private UpstreamPage fetchPageGuarded(SeriesKey key, TimeRange window, Instant deadline) {
        Supplier<UpstreamPage> attempt = () -> {
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw deadlineExceeded(key, window, null);
            }
            return fetchPage(key, window, remaining, deadline);
        };

        Supplier<UpstreamPage> guarded = Retry.decorateSupplier(retry,
                CircuitBreaker.decorateSupplier(circuitBreaker, attempt));
        try {
            return guarded.get();
        } catch (CallNotPermittedException e) {
            logger.warn("Circuit open for eSett, not fetching {} {}", key, window);
            throw new UpstreamUnavailableException("eSett circuit breaker is open", e);
        }
    }

    /**
     * One upstream request, cut off once {@code remaining} runs out even if the call timeout is longer.
     */
    UpstreamPage fetchPage(SeriesKey key, TimeRange window, Duration remaining, Instant deadline) {
        String start = TIMESTAMP_FORMAT.format(window.start());
        String end = TIMESTAMP_FORMAT.format(window.end());
        Call<JsonNode> call = callFor(key, start, end);
        // okio reads zero as no timeout
        call.timeout().timeout(Math.max(attemptTimeout(remaining).toMillis(), 1), TimeUnit.MILLISECONDS);

        Response<JsonNode> response;
        try {
            logger.debug("GET {} {} {}..{}", key.series().slug(), key.zone(), start, end);
            response = call.execute();
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed eSett response for " + key + " " + window, e);
        } catch (IOException e) {
            if (!clock.instant().isBefore(deadline)) {
                throw deadlineExceeded(key, window, e);
            }
            throw new UpstreamUnavailableException("I/O error fetching " + key + " " + window + ": " + e.getMessage(), e);
        }

        int status = response.code();
        if (status == 204) {
            return new UpstreamPage(window, List.of());
        }
        if (status == 429 || status >= 500) {
            throw new UpstreamUnavailableException("eSett answered " + status + " for " + key + " " + window);
        }
        if (!response.isSuccessful()) {
            throw new UpstreamRejectedException("eSett rejected " + key + " " + window + " with " + status, status);
        }

        JsonNode body = response.body();
        if (body == null || body.isNull()) {
            return new UpstreamPage(window, List.of());
        }
        if (!body.isArray()) {
            throw new DecodeException("Expected a JSON array from eSett for " + key + " " + window
                    + " but got " + body.getNodeType());
        }

        List<JsonNode> records = new ArrayList<>(body.size());
        body.forEach(records::add);
        return new UpstreamPage(window, records);
    }

    private Duration attemptTimeout(Duration remaining) {
        Duration callTimeout = properties.getCallTimeout();
        if (callTimeout.isZero() || remaining.compareTo(callTimeout) < 0) {
            return remaining;
        }
        return callTimeout;
    }

    private FetchDeadlineExceededException deadlineExceeded(SeriesKey key, TimeRange window, Throwable cause) {
        return new FetchDeadlineExceededException(
                "Fetch of " + key + " exceeded " + properties.getFetchTimeout() + " at window " + window, cause);
    }

    private Call<JsonNode> callFor(SeriesKey key, String start, String end) {
        String mba = key.zone().eicCode();
        return switch (key.series()) {
            case PRODUCTION -> esettApi.production(start, end, mba);
            case CONSUMPTION -> esettApi.consumption(start, end, mba);
            case PRICES -> esettApi.prices(start, end, mba);
            case LOAD_PROFILE -> esettApi.loadProfile(start, end, mba, key.hasMga() ? key.mga() : null);
        };
    }
}
