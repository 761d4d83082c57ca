package com.expektra.opendata.infrastructure.adapter.provider;

import com.expektra.opendata.domain.exception.DecodeException;
import com.expektra.opendata.domain.exception.UpstreamRejectedException;
import com.expektra.opendata.domain.exception.UpstreamUnavailableException;
import com.expektra.opendata.domain.model.Series;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.TimeRange;
import com.expektra.opendata.domain.model.Zone;
import com.expektra.opendata.infrastructure.adapter.mapper.RowCodec;
import com.expektra.opendata.infrastructure.config.EsettClientConfig;
import com.expektra.opendata.infrastructure.config.EsettProperties;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.springboot3.circuitbreaker.autoconfigure.CircuitBreakerAutoConfiguration;
import io.github.resilience4j.springboot3.retry.autoconfigure.RetryAutoConfiguration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;
import java.time.Instant;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the client against the {@code esett} retry and circuit breaker instances as configured in application.yml.
 */
@SpringBootTest(
        classes = {EsettClient.class, EsettClientConfig.class, EsettProperties.class, RowCodec.class},
        webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ImportAutoConfiguration({
        ConfigurationPropertiesAutoConfiguration.class,
        RetryAutoConfiguration.class,
        CircuitBreakerAutoConfiguration.class
})
@TestPropertySource(properties = "resilience4j.retry.instances.esett.wait-duration=10ms")
class EsettResilienceConfigurationTest {

    private static final SeriesKey SE3_PRODUCTION = SeriesKey.of(Series.PRODUCTION, Zone.SE3);
    private static final Instant JAN_1 = Instant.parse("2024-01-01T00:00:00Z");
    private static final TimeRange TWO_HOURS = TimeRange.of(JAN_1, JAN_1.plus(Duration.ofHours(2)));
    private static final String VOLUMES = "/EXP16/Volumes";

    private static final WireMockServer wireMockServer = startWireMock();

    @Autowired
    private EsettClient esettClient;

    @Autowired
    private RetryRegistry retryRegistry;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    private static WireMockServer startWireMock() {
        WireMockServer server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        return server;
    }

    @DynamicPropertySource
    static void esettProperties(DynamicPropertyRegistry registry) {
        registry.add("expektra.esett.base-url", () -> wireMockServer.baseUrl() + "/");
    }

    @AfterAll
    static void stopWireMock() {
        wireMockServer.stop();
    }

    @BeforeEach
    void setUp() {
        wireMockServer.resetAll();
        circuitBreakerRegistry.circuitBreaker(EsettClient.RESILIENCE_INSTANCE).reset();
    }

    @Test
    void shouldRetryOnlyTransientFailures() {
        RetryConfig config = retryRegistry.retry(EsettClient.RESILIENCE_INSTANCE).getRetryConfig();

        assertThat(config.getMaxAttempts()).isEqualTo(4);
        assertThat(config.getExceptionPredicate().test(new UpstreamUnavailableException("503"))).isTrue();
        assertThat(config.getExceptionPredicate().test(new UpstreamRejectedException("400", 400))).isFalse();
        assertThat(config.getExceptionPredicate().test(new DecodeException("bad json"))).isFalse();
        assertThat(config.getExceptionPredicate().test(new FetchDeadlineExceededException("late"))).isFalse();
        assertThat(config.getExceptionPredicate().test(
                CallNotPermittedException.createCallNotPermittedException(
                        circuitBreakerRegistry.circuitBreaker(EsettClient.RESILIENCE_INSTANCE)))).isFalse();
    }

    @Test
    void shouldCountOnlyUnavailabilityAgainstTheCircuit() {
        CircuitBreakerConfig config = circuitBreakerRegistry.circuitBreaker(EsettClient.RESILIENCE_INSTANCE)
                .getCircuitBreakerConfig();

        assertThat(config.getSlidingWindowSize()).isEqualTo(20);
        assertThat(config.getMinimumNumberOfCalls()).isEqualTo(10);
        assertThat(config.getFailureRateThreshold()).isEqualTo(50f);
        assertThat(config.getRecordExceptionPredicate().test(new UpstreamUnavailableException("503"))).isTrue();
        assertThat(config.getIgnoreExceptionPredicate().test(new UpstreamRejectedException("404", 404))).isTrue();
        assertThat(config.getIgnoreExceptionPredicate().test(new DecodeException("bad json"))).isTrue();
        assertThat(config.getIgnoreExceptionPredicate().test(new FetchDeadlineExceededException("late"))).isTrue();
    }

    @Test
    void shouldGiveUpAfterConfiguredAttempts() {
        wireMockServer.stubFor(get(urlPathEqualTo(VOLUMES)).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> esettClient.fetchRows(SE3_PRODUCTION, TWO_HOURS))
                .isInstanceOf(UpstreamUnavailableException.class);

        wireMockServer.verify(4, getRequestedFor(urlPathEqualTo(VOLUMES)));
        CircuitBreaker.Metrics metrics = circuitBreakerRegistry.circuitBreaker(EsettClient.RESILIENCE_INSTANCE)
                .getMetrics();
        assertThat(metrics.getNumberOfFailedCalls()).isEqualTo(4);
    }

    @Test
    void shouldNotRetryOrRecordRejections() {
        wireMockServer.stubFor(get(urlPathEqualTo(VOLUMES)).willReturn(aResponse().withStatus(400)));

        assertThatThrownBy(() -> esettClient.fetchRows(SE3_PRODUCTION, TWO_HOURS))
                .isInstanceOf(UpstreamRejectedException.class);

        wireMockServer.verify(1, getRequestedFor(urlPathEqualTo(VOLUMES)));
        assertThat(circuitBreakerRegistry.circuitBreaker(EsettClient.RESILIENCE_INSTANCE)
                .getMetrics().getNumberOfFailedCalls()).isZero();
    }
}
