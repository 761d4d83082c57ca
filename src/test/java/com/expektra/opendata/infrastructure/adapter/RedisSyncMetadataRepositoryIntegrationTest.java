package com.expektra.opendata.infrastructure.adapter;

import com.expektra.opendata.domain.exception.ErrorKind;
import com.expektra.opendata.domain.model.Series;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.SyncRecord;
import com.expektra.opendata.domain.model.TimeRange;
import com.expektra.opendata.domain.model.Zone;
import com.expektra.opendata.infrastructure.config.MetadataProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class RedisSyncMetadataRepositoryIntegrationTest {

    @Container
    static final GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379)
            .withCommand("redis-server", "--appendonly", "no", "--save", "");

    private static final SeriesKey KEY = SeriesKey.of(Series.PRICES, Zone.DK1);
    private static final TimeRange RANGE = TimeRange.of(
            Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-02T00:00:00Z"));

    private StringRedisTemplate redisTemplate;
    private MetadataProperties properties;
    private RedisSyncMetadataRepository repository;

    @BeforeEach
    void setUp() {
        LettuceConnectionFactory connectionFactory = new LettuceConnectionFactory(
                redis.getHost(),
                redis.getMappedPort(6379)
        );
        connectionFactory.setDatabase(1);
        connectionFactory.afterPropertiesSet();

        redisTemplate = new StringRedisTemplate(connectionFactory);

        properties = new MetadataProperties();
        properties.setKeyPrefix("test:sync:");
        properties.setTtlHours(2);

        repository = new RedisSyncMetadataRepository(redisTemplate, properties);
        clearTestKeys();
    }

    @AfterEach
    void tearDown() {
        clearTestKeys();
    }

    private void clearTestKeys() {
        Set<String> keys = redisTemplate.keys("test:sync:*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
    }

    @Test
    void shouldStoreAndReadSuccess() {
        // Given
        SyncRecord record = SyncRecord.success(KEY, RANGE, 24, Instant.parse("2024-01-05T10:15:30Z"));

        // When
        repository.recordSuccess(record);

        // Then
        assertThat(repository.lastSync(KEY)).contains(record);
        Long ttl = redisTemplate.getExpire("test:sync:prices:DK1");
        assertThat(ttl).isPositive().isLessThanOrEqualTo(2 * 3600L);
    }

    @Test
    void shouldOverwriteWithLatestFailure() {
        repository.recordSuccess(SyncRecord.success(KEY, RANGE, 24, Instant.parse("2024-01-05T10:00:00Z")));
        SyncRecord failure = SyncRecord.failure(KEY, RANGE, ErrorKind.UPSTREAM_UNAVAILABLE,
                Instant.parse("2024-01-05T11:00:00Z"));

        repository.recordFailure(failure);

        Optional<SyncRecord> last = repository.lastSync(KEY);
        assertThat(last).contains(failure);
        assertThat(last.get().rowCount()).isZero();
    }

    @Test
    void shouldReturnEmptyForUnknownKey() {
        assertThat(repository.lastSync(SeriesKey.of(Series.LOAD_PROFILE, Zone.NO5))).isEmpty();
    }

    @Test
    void shouldKeepMeteringGridAreaUnderItsOwnKey() {
        SeriesKey zoneWide = SeriesKey.of(Series.LOAD_PROFILE, Zone.SE3);
        SeriesKey area = SeriesKey.of(Series.LOAD_PROFILE, Zone.SE3, "SE3-123");
        SyncRecord record = SyncRecord.success(area, RANGE, 96, Instant.parse("2024-01-05T10:00:00Z"));

        repository.recordSuccess(record);

        assertThat(redisTemplate.hasKey("test:sync:load-profile:SE3:SE3-123")).isTrue();
        assertThat(repository.lastSync(area)).contains(record);
        assertThat(repository.lastSync(zoneWide)).isEmpty();
    }
}
