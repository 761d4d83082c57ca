package com.expektra.opendata.infrastructure.adapter;

import com.expektra.opendata.domain.exception.ErrorKind;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.SyncRecord;
import com.expektra.opendata.domain.model.TimeRange;
import com.expektra.opendata.domain.port.out.SyncMetadataService;
import com.expektra.opendata.infrastructure.config.MetadataProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the outcome of the last fetch per series-key in a Redis hash.
 * Failures to reach Redis are logged and never propagated.
 */
@Repository
public class RedisSyncMetadataRepository implements SyncMetadataService {

    private static final Logger logger = LoggerFactory.getLogger(RedisSyncMetadataRepository.class);

    private static final String STATUS = "status";
    private static final String SYNCED_AT = "synced_at";
    private static final String RANGE_START = "range_start";
    private static final String RANGE_END = "range_end";
    private static final String ROW_COUNT = "row_count";
    private static final String ERROR_KIND = "error_kind";

    private final StringRedisTemplate redisTemplate;
    private final MetadataProperties properties;

    public RedisSyncMetadataRepository(StringRedisTemplate redisTemplate, MetadataProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    @Override
    public void recordSuccess(SyncRecord record) {
        store(record);
    }

    @Override
    public void recordFailure(SyncRecord record) {
        store(record);
    }

    @Override
    public Optional<SyncRecord> lastSync(SeriesKey key) {
        try {
            Map<Object, Object> hash = redisTemplate.opsForHash().entries(redisKey(key));
            if (hash.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(toRecord(key, hash));
        } catch (Exception e) {
            logger.error("Failed to get last sync of {}", key, e);
            return Optional.empty();
        }
    }

    private void store(SyncRecord record) {
        String key = redisKey(record.key());
        try {
            Map<String, String> hash = new HashMap<>();
            hash.put(STATUS, record.status().name());
            hash.put(SYNCED_AT, record.syncedAt().toString());
            hash.put(RANGE_START, record.range().start().toString());
            hash.put(RANGE_END, record.range().end().toString());
            hash.put(ROW_COUNT, Integer.toString(record.rowCount()));
            hash.put(ERROR_KIND, record.errorKind() != null ? record.errorKind().name() : "");

            redisTemplate.opsForHash().putAll(key, hash);
            redisTemplate.expire(key, properties.getTtlHours(), TimeUnit.HOURS);
            logger.debug("Updated sync metadata {}: {}", key, record.status());
        } catch (Exception e) {
            logger.error("Failed to update sync metadata {}", key, e);
        }
    }

    private static SyncRecord toRecord(SeriesKey key, Map<Object, Object> hash) {
        String errorKind = (String) hash.get(ERROR_KIND);
        return new SyncRecord(
                key,
                SyncRecord.Status.valueOf((String) hash.get(STATUS)),
                Instant.parse((String) hash.get(SYNCED_AT)),
                TimeRange.of(Instant.parse((String) hash.get(RANGE_START)), Instant.parse((String) hash.get(RANGE_END))),
                Integer.parseInt((String) hash.get(ROW_COUNT)),
                errorKind == null || errorKind.isEmpty() ? null : ErrorKind.valueOf(errorKind));
    }

    private String redisKey(SeriesKey key) {
        String redisKey = properties.getKeyPrefix() + key.series().slug() + ":" + key.zone().name();
        return key.hasMga() ? redisKey + ":" + key.mga() : redisKey;
    }
}
