package com.expektra.opendata.infrastructure.persistence;

import com.expektra.opendata.domain.exception.StoreException;
import com.expektra.opendata.domain.interval.IntervalSet;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.TimeRange;
import com.expektra.opendata.domain.port.out.IntervalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Cached intervals in the {@code cached_interval} table.
 * Rows of one key are kept disjoint and non-adjacent: {@link #markCovered} replaces every range it touches
 * with their union, serialized per key by a transaction-scoped advisory lock.
 */
@Repository
public class JdbcIntervalStore implements IntervalStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcIntervalStore.class);

    private static final RowMapper<TimeRange> RANGE_MAPPER = (rs, rowNum) -> TimeRange.of(
            rs.getObject("range_start", OffsetDateTime.class).toInstant(),
            rs.getObject("range_end", OffsetDateTime.class).toInstant());

    private final JdbcTemplate jdbcTemplate;

    public JdbcIntervalStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<TimeRange> covered(SeriesKey key) {
        String sql = """
            SELECT range_start, range_end
            FROM cached_interval
            WHERE series = ? AND mba = ? AND mga_code = ?
            ORDER BY range_start
            """;
        try {
            return jdbcTemplate.query(sql, RANGE_MAPPER, key.series().name(), key.zone().name(), key.mga());
        } catch (DataAccessException e) {
            logger.error("Database error loading intervals of {}", key, e);
            throw new StoreException("Failed to load cached intervals of " + key, e);
        }
    }

    @Override
    public List<TimeRange> gaps(SeriesKey key, TimeRange requested) {
        if (requested.isEmpty()) {
            return List.of();
        }
        String sql = """
            SELECT range_start, range_end
            FROM cached_interval
            WHERE series = ? AND mba = ? AND mga_code = ?
              AND range_start < ? AND range_end > ?
            ORDER BY range_start
            """;
        try {
            List<TimeRange> overlapping = jdbcTemplate.query(sql, RANGE_MAPPER,
                    key.series().name(), key.zone().name(), key.mga(), utc(requested.end()), utc(requested.start()));
            return IntervalSet.of(overlapping).gaps(requested);
        } catch (DataAccessException e) {
            logger.error("Database error computing gaps of {} {}", key, requested, e);
            throw new StoreException("Failed to compute gaps of " + key, e);
        }
    }

    @Override
    @Transactional
    public void markCovered(SeriesKey key, TimeRange range) {
        if (range.isEmpty()) {
            return;
        }

        String touching = """
            SELECT range_start, range_end
            FROM cached_interval
            WHERE series = ? AND mba = ? AND mga_code = ?
              AND range_start <= ? AND range_end >= ?
            """;
        String delete = """
            DELETE FROM cached_interval
            WHERE series = ? AND mba = ? AND mga_code = ?
              AND range_start <= ? AND range_end >= ?
            """;
        String insert = """
            INSERT INTO cached_interval (series, mba, mga_code, range_start, range_end, updated_at)
            VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
            """;

        String series = key.series().name();
        String mba = key.zone().name();
        String mga = key.mga();
        try {
            jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", rs -> null, key.lockId());

            TimeRange merged = range;
            for (TimeRange existing : jdbcTemplate.query(touching, RANGE_MAPPER,
                    series, mba, mga, utc(range.end()), utc(range.start()))) {
                merged = merged.span(existing);
            }

            jdbcTemplate.update(delete, series, mba, mga, utc(range.end()), utc(range.start()));
            jdbcTemplate.update(insert, series, mba, mga, utc(merged.start()), utc(merged.end()));
            logger.debug("Marked {} {} covered, stored as {}", key, range, merged);
        } catch (DataAccessException e) {
            logger.error("Database error marking {} {} covered", key, range, e);
            throw new StoreException("Failed to record cached interval of " + key, e);
        }
    }

    private static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
