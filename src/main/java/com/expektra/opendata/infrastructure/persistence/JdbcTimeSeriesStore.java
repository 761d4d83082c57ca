package com.expektra.opendata.infrastructure.persistence;

import com.expektra.opendata.domain.exception.StoreException;
import com.expektra.opendata.domain.model.Row;
import com.expektra.opendata.domain.model.Series;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.TimeRange;
import com.expektra.opendata.domain.model.Zone;
import com.expektra.opendata.domain.port.out.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * PostgreSQL implementation of TimeSeriesStore.
 * One table per series, primary key {@code (time, mba)}, extended by {@code mga_code} for series published per
 * metering grid area; every schema field is a nullable double column.
 */
@Repository
public class JdbcTimeSeriesStore implements TimeSeriesStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcTimeSeriesStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final Map<Series, String> upsertSql = new EnumMap<>(Series.class);

    public JdbcTimeSeriesStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        for (Series series : Series.values()) {
            upsertSql.put(series, buildUpsert(series));
        }
    }

    @Override
    @Transactional
    public int upsert(List<Row> rows) {
        if (rows.isEmpty()) {
            logger.debug("No rows to upsert");
            return 0;
        }

        Map<Series, List<Row>> bySeries = rows.stream()
                .collect(Collectors.groupingBy(Row::series, LinkedHashMap::new, Collectors.toList()));

        try {
            int written = 0;
            for (Map.Entry<Series, List<Row>> entry : bySeries.entrySet()) {
                written += upsertSeries(entry.getKey(), entry.getValue());
            }
            logger.debug("Upserted {} rows", written);
            return written;
        } catch (DataAccessException e) {
            logger.error("Error upserting {} rows", rows.size(), e);
            throw new StoreException("Failed to upsert rows", e);
        }
    }

    private int upsertSeries(Series series, List<Row> rows) {
        List<String> fields = series.fieldNames();
        jdbcTemplate.batchUpdate(upsertSql.get(series), new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                Row row = rows.get(i);
                ps.setObject(1, OffsetDateTime.ofInstant(row.time(), ZoneOffset.UTC));
                ps.setString(2, row.zone().name());
                int index = 3;
                if (series.hasMeteringGridAreas()) {
                    ps.setString(index++, row.mgaCode());
                    if (row.mgaName() == null) {
                        ps.setNull(index++, Types.VARCHAR);
                    } else {
                        ps.setString(index++, row.mgaName());
                    }
                }
                for (String field : fields) {
                    Double value = row.value(field);
                    if (value == null) {
                        ps.setNull(index++, Types.DOUBLE);
                    } else {
                        ps.setObject(index++, value, Types.DOUBLE);
                    }
                }
            }

            @Override
            public int getBatchSize() {
                return rows.size();
            }
        });
        return rows.size();
    }

    @Override
    public List<Row> readRange(SeriesKey key, TimeRange range) {
        return query(key, range, null);
    }

    @Override
    public List<Row> readRange(SeriesKey key, TimeRange range, int limit) {
        return query(key, range, limit);
    }

    @Override
    public long count(SeriesKey key, TimeRange range) {
        String sql = "SELECT COUNT(*) FROM " + key.series().table() + whereKeyAndRange(key.series());
        try {
            Long count = jdbcTemplate.queryForObject(sql, Long.class, keyAndRangeArgs(key, range));
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            logger.error("Database error counting {} {}", key, range, e);
            throw new StoreException("Failed to count rows of " + key, e);
        }
    }

    private List<Row> query(SeriesKey key, TimeRange range, Integer limit) {
        Series series = key.series();
        String sql = "SELECT " + String.join(", ", columns(series))
                + " FROM " + series.table()
                + whereKeyAndRange(series)
                + " ORDER BY time"
                + (limit != null ? " LIMIT " + limit : "");

        try {
            return jdbcTemplate.query(sql, rowMapper(series), keyAndRangeArgs(key, range));
        } catch (DataAccessException e) {
            logger.error("Database error reading {} {}", key, range, e);
            throw new StoreException("Failed to read rows of " + key, e);
        }
    }

    private static RowMapper<Row> rowMapper(Series series) {
        List<String> fields = series.fieldNames();
        return (rs, rowNum) -> {
            Map<String, Double> values = new LinkedHashMap<>();
            for (String field : fields) {
                values.put(field, rs.getObject(field, Double.class));
            }
            Zone zone = Zone.valueOf(rs.getString("mba"));
            Instant time = rs.getObject("time", OffsetDateTime.class).toInstant();
            if (!series.hasMeteringGridAreas()) {
                return new Row(series, zone, time, values);
            }
            return new Row(series, zone, rs.getString("mga_code"), rs.getString("mga_name"), time, values);
        };
    }

    private static List<String> columns(Series series) {
        List<String> columns = new ArrayList<>(List.of("time", "mba"));
        if (series.hasMeteringGridAreas()) {
            columns.add("mga_code");
            columns.add("mga_name");
        }
        columns.addAll(series.fieldNames());
        return columns;
    }

    private static String whereKeyAndRange(Series series) {
        return series.hasMeteringGridAreas()
                ? " WHERE mba = ? AND mga_code = ? AND time >= ? AND time < ?"
                : " WHERE mba = ? AND time >= ? AND time < ?";
    }

    private static Object[] keyAndRangeArgs(SeriesKey key, TimeRange range) {
        if (key.series().hasMeteringGridAreas()) {
            return new Object[]{key.zone().name(), key.mga(), utc(range.start()), utc(range.end())};
        }
        return new Object[]{key.zone().name(), utc(range.start()), utc(range.end())};
    }

    private static String buildUpsert(Series series) {
        List<String> columns = columns(series);
        List<String> updates = new ArrayList<>();
        for (String column : columns.subList(series.hasMeteringGridAreas() ? 3 : 2, columns.size())) {
            updates.add(column + " = EXCLUDED." + column);
        }
        String conflict = series.hasMeteringGridAreas() ? "(time, mba, mga_code)" : "(time, mba)";
        return "INSERT INTO " + series.table() + " (" + String.join(", ", columns) + ")"
                + " VALUES (" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")"
                + " ON CONFLICT " + conflict + " DO UPDATE SET " + String.join(", ", updates);
    }

    private static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
