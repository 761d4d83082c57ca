package com.expektra.opendata.infrastructure.adapter.mapper;

import com.expektra.opendata.domain.exception.DecodeException;
import com.expektra.opendata.domain.model.Row;
import com.expektra.opendata.domain.model.Series;
import com.expektra.opendata.domain.model.SeriesField;
import com.expektra.opendata.domain.model.TimeRange;
import com.expektra.opendata.domain.model.Zone;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps eSett JSON records to domain rows.
 * Upstream field names are translated to schema names; units are kept as published.
 */
@Component
public class RowCodec {

    private static final Logger logger = LoggerFactory.getLogger(RowCodec.class);
    private static final Marker DECODE_ERROR = MarkerFactory.getMarker("DECODE_ERROR");

    static final String TIMESTAMP_FIELD = "timestampUTC";
    static final String MGA_CODE_FIELD = "mgaCode";
    static final String MGA_NAME_FIELD = "mgaName";

    public List<Row> decodeAll(Series series, Zone zone, List<JsonNode> records) {
        List<Row> rows = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            rows.add(decode(series, zone, record));
        }
        return rows;
    }

    /**
     * Decode one upstream record.
     * Missing or null fields decode to {@code null}; a present non-numeric value is a decode error.
     */
    public Row decode(Series series, Zone zone, JsonNode record) {
        if (record == null || !record.isObject()) {
            throw failure(series, zone, "Record is not a JSON object: " + record);
        }

        Instant time = parseTimestamp(series, zone, record.get(TIMESTAMP_FIELD));
        if (!TimeRange.isAligned(time, series.granularity())) {
            throw failure(series, zone, "Timestamp " + time + " is not aligned to " + series.granularity());
        }

        Map<String, Double> values = new LinkedHashMap<>();
        for (SeriesField field : series.fields()) {
            values.put(field.name(), readNumber(series, zone, record, field));
        }
        if (!series.hasMeteringGridAreas()) {
            return new Row(series, zone, time, values);
        }
        // zone-wide records carry no mgaCode
        String mgaCode = readText(series, zone, record, MGA_CODE_FIELD);
        return new Row(series, zone, mgaCode, readText(series, zone, record, MGA_NAME_FIELD), time, values);
    }

    private String readText(Series series, Zone zone, JsonNode record, String field) {
        JsonNode value = record.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw failure(series, zone, "Field " + field + " is not a string: " + value);
        }
        return value.asText();
    }

    private Instant parseTimestamp(Series series, Zone zone, JsonNode node) {
        if (node == null || node.isNull() || !node.isTextual()) {
            throw failure(series, zone, "Missing " + TIMESTAMP_FIELD);
        }

        String text = node.asText();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            // naive timestamps are UTC upstream
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw failure(series, zone, "Unparseable " + TIMESTAMP_FIELD + ": " + text);
        }
    }

    private Double readNumber(Series series, Zone zone, JsonNode record, SeriesField field) {
        JsonNode value = record.get(field.upstreamName());
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw failure(series, zone, "Field " + field.upstreamName() + " is not numeric: " + value);
        }
        return value.doubleValue();
    }

    private static DecodeException failure(Series series, Zone zone, String reason) {
        logger.warn(DECODE_ERROR, "Cannot decode {} record for {}: {}", series.slug(), zone, reason);
        return new DecodeException(series.slug() + "/" + zone + ": " + reason);
    }
}
