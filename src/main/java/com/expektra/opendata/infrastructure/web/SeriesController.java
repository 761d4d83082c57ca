package com.expektra.opendata.infrastructure.web;

import com.expektra.opendata.application.QuerySeries;
import com.expektra.opendata.domain.exception.InvalidRangeException;
import com.expektra.opendata.domain.model.Series;
import com.expektra.opendata.domain.model.SeriesPage;
import com.expektra.opendata.domain.model.SeriesQuery;
import com.expektra.opendata.domain.model.TimeRange;
import com.expektra.opendata.domain.model.Zone;
import com.expektra.opendata.infrastructure.config.SyncProperties;
import com.expektra.opendata.infrastructure.web.dto.SeriesPageResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Read endpoints for the cached series: {@code /api/production}, {@code /api/consumption},
 * {@code /api/prices} and {@code /api/load-profile}.
 */
@RestController
@RequestMapping("/api")
public class SeriesController {

    private static final Logger logger = LoggerFactory.getLogger(SeriesController.class);

    private final QuerySeries querySeries;
    private final SyncProperties syncProperties;

    public SeriesController(QuerySeries querySeries, SyncProperties syncProperties) {
        this.querySeries = querySeries;
        this.syncProperties = syncProperties;
    }

    @GetMapping("/{series:production|consumption|prices|load-profile}")
    public ResponseEntity<SeriesPageResponse> getSeries(
            @PathVariable("series") String seriesSlug,
            @RequestParam(value = "zone", required = false) String zone,
            @RequestParam(value = "mba", required = false) String mba,
            @RequestParam(value = "start", required = false) String start,
            @RequestParam(value = "end", required = false) String end,
            @RequestParam(value = "page_size", required = false) Integer pageSize,
            @RequestParam(value = "page_token", required = false) String pageToken,
            @RequestParam(value = "mga", required = false) String mga
    ) {
        Series series = Series.fromSlug(seriesSlug);
        Zone parsedZone = Zone.parse(zone != null ? zone : mba);
        Instant from = TimestampParams.parse("start", start);
        Instant to = TimestampParams.parse("end", end);
        if (from.isAfter(to)) {
            logger.warn("Invalid range for {}: start {} is after end {}", seriesSlug, from, to);
            throw new InvalidRangeException("start " + from + " is after end " + to);
        }

        int size = pageSize != null ? pageSize : syncProperties.getDefaultPageSize();
        SeriesQuery query = new SeriesQuery(series, parsedZone, TimeRange.of(from, to), size,
                blankToNull(pageToken), mga);
        logger.info("Querying {} from {} to {} (page_size={})", query.key(), from, to, size);

        SeriesPage page = querySeries.execute(query);

        logger.info("Returning {} of {} {} rows (cached={})",
                page.rows().size(), page.total(), series.slug(), page.cached());
        return ResponseEntity.ok(SeriesPageResponse.fromPage(page, size));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
