package com.expektra.opendata.infrastructure.web;

import com.expektra.opendata.application.CacheSynchronizer;
import com.expektra.opendata.domain.exception.InvalidRangeException;
import com.expektra.opendata.domain.model.Series;
import com.expektra.opendata.domain.model.SeriesKey;
import com.expektra.opendata.domain.model.SyncRecord;
import com.expektra.opendata.domain.model.Zone;
import com.expektra.opendata.domain.port.out.SyncMetadataService;
import com.expektra.opendata.infrastructure.web.dto.SyncStatusResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * Synchronizer counters and the last fetch outcome per series-key.
 */
@RestController
@RequestMapping("/api/sync")
public class SyncStatusController {

    private final CacheSynchronizer cacheSynchronizer;
    private final SyncMetadataService syncMetadata;

    public SyncStatusController(CacheSynchronizer cacheSynchronizer, SyncMetadataService syncMetadata) {
        this.cacheSynchronizer = cacheSynchronizer;
        this.syncMetadata = syncMetadata;
    }

    @GetMapping("/status")
    public ResponseEntity<SyncStatusResponse> status(
            @RequestParam(value = "series", required = false) String series,
            @RequestParam(value = "zone", required = false) String zone,
            @RequestParam(value = "mga", required = false) String mga
    ) {
        List<Series> seriesFilter = series != null ? List.of(Series.fromSlug(series)) : List.of(Series.values());
        boolean mgaFilter = mga != null && !mga.isBlank();
        if (mgaFilter) {
            seriesFilter = seriesFilter.stream().filter(Series::hasMeteringGridAreas).toList();
            if (seriesFilter.isEmpty()) {
                throw new InvalidRangeException("Series " + series + " has no metering grid areas");
            }
        }
        List<Zone> zoneFilter = zone != null ? List.of(Zone.parse(zone)) : List.of(Zone.values());

        List<SyncRecord> records = new ArrayList<>();
        for (Series s : seriesFilter) {
            for (Zone z : zoneFilter) {
                syncMetadata.lastSync(SeriesKey.of(s, z, mgaFilter ? mga : null)).ifPresent(records::add);
            }
        }

        return ResponseEntity.ok(SyncStatusResponse.from(cacheSynchronizer.stats(), records));
    }
}
