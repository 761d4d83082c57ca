package com.expektra.opendata.infrastructure.web.dto;

import com.expektra.opendata.application.SyncStats;
import com.expektra.opendata.domain.model.SyncRecord;

import java.util.List;

public record SyncStatusResponse(
        StatsDto stats,
        List<SyncDto> syncs
) {
    public static SyncStatusResponse from(SyncStats stats, List<SyncRecord> records) {
        return new SyncStatusResponse(
                StatsDto.fromStats(stats),
                records.stream().map(SyncDto::fromRecord).toList());
    }

    public record StatsDto(
            long queries,
            long cache_hits,
            long owned_fetches,
            long joined_fetches,
            long fetch_failures,
            int in_flight_fetches,
            double hit_ratio
    ) {
        public static StatsDto fromStats(SyncStats stats) {
            return new StatsDto(
                    stats.queries(),
                    stats.cacheHits(),
                    stats.ownedFetches(),
                    stats.joinedFetches(),
                    stats.fetchFailures(),
                    stats.inFlightFetches(),
                    stats.hitRatio()
            );
        }
    }

    public record SyncDto(
            String series,
            String mba,
            String mga,
            String status,
            String synced_at,
            String range_start,
            String range_end,
            int row_count,
            String error
    ) {
        public static SyncDto fromRecord(SyncRecord record) {
            return new SyncDto(
                    record.key().series().slug(),
                    record.key().zone().name(),
                    record.key().hasMga() ? record.key().mga() : null,
                    record.status().name(),
                    record.syncedAt().toString(),
                    record.range().start().toString(),
                    record.range().end().toString(),
                    record.rowCount(),
                    record.errorKind() != null ? record.errorKind().name() : null
            );
        }
    }
}
