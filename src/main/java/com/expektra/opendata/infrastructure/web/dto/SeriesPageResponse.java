package com.expektra.opendata.infrastructure.web.dto;

import com.expektra.opendata.domain.model.Row;
import com.expektra.opendata.domain.model.SeriesPage;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SeriesPageResponse(
        List<Map<String, Object>> data,
        String next_page_token,
        long total,
        int page_size,
        boolean cached
) {
    public static SeriesPageResponse fromPage(SeriesPage page, int pageSize) {
        var data = page.rows().stream()
                .map(SeriesPageResponse::toDataPoint)
                .toList();

        return new SeriesPageResponse(data, page.nextPageToken(), page.total(), pageSize, page.cached());
    }

    /**
     * Flat data point: {@code time}, {@code mba}, the metering grid area for series published per MGA,
     * then every schema field in order.
     */
    static Map<String, Object> toDataPoint(Row row) {
        Map<String, Object> point = new LinkedHashMap<>();
        point.put("time", row.time().toString());
        point.put("mba", row.zone().name());
        if (row.series().hasMeteringGridAreas()) {
            point.put("mga_code", row.mgaCode().isEmpty() ? null : row.mgaCode());
            point.put("mga_name", row.mgaName());
        }
        point.putAll(row.values());
        return point;
    }
}
