package com.expektra.opendata.infrastructure.adapter.provider;

import com.expektra.opendata.domain.model.TimeRange;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Raw records returned by one upstream request, together with the window that was requested.
 */
public record UpstreamPage(TimeRange window, List<JsonNode> records) {

    public UpstreamPage {
        records = List.copyOf(records);
    }
}
