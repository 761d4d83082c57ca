package com.expektra.opendata.domain.model;

import java.util.List;

/**
 * One page of a series query.
 *
 * @param rows          rows ascending by time
 * @param nextPageToken token for the following page, {@code null} on the last page
 * @param total         number of rows in the whole aligned range
 * @param cached        true when the range was fully cached before the query
 */
public record SeriesPage(List<Row> rows, String nextPageToken, long total, boolean cached) {

    public SeriesPage {
        rows = List.copyOf(rows);
    }

    public static SeriesPage empty() {
        return new SeriesPage(List.of(), null, 0, true);
    }

    public boolean hasNext() {
        return nextPageToken != null;
    }
}
