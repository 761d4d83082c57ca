package com.expektra.opendata.domain.model;

/**
 * One numeric column of a series.
 *
 * @param name         normalized name used in storage and in responses
 * @param upstreamName field name in the eSett JSON payload
 */
public record SeriesField(String name, String upstreamName) {

    static SeriesField of(String name, String upstreamName) {
        return new SeriesField(name, upstreamName);
    }
}
