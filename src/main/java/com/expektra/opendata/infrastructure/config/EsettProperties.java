package com.expektra.opendata.infrastructure.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the eSett Open Data API.
 */
@Component
@ConfigurationProperties(prefix = "expektra.esett")
@Validated
public class EsettProperties {

    @NotBlank
    private String baseUrl = "https://api.opendata.esett.com/";

    // Longest time window requested in one upstream call
    @NotNull
    private Duration maxWindow = Duration.ofDays(31);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);
    @NotNull
    private Duration readTimeout = Duration.ofSeconds(30);
    @NotNull
    private Duration callTimeout = Duration.ofSeconds(60);

    // Deadline for a whole gap fetch, all pages and retries included
    @NotNull
    private Duration fetchTimeout = Duration.ofMinutes(2);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getMaxWindow() {
        return maxWindow;
    }

    public void setMaxWindow(Duration maxWindow) {
        this.maxWindow = maxWindow;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }
}
