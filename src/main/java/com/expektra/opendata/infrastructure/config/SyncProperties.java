package com.expektra.opendata.infrastructure.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings of the cache synchronizer and its fetch executor.
 */
@Component
@ConfigurationProperties(prefix = "expektra.sync")
@Validated
public class SyncProperties {

    @Min(1)
    private int defaultPageSize = 1000;
    @Min(1)
    private int maxPageSize = 10000;
    @Min(1)
    private int fetchThreads = 4;
    @Min(0)
    private int fetchQueueCapacity = 100;

    // How long a query waits for owned or joined gap fetches
    @NotNull
    private Duration waitTimeout = Duration.ofMinutes(3);

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public int getFetchThreads() {
        return fetchThreads;
    }

    public void setFetchThreads(int fetchThreads) {
        this.fetchThreads = fetchThreads;
    }

    public int getFetchQueueCapacity() {
        return fetchQueueCapacity;
    }

    public void setFetchQueueCapacity(int fetchQueueCapacity) {
        this.fetchQueueCapacity = fetchQueueCapacity;
    }

    public Duration getWaitTimeout() {
        return waitTimeout;
    }

    public void setWaitTimeout(Duration waitTimeout) {
        this.waitTimeout = waitTimeout;
    }
}
