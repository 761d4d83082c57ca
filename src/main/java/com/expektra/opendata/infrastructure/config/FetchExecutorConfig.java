package com.expektra.opendata.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool that runs owned gap fetches, so a fetch keeps going when the query that started it gives up.
 */
@Configuration
public class FetchExecutorConfig {

    @Bean(name = "fetchExecutor")
    public ThreadPoolTaskExecutor fetchExecutor(SyncProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getFetchThreads());
        executor.setMaxPoolSize(properties.getFetchThreads());
        executor.setQueueCapacity(properties.getFetchQueueCapacity());
        executor.setThreadNamePrefix("esett-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
