package com.storesync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Worker pool for concurrently dispatched reconciliation items. Its size only caps threads; the
 * effective parallelism is set by the adaptive concurrency controller.
 */
@Configuration
public class AsyncConfig {

    public static final String RECONCILE_EXECUTOR = "reconcile-executor";

    @Bean(name = RECONCILE_EXECUTOR)
    public Executor reconcileExecutor(ResilienceProperties resilienceProperties) {
        int size = Math.max(1, resilienceProperties.getMaxConcurrency());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix("reconcile-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.initialize();
        return e;
    }
}
