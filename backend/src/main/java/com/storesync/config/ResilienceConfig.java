package com.storesync.config;

import com.storesync.batch.ChunkedBatchProcessor;
import com.storesync.common.RetryPolicy;
import com.storesync.common.Sleeper;
import com.storesync.diff.DiffEngine;
import com.storesync.reconcile.BatchSettings;
import com.storesync.reconcile.ReconciliationSupport;
import com.storesync.resilience.AdaptiveRateLimiter;
import com.storesync.resilience.ConcurrencyController;
import com.storesync.resilience.ErrorClassifier;
import com.storesync.resilience.ResilienceContext;
import com.storesync.resilience.ResilienceTracker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * One resilience context per process: every service of the run shares the same rate-limit window,
 * concurrency bound and stage tracker.
 */
@Configuration
@EnableConfigurationProperties({ ApiProperties.class, ResilienceProperties.class, BatchProperties.class, ReportProperties.class })
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.DEFAULT;
    }

    @Bean
    public RetryPolicy retryPolicy(ResilienceProperties properties) {
        return new RetryPolicy(
                properties.getBaseDelayMs(),
                properties.getMultiplier(),
                properties.getMaxDelayMs(),
                properties.getJitterFactor(),
                properties.getMaxRetries());
    }

    @Bean
    public ResilienceContext resilienceContext(ResilienceProperties properties, RetryPolicy retryPolicy,
                                               Clock clock, Sleeper sleeper) {
        return new ResilienceContext(
                new ErrorClassifier(),
                new AdaptiveRateLimiter(clock),
                new ConcurrencyController(properties.getMinConcurrency(), properties.getMaxConcurrency()),
                new ResilienceTracker(),
                retryPolicy,
                sleeper);
    }

    @Bean
    public ChunkedBatchProcessor chunkedBatchProcessor(ResilienceContext resilienceContext, Sleeper sleeper) {
        return new ChunkedBatchProcessor(resilienceContext.getRateLimiter(), sleeper);
    }

    @Bean
    public ReconciliationSupport reconciliationSupport(ResilienceContext resilienceContext,
                                                       ChunkedBatchProcessor chunkedBatchProcessor,
                                                       @Qualifier(AsyncConfig.RECONCILE_EXECUTOR) Executor executor,
                                                       BatchProperties batch) {
        BatchSettings settings = new BatchSettings(
                Math.max(1, batch.getBulkThreshold()),
                Math.max(1, batch.getChunkSize()),
                Math.max(0L, batch.getChunkDelayMs()),
                batch.isFailOnPartialFailure());
        return new ReconciliationSupport(resilienceContext, chunkedBatchProcessor, executor, settings);
    }

    @Bean
    public DiffEngine diffEngine() {
        return new DiffEngine();
    }
}
