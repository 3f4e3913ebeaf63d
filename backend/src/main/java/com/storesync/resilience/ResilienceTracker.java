package com.storesync.resilience;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Attributes resilience events to the currently active deployment stage. One stage at a time;
 * events recorded while no stage is active are dropped.
 */
@Slf4j
public class ResilienceTracker {

    private final Map<String, StageMetrics> completed = new LinkedHashMap<>();

    private String currentStage;
    private int rateLimitHits;
    private int retryAttempts;
    private int graphqlErrors;
    private int networkErrors;

    /**
     * @throws IllegalStateException when another stage is still active
     */
    public synchronized void startStageContext(String stageName) {
        if (stageName == null || stageName.isBlank()) {
            throw new IllegalArgumentException("stageName must not be blank");
        }
        if (currentStage != null) {
            throw new IllegalStateException("Stage '" + currentStage + "' is still active; cannot start '" + stageName + "'");
        }
        currentStage = stageName;
        rateLimitHits = 0;
        retryAttempts = 0;
        graphqlErrors = 0;
        networkErrors = 0;
    }

    /**
     * Closes the active stage and stores its counters under the stage name (replacing an earlier
     * run of the same stage).
     *
     * @return the stage counters, or empty when no stage was active
     */
    public synchronized Optional<StageMetrics> endStageContext() {
        if (currentStage == null) {
            return Optional.empty();
        }
        StageMetrics metrics = new StageMetrics(rateLimitHits, retryAttempts, graphqlErrors, networkErrors);
        completed.put(currentStage, metrics);
        if (metrics.hasIssues()) {
            log.info("Stage '{}' resilience: {} rate limit(s), {} retr(ies), {} GraphQL error(s), {} network error(s)",
                    currentStage, rateLimitHits, retryAttempts, graphqlErrors, networkErrors);
        }
        currentStage = null;
        return Optional.of(metrics);
    }

    public synchronized void recordRateLimit() {
        if (currentStage != null) {
            rateLimitHits++;
        }
    }

    public synchronized void recordRetry() {
        if (currentStage != null) {
            retryAttempts++;
        }
    }

    public synchronized void recordGraphQLError() {
        if (currentStage != null) {
            graphqlErrors++;
        }
    }

    public synchronized void recordNetworkError() {
        if (currentStage != null) {
            networkErrors++;
        }
    }

    public synchronized Optional<StageMetrics> getStageMetrics(String stageName) {
        return Optional.ofNullable(completed.get(stageName));
    }

    /** Completed stages in the order they were first completed. */
    public synchronized Map<String, StageMetrics> getAllStageMetrics() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(completed));
    }

    public synchronized boolean isInStageContext() {
        return currentStage != null;
    }

    public synchronized Optional<String> getCurrentStageName() {
        return Optional.ofNullable(currentStage);
    }

    public synchronized void reset() {
        completed.clear();
        currentStage = null;
        rateLimitHits = 0;
        retryAttempts = 0;
        graphqlErrors = 0;
        networkErrors = 0;
    }
}
