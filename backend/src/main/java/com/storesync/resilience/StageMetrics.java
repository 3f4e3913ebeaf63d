package com.storesync.resilience;

/**
 * Resilience counters observed while one deployment stage was active.
 */
public record StageMetrics(int rateLimitHits, int retryAttempts, int graphqlErrors, int networkErrors) {

    public static final StageMetrics EMPTY = new StageMetrics(0, 0, 0, 0);

    public StageMetrics plus(StageMetrics other) {
        return new StageMetrics(
                rateLimitHits + other.rateLimitHits,
                retryAttempts + other.retryAttempts,
                graphqlErrors + other.graphqlErrors,
                networkErrors + other.networkErrors);
    }

    public boolean hasIssues() {
        return rateLimitHits > 0 || retryAttempts > 0 || graphqlErrors > 0 || networkErrors > 0;
    }
}
