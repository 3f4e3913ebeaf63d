package com.storesync.resilience;

import com.storesync.common.CancellationToken;
import com.storesync.common.RetryPolicy;
import com.storesync.common.Sleeper;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * The resilience components of one run, shared by every service of that run. Remote operations
 * go through {@link #execute}: a concurrency slot is held for the whole retry sequence.
 */
public class ResilienceContext {

    private final ErrorClassifier classifier;
    private final AdaptiveRateLimiter rateLimiter;
    private final ConcurrencyController concurrencyController;
    private final ResilienceTracker tracker;
    private final RetryExecutor retryExecutor;

    public ResilienceContext(ErrorClassifier classifier, AdaptiveRateLimiter rateLimiter,
                             ConcurrencyController concurrencyController, ResilienceTracker tracker,
                             RetryPolicy retryPolicy, Sleeper sleeper) {
        this.classifier = classifier;
        this.rateLimiter = rateLimiter;
        this.concurrencyController = concurrencyController;
        this.tracker = tracker;
        this.retryExecutor = new RetryExecutor(retryPolicy, classifier, rateLimiter, concurrencyController, tracker, sleeper);
    }

    public static ResilienceContext create(Clock clock, RetryPolicy retryPolicy, Sleeper sleeper) {
        return new ResilienceContext(new ErrorClassifier(), new AdaptiveRateLimiter(clock),
                new ConcurrencyController(), new ResilienceTracker(), retryPolicy, sleeper);
    }

    public <T> T execute(String operationName, Supplier<T> operation, CancellationToken token) {
        return concurrencyController.run(() -> retryExecutor.execute(operationName, operation, token), token);
    }

    public ErrorClassifier getClassifier() {
        return classifier;
    }

    public AdaptiveRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public ConcurrencyController getConcurrencyController() {
        return concurrencyController;
    }

    public ResilienceTracker getTracker() {
        return tracker;
    }

    public RetryExecutor getRetryExecutor() {
        return retryExecutor;
    }
}
