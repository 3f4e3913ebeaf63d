package com.storesync.resilience;

import com.storesync.common.CancellationToken;
import com.storesync.common.RetryPolicy;
import com.storesync.common.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Runs an operation with exponential backoff. Rate-limit and network failures are retried up to
 * {@link RetryPolicy#getMaxRetries()} times after the first attempt; everything else propagates
 * at once. Every failure is reported to the tracker, rate limits also to the adaptive limiter and
 * the concurrency controller. A server Retry-After hint is waited out on top of the backoff.
 */
@Slf4j
public class RetryExecutor {

    private final RetryPolicy retryPolicy;
    private final ErrorClassifier classifier;
    private final AdaptiveRateLimiter rateLimiter;
    private final ConcurrencyController concurrencyController;
    private final ResilienceTracker tracker;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy retryPolicy, ErrorClassifier classifier, AdaptiveRateLimiter rateLimiter,
                         ConcurrencyController concurrencyController, ResilienceTracker tracker, Sleeper sleeper) {
        this.retryPolicy = retryPolicy;
        this.classifier = classifier;
        this.rateLimiter = rateLimiter;
        this.concurrencyController = concurrencyController;
        this.tracker = tracker;
        this.sleeper = sleeper;
    }

    public <T> T execute(String operationName, Supplier<T> operation, CancellationToken token) {
        AdaptiveRateLimiter.WaitDecision pending = rateLimiter.shouldWait();
        if (pending.waitRequired()) {
            log.debug("{}: waiting {} ms for pending Retry-After", operationName, pending.delayMs());
            sleeper.sleep(pending.delayMs(), token);
        }
        int maxRetries = retryPolicy.getMaxRetries();
        for (int attempt = 0; ; attempt++) {
            token.throwIfCancelled();
            try {
                T result = operation.get();
                concurrencyController.adjustConcurrency(false);
                if (attempt > 0) {
                    log.info("{} succeeded after {} retr(ies)", operationName, attempt);
                }
                return result;
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                ClassifiedError error = classifier.classify(e);
                record(error);
                if (!error.retryable()) {
                    log.debug("{} failed with non-retryable {} error: {}", operationName, error.kind(), error.message());
                    throw error.toFailure(operationName, attempt + 1);
                }
                if (attempt >= maxRetries) {
                    log.warn("{} giving up after {} attempt(s): {} ({})", operationName, attempt + 1, error.message(), error.kind());
                    throw error.toFailure(operationName, attempt + 1);
                }
                tracker.recordRetry();
                if (error.kind() == ErrorKind.RATE_LIMITED && error.retryAfterMs() != null && error.retryAfterMs() > 0) {
                    log.info("{} rate limited, honouring Retry-After of {} ms", operationName, error.retryAfterMs());
                    sleeper.sleep(error.retryAfterMs(), token);
                }
                long delay = retryPolicy.delayMs(attempt);
                log.warn("{} failed ({}), retry {}/{} in {} ms: {}",
                        operationName, error.kind(), attempt + 1, maxRetries, delay, error.message());
                sleeper.sleep(delay, token);
            }
        }
    }

    private void record(ClassifiedError error) {
        switch (error.kind()) {
            case RATE_LIMITED -> {
                tracker.recordRateLimit();
                rateLimiter.trackRateLimit(error.retryAfterMs());
                concurrencyController.adjustConcurrency(true);
            }
            case NETWORK -> tracker.recordNetworkError();
            case GRAPHQL -> tracker.recordGraphQLError();
            default -> {
            }
        }
    }
}
