package com.storesync.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for remote-call retries.
 * Delay for retry n (zero-based) is min(base * multiplier^n, maxDelay), then ± jitterFactor.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxRetries;

    public RetryPolicy(long baseDelayMs, double multiplier, long maxDelayMs, double jitterFactor, int maxRetries) {
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxRetries = maxRetries;
    }

    /**
     * Delay in milliseconds before the given zero-based retry.
     */
    public long delayMs(int retry) {
        double exponential = baseDelayMs * Math.pow(multiplier, Math.max(0, Math.min(retry, 30)));
        long capped = (long) Math.min(exponential, (double) maxDelayMs);
        return jitter(capped);
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, Math.min(maxDelayMs, (long) (value * jitter)));
    }

    /** Retries after the first attempt; total attempts = maxRetries + 1. */
    public int getMaxRetries() {
        return maxRetries;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Default: 1s base, doubling, capped at 30s, ±20% jitter, 5 retries.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 2.0, 30_000L, 0.2, 5);
    }
}
