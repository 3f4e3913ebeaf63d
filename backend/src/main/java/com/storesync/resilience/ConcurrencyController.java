package com.storesync.resilience;

import com.storesync.common.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CancellationException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Bounds how many remote operations run at once and adapts the bound to rate limiting:
 * each rate limit shrinks it by {@value #DECREASE_STEP} (never below the floor), each success
 * grows it by {@value #INCREASE_STEP} (never above the ceiling). Work already admitted keeps
 * running when the bound shrinks; new work waits until in-flight count drops under the new bound.
 */
@Slf4j
public class ConcurrencyController {

    public static final int DEFAULT_MAX_CONCURRENCY = 10;
    public static final int DEFAULT_MIN_CONCURRENCY = 1;
    static final int DECREASE_STEP = 2;
    static final int INCREASE_STEP = 1;
    private static final long ACQUIRE_POLL_MS = 50L;

    private final int minConcurrency;
    private final int maxConcurrency;
    private final ResizableSemaphore gate;
    private int currentLimit;

    public ConcurrencyController() {
        this(DEFAULT_MIN_CONCURRENCY, DEFAULT_MAX_CONCURRENCY);
    }

    public ConcurrencyController(int minConcurrency, int maxConcurrency) {
        if (minConcurrency < 1 || maxConcurrency < minConcurrency) {
            throw new IllegalArgumentException("require 1 <= min <= max, got min=" + minConcurrency + " max=" + maxConcurrency);
        }
        this.minConcurrency = minConcurrency;
        this.maxConcurrency = maxConcurrency;
        this.currentLimit = maxConcurrency;
        this.gate = new ResizableSemaphore(maxConcurrency);
    }

    /**
     * Runs the operation once a slot is free. Waiting for a slot stops with
     * {@link CancellationException} when the token is cancelled.
     */
    public <T> T run(Supplier<T> operation, CancellationToken token) {
        acquire(token);
        try {
            return operation.get();
        } finally {
            gate.release();
        }
    }

    private void acquire(CancellationToken token) {
        while (true) {
            token.throwIfCancelled();
            try {
                if (gate.tryAcquire(ACQUIRE_POLL_MS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                CancellationException ce = new CancellationException("Interrupted while waiting for a concurrency slot");
                ce.initCause(e);
                throw ce;
            }
        }
    }

    public synchronized void adjustConcurrency(boolean wasRateLimited) {
        int next = wasRateLimited
                ? Math.max(minConcurrency, currentLimit - DECREASE_STEP)
                : Math.min(maxConcurrency, currentLimit + INCREASE_STEP);
        if (next == currentLimit) {
            return;
        }
        if (next < currentLimit) {
            gate.shrink(currentLimit - next);
            log.info("Rate limited: concurrency reduced {} -> {}", currentLimit, next);
        } else {
            gate.release(next - currentLimit);
            log.debug("Concurrency increased {} -> {}", currentLimit, next);
        }
        currentLimit = next;
    }

    public synchronized int getCurrentLimit() {
        return currentLimit;
    }

    public int getMinConcurrency() {
        return minConcurrency;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /** Slots currently taken (may briefly exceed the limit right after a shrink). */
    public synchronized int getInFlight() {
        return currentLimit - gate.availablePermits();
    }

    private static final class ResizableSemaphore extends Semaphore {

        ResizableSemaphore(int permits) {
            super(permits, true);
        }

        void shrink(int by) {
            reducePermits(by);
        }
    }
}
