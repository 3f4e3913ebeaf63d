package com.storesync.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Widens pauses after observed rate limits. Keeps the number of rate limits seen in the last
 * {@value #WINDOW_MS} ms (reset lazily on the next read or write) and the instant until which the
 * server asked us to back off. Shared by all workers of a run.
 */
@Slf4j
public class AdaptiveRateLimiter {

    public static final long WINDOW_MS = 60_000L;
    public static final long MAX_DELAY_MS = 15_000L;

    private final Clock clock;

    private int recentRateLimitCount;
    private long lastRateLimitTimestamp;
    private long retryAfterExpiresAt;

    public AdaptiveRateLimiter(Clock clock) {
        this.clock = clock;
    }

    public AdaptiveRateLimiter() {
        this(Clock.systemUTC());
    }

    /**
     * Records a rate-limit response. A positive hint sets the back-off deadline to now + hint.
     */
    public synchronized void trackRateLimit(Long retryAfterMs) {
        long now = clock.millis();
        resetIfStale(now);
        recentRateLimitCount++;
        lastRateLimitTimestamp = now;
        if (retryAfterMs != null && retryAfterMs > 0) {
            retryAfterExpiresAt = now + retryAfterMs;
        }
        log.debug("Rate limit tracked: {} in window, retryAfterMs={}", recentRateLimitCount, retryAfterMs);
    }

    /**
     * While a Retry-After deadline is pending, max(remaining, baseDelayMs). Otherwise baseDelayMs when
     * no recent rate limits, else min(base * 2^recentCount, {@value #MAX_DELAY_MS}).
     */
    public synchronized long getAdaptiveDelay(long baseDelayMs) {
        long now = clock.millis();
        if (retryAfterExpiresAt > now) {
            return Math.max(retryAfterExpiresAt - now, baseDelayMs);
        }
        resetIfStale(now);
        if (recentRateLimitCount == 0) {
            return baseDelayMs;
        }
        double scaled = baseDelayMs * Math.pow(2, Math.min(recentRateLimitCount, 30));
        return (long) Math.min(scaled, (double) MAX_DELAY_MS);
    }

    public synchronized WaitDecision shouldWait() {
        long now = clock.millis();
        if (now < retryAfterExpiresAt) {
            return new WaitDecision(true, retryAfterExpiresAt - now);
        }
        return WaitDecision.NO_WAIT;
    }

    public synchronized int getRecentRateLimitCount() {
        resetIfStale(clock.millis());
        return recentRateLimitCount;
    }

    public synchronized RateLimiterState state() {
        resetIfStale(clock.millis());
        return new RateLimiterState(recentRateLimitCount, lastRateLimitTimestamp, retryAfterExpiresAt);
    }

    public synchronized void reset() {
        recentRateLimitCount = 0;
        lastRateLimitTimestamp = 0L;
        retryAfterExpiresAt = 0L;
    }

    private void resetIfStale(long now) {
        if (recentRateLimitCount > 0 && now - lastRateLimitTimestamp >= WINDOW_MS) {
            log.debug("Rate limit window expired, clearing {} recent hit(s)", recentRateLimitCount);
            recentRateLimitCount = 0;
        }
    }

    /** Whether a Retry-After deadline is still pending, and for how long. */
    public record WaitDecision(boolean waitRequired, long delayMs) {
        static final WaitDecision NO_WAIT = new WaitDecision(false, 0L);
    }

    public record RateLimiterState(int recentRateLimitCount, long lastRateLimitTimestamp, long retryAfterExpiresAt) {
    }
}
