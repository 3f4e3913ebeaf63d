package com.storesync.resilience;

import com.storesync.common.StoreSyncException;

/**
 * Remote side kept rate-limiting after all retries were spent.
 */
public class RateLimitException extends StoreSyncException {

    private final Long retryAfterMs;
    private final int attempts;

    public RateLimitException(String message, Long retryAfterMs, int attempts, Throwable cause) {
        super(message, cause);
        this.retryAfterMs = retryAfterMs;
        this.attempts = attempts;
    }

    public Long getRetryAfterMs() {
        return retryAfterMs;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
