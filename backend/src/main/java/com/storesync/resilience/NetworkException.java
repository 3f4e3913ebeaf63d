package com.storesync.resilience;

import com.storesync.common.StoreSyncException;

/**
 * Transport failure (connection, DNS, timeout, bad gateway) that outlived the retry budget.
 */
public class NetworkException extends StoreSyncException {

    private final int attempts;

    public NetworkException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
