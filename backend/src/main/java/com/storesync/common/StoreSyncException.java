package com.storesync.common;

/**
 * Base for failures raised by store-sync. Retryability drives {@code RetryExecutor}.
 */
public class StoreSyncException extends RuntimeException {

    public StoreSyncException(String message) {
        super(message);
    }

    public StoreSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
