package com.storesync.cli;

import com.storesync.common.ValidationException;
import com.storesync.reconcile.BatchOperationException;
import com.storesync.resilience.NetworkException;
import com.storesync.resilience.RateLimitException;
import com.storesync.resilience.RemoteCallException;

/**
 * Process exit codes of the command-line runner.
 */
public enum ExitCode {

    SUCCESS(0),
    UNEXPECTED(1),
    AUTHENTICATION(2),
    NETWORK(3),
    VALIDATION(4),
    PARTIAL_FAILURE(5);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ExitCode forException(Throwable e) {
        if (e instanceof ValidationException) {
            return VALIDATION;
        }
        if (e instanceof BatchOperationException) {
            return PARTIAL_FAILURE;
        }
        if (e instanceof RateLimitException || e instanceof NetworkException) {
            return isAuthFailure(e.getCause()) ? AUTHENTICATION : NETWORK;
        }
        if (isAuthFailure(e)) {
            return AUTHENTICATION;
        }
        if (e instanceof RemoteCallException r && r.isNetworkError()) {
            return NETWORK;
        }
        return UNEXPECTED;
    }

    private static boolean isAuthFailure(Throwable e) {
        return e instanceof RemoteCallException r && r.getStatus() != null
                && (r.getStatus() == 401 || r.getStatus() == 403);
    }
}
