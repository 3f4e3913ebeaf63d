package com.storesync.common;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared by retries, waits and chunk loops of one run.
 * Waiting through {@link #sleep(long)} wakes up as soon as the token is cancelled.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String reason = "Operation cancelled";

    /** A fresh token nobody else holds; never cancelled unless the caller does it. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.countDown();
    }

    public void cancel(String reason) {
        if (reason != null && !reason.isBlank()) {
            this.reason = reason;
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(reason);
        }
    }

    /**
     * Blocks for delayMs or until cancelled, whichever comes first.
     *
     * @throws CancellationException if the token is (or becomes) cancelled, or the thread is interrupted
     */
    public void sleep(long delayMs) {
        throwIfCancelled();
        if (delayMs <= 0) {
            return;
        }
        try {
            if (cancelled.await(delayMs, TimeUnit.MILLISECONDS)) {
                throw new CancellationException(reason);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException ce = new CancellationException("Interrupted while waiting");
            ce.initCause(e);
            throw ce;
        }
    }
}
