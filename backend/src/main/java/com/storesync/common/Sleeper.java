package com.storesync.common;

/**
 * Blocking wait used for backoff and inter-chunk pauses. Replaced in tests to avoid real delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper DEFAULT = (delayMs, token) -> token.sleep(delayMs);

    void sleep(long delayMs, CancellationToken token);
}
