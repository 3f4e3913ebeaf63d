package com.storesync.batch;

import java.util.List;

/**
 * Per-item outcome of a chunked run. successes + failures always covers every item of every
 * processed chunk. {@code cancelled} is set when the run stopped before the last chunk.
 */
public record ChunkedProcessorResult<T, R>(
        List<ItemSuccess<T, R>> successes,
        List<ItemFailure<T>> failures,
        int chunksProcessed,
        boolean cancelled) {

    public ChunkedProcessorResult {
        successes = List.copyOf(successes);
        failures = List.copyOf(failures);
    }

    public int processedItems() {
        return successes.size() + failures.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
