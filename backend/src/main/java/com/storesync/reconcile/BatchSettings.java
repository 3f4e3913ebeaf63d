package com.storesync.reconcile;

/**
 * @param bulkThreshold        batches up to this size are dispatched all at once; larger ones are chunked
 * @param failOnPartialFailure throw {@link BatchOperationException} when any item failed
 */
public record BatchSettings(int bulkThreshold, int chunkSize, long chunkDelayMs, boolean failOnPartialFailure) {

    public static BatchSettings defaults() {
        return new BatchSettings(10, 10, 500L, true);
    }
}
