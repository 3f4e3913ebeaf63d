package com.storesync.reconcile;

import com.storesync.batch.ChunkedBatchProcessor;
import com.storesync.resilience.ResilienceContext;

import java.util.concurrent.Executor;

/**
 * Collaborators every {@link ReconciliationService} of a run shares.
 */
public record ReconciliationSupport(
        ResilienceContext resilience,
        ChunkedBatchProcessor batchProcessor,
        Executor executor,
        BatchSettings settings) {
}
