package com.storesync.batch;

import com.storesync.common.StoreSyncException;

/**
 * A per-item chunk operation returned fewer results than the chunk had items.
 */
public class BatchResultMismatchException extends StoreSyncException {

    public BatchResultMismatchException(int expected, int actual) {
        super("Chunk operation returned " + actual + " result(s) for " + expected + " item(s)");
    }
}
