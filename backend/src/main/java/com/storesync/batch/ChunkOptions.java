package com.storesync.batch;

/**
 * @param chunkSize   items per chunk, at least 1
 * @param delayMs     base pause between consecutive chunks
 * @param entityType  label used in log lines
 */
public record ChunkOptions(int chunkSize, long delayMs, String entityType) {

    public static final int DEFAULT_CHUNK_SIZE = 10;
    public static final long DEFAULT_DELAY_MS = 500L;

    public ChunkOptions {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1, got " + chunkSize);
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must not be negative");
        }
        entityType = entityType == null || entityType.isBlank() ? "items" : entityType;
    }

    public static ChunkOptions defaults() {
        return new ChunkOptions(DEFAULT_CHUNK_SIZE, DEFAULT_DELAY_MS, "items");
    }

    public static ChunkOptions of(String entityType) {
        return new ChunkOptions(DEFAULT_CHUNK_SIZE, DEFAULT_DELAY_MS, entityType);
    }

    public ChunkOptions withChunkSize(int size) {
        return new ChunkOptions(size, delayMs, entityType);
    }

    public ChunkOptions withDelayMs(long delay) {
        return new ChunkOptions(chunkSize, delay, entityType);
    }
}
