package com.storesync.batch;

import com.storesync.common.CancellationToken;
import com.storesync.common.Sleeper;
import com.storesync.common.StoreSyncException;
import com.storesync.resilience.AdaptiveRateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.Function;

/**
 * Runs a batch operation over fixed-size chunks, one chunk at a time, pausing between chunks.
 * A failing chunk marks all of its items failed with the same error; later chunks still run.
 * When composed with an {@link AdaptiveRateLimiter} the pause widens after recent rate limits.
 */
@Slf4j
public class ChunkedBatchProcessor {

    private final AdaptiveRateLimiter rateLimiter;
    private final Sleeper sleeper;

    public ChunkedBatchProcessor(AdaptiveRateLimiter rateLimiter, Sleeper sleeper) {
        this.rateLimiter = rateLimiter;
        this.sleeper = sleeper;
    }

    /** Without adaptive pacing: pauses are always the configured delay. */
    public ChunkedBatchProcessor(Sleeper sleeper) {
        this(null, sleeper);
    }

    public static <T> List<List<T>> splitIntoChunks(List<T> items, int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1, got " + chunkSize);
        }
        List<List<T>> chunks = new ArrayList<>();
        for (int start = 0; start < items.size(); start += chunkSize) {
            chunks.add(Collections.unmodifiableList(new ArrayList<>(items.subList(start, Math.min(start + chunkSize, items.size())))));
        }
        return chunks;
    }

    /**
     * Each chunk yields one result, recorded for every item of that chunk.
     */
    public <T, R> ChunkedProcessorResult<T, R> processInChunks(List<T> items, Function<List<T>, R> chunkOperation,
                                                              ChunkOptions options, CancellationToken token) {
        return process(items, options, token, chunk -> {
            R shared = chunkOperation.apply(chunk);
            List<ItemSuccess<T, R>> out = new ArrayList<>(chunk.size());
            for (T item : chunk) {
                out.add(new ItemSuccess<>(item, shared));
            }
            return out;
        });
    }

    /**
     * Each chunk yields a list of results matched to items by position. A list shorter than the
     * chunk fails the whole chunk with {@link BatchResultMismatchException}; extra entries are ignored.
     */
    public <T, R> ChunkedProcessorResult<T, R> processInChunksPerItem(List<T> items, Function<List<T>, List<R>> chunkOperation,
                                                                     ChunkOptions options, CancellationToken token) {
        return process(items, options, token, chunk -> {
            List<R> results = chunkOperation.apply(chunk);
            int actual = results == null ? 0 : results.size();
            if (actual < chunk.size()) {
                throw new BatchResultMismatchException(chunk.size(), actual);
            }
            List<ItemSuccess<T, R>> out = new ArrayList<>(chunk.size());
            for (int i = 0; i < chunk.size(); i++) {
                out.add(new ItemSuccess<>(chunk.get(i), results.get(i)));
            }
            return out;
        });
    }

    private <T, R> ChunkedProcessorResult<T, R> process(List<T> items, ChunkOptions options, CancellationToken token,
                                                       Function<List<T>, List<ItemSuccess<T, R>>> runChunk) {
        List<ItemSuccess<T, R>> successes = new ArrayList<>();
        List<ItemFailure<T>> failures = new ArrayList<>();
        if (items == null || items.isEmpty()) {
            return new ChunkedProcessorResult<>(successes, failures, 0, false);
        }
        List<List<T>> chunks = splitIntoChunks(items, options.chunkSize());
        int total = chunks.size();
        int processed = 0;
        log.info("Processing {} {} in {} chunk(s) of up to {}", items.size(), options.entityType(), total, options.chunkSize());

        for (int i = 0; i < total; i++) {
            if (token.isCancelled()) {
                log.warn("Cancelled {} processing after {}/{} chunk(s)", options.entityType(), processed, total);
                return new ChunkedProcessorResult<>(successes, failures, processed, true);
            }
            List<T> chunk = chunks.get(i);
            log.debug("Processing {} chunk {}/{} ({} item(s))", options.entityType(), i + 1, total, chunk.size());
            try {
                successes.addAll(runChunk.apply(chunk));
            } catch (CancellationException e) {
                failAll(chunk, e, failures);
                processed++;
                log.warn("Cancelled {} processing in chunk {}/{}", options.entityType(), i + 1, total);
                return new ChunkedProcessorResult<>(successes, failures, processed, true);
            } catch (RuntimeException e) {
                log.warn("Chunk {}/{} of {} failed: {}", i + 1, total, options.entityType(), e.getMessage());
                failAll(chunk, e, failures);
            } catch (Error e) {
                throw e;
            } catch (Throwable t) {
                // sneaky-thrown checked exception; keep its string form
                failAll(chunk, new StoreSyncException(String.valueOf(t), t), failures);
            }
            processed++;
            if (i < total - 1) {
                long delay = rateLimiter != null ? rateLimiter.getAdaptiveDelay(options.delayMs()) : options.delayMs();
                if (delay > 0) {
                    try {
                        sleeper.sleep(delay, token);
                    } catch (CancellationException e) {
                        log.warn("Cancelled {} processing after {}/{} chunk(s)", options.entityType(), processed, total);
                        return new ChunkedProcessorResult<>(successes, failures, processed, true);
                    }
                }
            }
        }
        log.info("Processed {} {}: {} succeeded, {} failed", items.size(), options.entityType(), successes.size(), failures.size());
        return new ChunkedProcessorResult<>(successes, failures, processed, false);
    }

    private static <T> void failAll(List<T> chunk, RuntimeException error, List<ItemFailure<T>> failures) {
        for (T item : chunk) {
            failures.add(new ItemFailure<>(item, error));
        }
    }
}
