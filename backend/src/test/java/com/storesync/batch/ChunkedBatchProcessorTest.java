package com.storesync.batch;

import com.storesync.common.CancellationToken;
import com.storesync.common.MutableClock;
import com.storesync.common.RecordingSleeper;
import com.storesync.resilience.AdaptiveRateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkedBatchProcessorTest {

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final ChunkedBatchProcessor processor = new ChunkedBatchProcessor(sleeper);
    private final ChunkOptions options = new ChunkOptions(2, 100L, "products");

    @Test
    void splitIntoChunks_keepsOrderAndRemainder() {
        assertThat(ChunkedBatchProcessor.splitIntoChunks(List.of(1, 2, 3, 4, 5), 2))
                .containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
        assertThat(ChunkedBatchProcessor.splitIntoChunks(List.of(), 3)).isEmpty();
        assertThatThrownBy(() -> ChunkedBatchProcessor.splitIntoChunks(List.of(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("a failing middle chunk fails its items only; later chunks still run")
    void failingChunk_isolated() {
        List<String> items = List.of("a", "b", "c", "d", "e", "f");

        ChunkedProcessorResult<String, String> result = processor.processInChunksPerItem(items, chunk -> {
            if (chunk.contains("c")) {
                throw new IllegalStateException("chunk rejected");
            }
            return chunk.stream().map(String::toUpperCase).collect(Collectors.toList());
        }, options, CancellationToken.none());

        assertThat(result.chunksProcessed()).isEqualTo(3);
        assertThat(result.cancelled()).isFalse();
        assertThat(result.successes()).extracting(ItemSuccess::item).containsExactly("a", "b", "e", "f");
        assertThat(result.successes()).extracting(ItemSuccess::result).containsExactly("A", "B", "E", "F");
        assertThat(result.failures()).extracting(ItemFailure::item).containsExactly("c", "d");
        assertThat(result.failures()).extracting(ItemFailure::message).containsOnly("chunk rejected");
        assertThat(result.processedItems()).isEqualTo(6);
        assertThat(sleeper.delays()).containsExactly(100L, 100L);
    }

    @Test
    void processInChunks_sharesChunkResultAcrossItems() {
        ChunkedProcessorResult<Integer, Integer> result = processor.processInChunks(List.of(1, 2, 3),
                chunk -> chunk.stream().mapToInt(Integer::intValue).sum(), options, CancellationToken.none());

        assertThat(result.successes()).extracting(ItemSuccess::result).containsExactly(3, 3, 3);
        assertThat(result.hasFailures()).isFalse();
    }

    @Test
    void shortResultList_failsWholeChunk() {
        ChunkedProcessorResult<String, String> result = processor.processInChunksPerItem(List.of("a", "b"),
                chunk -> List.of("only-one"), options, CancellationToken.none());

        assertThat(result.successes()).isEmpty();
        assertThat(result.failures()).hasSize(2);
        assertThat(result.failures().get(0).error()).isInstanceOf(BatchResultMismatchException.class);
    }

    @Test
    void cancellation_stopsBeforeNextChunk() {
        CancellationToken token = new CancellationToken();
        List<List<String>> seen = new ArrayList<>();

        ChunkedProcessorResult<String, String> result = processor.processInChunksPerItem(List.of("a", "b", "c", "d"),
                chunk -> {
                    seen.add(chunk);
                    token.cancel("stop");
                    return chunk;
                }, options, token);

        assertThat(seen).hasSize(1);
        assertThat(result.cancelled()).isTrue();
        assertThat(result.chunksProcessed()).isEqualTo(1);
        assertThat(result.successes()).extracting(ItemSuccess::item).containsExactly("a", "b");
    }

    @Test
    void emptyInput_returnsEmptyResult() {
        ChunkedProcessorResult<String, String> result = processor.processInChunksPerItem(List.of(),
                chunk -> chunk, options, CancellationToken.none());

        assertThat(result.chunksProcessed()).isZero();
        assertThat(result.processedItems()).isZero();
        assertThat(sleeper.delays()).isEmpty();
    }

    @Test
    @DisplayName("inter-chunk pause widens after recent rate limits")
    void adaptiveDelay_betweenChunks() {
        MutableClock clock = new MutableClock(0L);
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(clock);
        limiter.trackRateLimit(null);
        limiter.trackRateLimit(null);
        ChunkedBatchProcessor adaptive = new ChunkedBatchProcessor(limiter, sleeper);

        adaptive.processInChunksPerItem(List.of(1, 2, 3), chunk -> chunk, options, CancellationToken.none());

        assertThat(sleeper.delays()).containsExactly(400L);
    }

    @Test
    void interChunkPause_waitsOutServerRetryAfter() {
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(new MutableClock(0L));
        limiter.trackRateLimit(10_000L);
        ChunkedBatchProcessor adaptive = new ChunkedBatchProcessor(limiter, sleeper);

        adaptive.processInChunksPerItem(List.of(1, 2, 3), chunk -> chunk, options, CancellationToken.none());

        assertThat(sleeper.delays()).containsExactly(10_000L);
    }

    @Test
    void nullItems_areChunkedLikeAnyOther() {
        List<String> items = Arrays.asList("a", null, "c");

        ChunkedProcessorResult<String, String> result = processor.processInChunksPerItem(items,
                chunk -> new ArrayList<>(chunk), options, CancellationToken.none());

        assertThat(ChunkedBatchProcessor.splitIntoChunks(items, 2))
                .containsExactly(Arrays.asList("a", null), List.of("c"));
        assertThat(result.successes()).extracting(ItemSuccess::item).containsExactly("a", null, "c");
        assertThat(result.hasFailures()).isFalse();
    }

    @Test
    void chunkOptions_rejectInvalidValues() {
        assertThatThrownBy(() -> new ChunkOptions(0, 0L, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChunkOptions(1, -1L, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThat(ChunkOptions.defaults().chunkSize()).isEqualTo(ChunkOptions.DEFAULT_CHUNK_SIZE);
        assertThat(ChunkOptions.of("warehouses").withChunkSize(5).withDelayMs(0L))
                .isEqualTo(new ChunkOptions(5, 0L, "warehouses"));
    }
}
