package com.storesync.resilience;

import com.storesync.common.CancellationToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyControllerTest {

    @Test
    void startsAtCeiling() {
        ConcurrencyController controller = new ConcurrencyController();
        assertThat(controller.getCurrentLimit()).isEqualTo(10);
    }

    @Test
    @DisplayName("rate limits shrink by 2 down to the floor, successes grow by 1 up to the ceiling")
    void adjustConcurrency_respectsBounds() {
        ConcurrencyController controller = new ConcurrencyController();

        controller.adjustConcurrency(true);
        assertThat(controller.getCurrentLimit()).isEqualTo(8);

        for (int i = 0; i < 10; i++) {
            controller.adjustConcurrency(true);
        }
        assertThat(controller.getCurrentLimit()).isEqualTo(1);

        controller.adjustConcurrency(false);
        assertThat(controller.getCurrentLimit()).isEqualTo(2);

        for (int i = 0; i < 20; i++) {
            controller.adjustConcurrency(false);
        }
        assertThat(controller.getCurrentLimit()).isEqualTo(10);
    }

    @Test
    void run_returnsOperationResult() {
        ConcurrencyController controller = new ConcurrencyController();
        assertThat(controller.run(() -> "ok", CancellationToken.none())).isEqualTo("ok");
        assertThat(controller.getInFlight()).isZero();
    }

    @Test
    void run_releasesSlotWhenOperationThrows() {
        ConcurrencyController controller = new ConcurrencyController(1, 1);
        assertThatThrownBy(() -> controller.run(() -> {
            throw new IllegalStateException("boom");
        }, CancellationToken.none())).isInstanceOf(IllegalStateException.class);

        assertThat(controller.run(() -> 1, CancellationToken.none())).isEqualTo(1);
    }

    @Test
    @DisplayName("never more operations in flight than the current limit")
    void run_boundsInFlightOperations() throws Exception {
        ConcurrencyController controller = new ConcurrencyController(1, 3);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxSeen = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < 24; i++) {
                futures.add(CompletableFuture.supplyAsync(() -> controller.run(() -> {
                    int now = inFlight.incrementAndGet();
                    maxSeen.accumulateAndGet(now, Math::max);
                    sleepQuietly(10);
                    inFlight.decrementAndGet();
                    return now;
                }, CancellationToken.none()), pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertThat(maxSeen.get()).isLessThanOrEqualTo(3);
    }

    @Test
    void waitingForSlot_stopsOnCancellation() throws Exception {
        ConcurrencyController controller = new ConcurrencyController(1, 1);
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            pool.submit(() -> controller.run(() -> {
                holding.countDown();
                awaitQuietly(release);
                return null;
            }, CancellationToken.none()));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

            CancellationToken token = new CancellationToken();
            token.cancel();
            assertThatThrownBy(() -> controller.run(() -> "never", token))
                    .isInstanceOf(CancellationException.class);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    private static void sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
