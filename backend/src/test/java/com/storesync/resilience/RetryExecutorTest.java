package com.storesync.resilience;

import com.storesync.common.CancellationToken;
import com.storesync.common.MutableClock;
import com.storesync.common.RecordingSleeper;
import com.storesync.common.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private ResilienceContext context;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
        sleeper = new RecordingSleeper(clock);
        context = ResilienceContext.create(clock, new RetryPolicy(100L, 2.0, 30_000L, 0, 5), sleeper);
        executor = context.getRetryExecutor();
        context.getTracker().startStageContext("test");
    }

    @Test
    void success_firstAttempt_noWaits() {
        String result = executor.execute("op", () -> "done", CancellationToken.none());

        assertThat(result).isEqualTo("done");
        assertThat(sleeper.delays()).isEmpty();
        assertThat(context.getConcurrencyController().getCurrentLimit()).isEqualTo(10);
    }

    @Test
    @DisplayName("network errors are retried with exponential backoff and tracked")
    void networkErrors_retriedWithBackoff() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("op", () -> {
            if (calls.incrementAndGet() <= 2) {
                throw RemoteCallException.network("ECONNRESET", null);
            }
            return "ok";
        }, CancellationToken.none());

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(sleeper.delays()).containsExactly(100L, 200L);
        StageMetrics metrics = context.getTracker().endStageContext().orElseThrow();
        assertThat(metrics.networkErrors()).isEqualTo(2);
        assertThat(metrics.retryAttempts()).isEqualTo(2);
        assertThat(metrics.rateLimitHits()).isZero();
    }

    @Test
    @DisplayName("rate limit with Retry-After waits the hint, then backs off, and narrows concurrency")
    void rateLimit_honoursRetryAfter() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("op", () -> {
            if (calls.incrementAndGet() == 1) {
                throw RemoteCallException.http(429, Map.of("Retry-After", "3"), "HTTP 429", null);
            }
            return "ok";
        }, CancellationToken.none());

        assertThat(result).isEqualTo("ok");
        assertThat(sleeper.delays()).containsExactly(3000L, 100L);
        assertThat(context.getRateLimiter().getRecentRateLimitCount()).isEqualTo(1);
        // 10 - 2 on the rate limit, + 1 on the success
        assertThat(context.getConcurrencyController().getCurrentLimit()).isEqualTo(9);
        StageMetrics metrics = context.getTracker().endStageContext().orElseThrow();
        assertThat(metrics.rateLimitHits()).isEqualTo(1);
        assertThat(metrics.retryAttempts()).isEqualTo(1);
    }

    @Test
    void graphQLError_isNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("create channel", () -> {
            calls.incrementAndGet();
            throw RemoteCallException.graphQL(List.of(GraphQLErrorDetail.of("Invalid currency")));
        }, CancellationToken.none()))
                .isInstanceOf(GraphQLApplicationException.class)
                .hasMessageContaining("Invalid currency");

        assertThat(calls).hasValue(1);
        assertThat(sleeper.delays()).isEmpty();
        StageMetrics metrics = context.getTracker().endStageContext().orElseThrow();
        assertThat(metrics.graphqlErrors()).isEqualTo(1);
        assertThat(metrics.retryAttempts()).isZero();
    }

    @Test
    void unclassifiedError_propagatesAsIs() {
        IllegalStateException boom = new IllegalStateException("unexpected state");

        assertThatThrownBy(() -> executor.execute("op", () -> {
            throw boom;
        }, CancellationToken.none())).isSameAs(boom);
        assertThat(sleeper.delays()).isEmpty();
    }

    @Test
    @DisplayName("after maxRetries retries a NetworkException carries the attempt count")
    void exhaustion_throwsTypedException() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("fetch channels", () -> {
            calls.incrementAndGet();
            throw RemoteCallException.http(503, Map.of(), "HTTP 503", null);
        }, CancellationToken.none()))
                .isInstanceOfSatisfying(NetworkException.class, e -> assertThat(e.getAttempts()).isEqualTo(6));

        assertThat(calls).hasValue(6);
        assertThat(sleeper.delays()).containsExactly(100L, 200L, 400L, 800L, 1600L);
        assertThat(context.getTracker().endStageContext().orElseThrow().retryAttempts()).isEqualTo(5);
    }

    @Test
    void rateLimitExhaustion_throwsRateLimitException() {
        assertThatThrownBy(() -> executor.execute("op", () -> {
            throw new RuntimeException("Too many requests");
        }, CancellationToken.none()))
                .isInstanceOfSatisfying(RateLimitException.class, e -> assertThat(e.getAttempts()).isEqualTo(6));
        assertThat(context.getConcurrencyController().getCurrentLimit()).isEqualTo(1);
    }

    @Test
    void cancelledToken_stopsBeforeCallingOperation() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("op", calls::incrementAndGet, token))
                .isInstanceOf(CancellationException.class);
        assertThat(calls).hasValue(0);
    }

    @Test
    void pendingRetryAfter_isWaitedOutBeforeFirstAttempt() {
        context.getRateLimiter().trackRateLimit(2000L);

        executor.execute("op", () -> "ok", CancellationToken.none());

        assertThat(sleeper.delays()).containsExactly(2000L);
    }

    @Test
    void resilienceContext_executeRunsThroughConcurrencyGate() {
        assertThat(context.execute("op", () -> 42, CancellationToken.none())).isEqualTo(42);
        assertThat(context.getConcurrencyController().getInFlight()).isZero();
    }
}
