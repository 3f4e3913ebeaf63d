package com.storesync.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_firstRetry_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(1000L, 2.0, 30_000L, 0.2, 5);
        for (int i = 0; i < 20; i++) {
            long d = policy.delayMs(0);
            assertThat(d).isBetween(800L, 1200L); // ±20% of 1000
        }
    }

    @Test
    void delayMs_exponentialIncreases() {
        RetryPolicy policy = new RetryPolicy(100L, 2.0, 30_000L, 0, 5); // no jitter for deterministic test
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
    }

    @Test
    void delayMs_neverExceedsCapEvenWithJitter() {
        RetryPolicy policy = new RetryPolicy(1000L, 2.0, 30_000L, 0.2, 10);
        assertThat(new RetryPolicy(1000L, 2.0, 30_000L, 0, 10).delayMs(5)).isEqualTo(30_000L);
        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayMs(9)).isLessThanOrEqualTo(30_000L);
        }
    }

    @Test
    void defaultPolicy_hasFiveRetries() {
        assertThat(RetryPolicy.defaultPolicy().getMaxRetries()).isEqualTo(5);
        assertThat(RetryPolicy.defaultPolicy().getMaxDelayMs()).isEqualTo(30_000L);
    }

    @Test
    void rejectsMultiplierBelowOne() {
        assertThatThrownBy(() -> new RetryPolicy(100L, 0.5, 1000L, 0, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
