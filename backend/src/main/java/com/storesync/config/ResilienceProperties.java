package com.storesync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry backoff and adaptive concurrency bounds for remote operations.
 */
@ConfigurationProperties(prefix = "storesync.resilience")
@NoArgsConstructor
@Getter
@Setter
public class ResilienceProperties {

    /** Retries after the first attempt. Default 5. */
    private int maxRetries = 5;

    /** Delay before the first retry; multiplied each retry. Default 1000. */
    private long baseDelayMs = 1000L;

    /** Backoff multiplier. Default 2. */
    private double multiplier = 2.0;

    /** Upper bound for a single backoff delay. Default 30000. */
    private long maxDelayMs = 30_000L;

    /** Jitter factor 0..1 (0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Concurrency floor after repeated rate limits. Default 1. */
    private int minConcurrency = 1;

    /** Starting and maximum concurrency. Default 10. */
    private int maxConcurrency = 10;
}
