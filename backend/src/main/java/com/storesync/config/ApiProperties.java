package com.storesync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Store GraphQL API endpoint and local request pacing. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "storesync.api")
@NoArgsConstructor
@Getter
@Setter
public class ApiProperties {

    /** GraphQL endpoint URL, e.g. https://store.example.com/graphql/. */
    private String url = "http://localhost:8000/graphql/";

    /** App or staff token sent as Bearer authorization. Empty = anonymous. */
    private String token = "";

    /** Local limiter: max GraphQL requests per second across all workers. Default 20. */
    private int maxRequestsPerSecond = 20;

    /** Max time a request waits for a local limiter permit. Default 30000. */
    private long localLimiterTimeoutMs = 30_000L;

    /** Per-request timeout in ms. Default 30000. */
    private long requestTimeoutMs = 30_000L;
}
