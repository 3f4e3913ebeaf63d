package com.storesync.resilience;

public enum ErrorKind {
    /** Server asked us to slow down (HTTP 429, throttling message, TOO_MANY_REQUESTS). Retried. */
    RATE_LIMITED,
    /** Connection refused/reset, DNS, timeout, 502/503/504. Retried. */
    NETWORK,
    /** Application-level GraphQL error. Not retried. */
    GRAPHQL,
    /** Anything else. Not retried. */
    UNCLASSIFIED
}
