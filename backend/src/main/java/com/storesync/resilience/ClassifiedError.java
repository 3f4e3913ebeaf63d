package com.storesync.resilience;

import com.storesync.common.StoreSyncException;

import java.util.List;

/**
 * Outcome of {@link ErrorClassifier#classify(Throwable)}.
 *
 * @param retryAfterMs server wait hint, only for {@link ErrorKind#RATE_LIMITED}; may be null
 */
public record ClassifiedError(ErrorKind kind, Long retryAfterMs, String message, Throwable cause) {

    public boolean retryable() {
        return kind == ErrorKind.RATE_LIMITED || kind == ErrorKind.NETWORK;
    }

    /**
     * Exception to surface once retrying stops. Rate-limit and network failures become their typed
     * variants carrying the attempt count; unclassified runtime failures are propagated as they are.
     */
    public RuntimeException toFailure(String operationName, int attempts) {
        switch (kind) {
            case RATE_LIMITED:
                return new RateLimitException(operationName + " rate limited after " + attempts
                        + " attempt(s): " + message, retryAfterMs, attempts, cause);
            case NETWORK:
                return new NetworkException(operationName + " failed after " + attempts
                        + " attempt(s): " + message, attempts, cause);
            case GRAPHQL:
                if (cause instanceof GraphQLApplicationException g) {
                    return g;
                }
                List<GraphQLErrorDetail> details = cause instanceof RemoteCallException r ? r.getGraphQLErrors() : List.of();
                return new GraphQLApplicationException(operationName + ": " + message, details, cause);
            default:
                if (cause instanceof RuntimeException re) {
                    return re;
                }
                return new StoreSyncException(operationName + ": " + message, cause);
        }
    }
}
