package com.storesync.resilience;

import com.storesync.common.StoreSyncException;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raw failure of a remote GraphQL call, before classification: HTTP status and headers,
 * top-level GraphQL errors, or a transport-level (network) failure.
 */
public class RemoteCallException extends StoreSyncException {

    private final Integer status;
    private final Map<String, String> headers;
    private final List<GraphQLErrorDetail> graphQLErrors;
    private final boolean networkError;

    public RemoteCallException(String message, Integer status, Map<String, String> headers,
                               List<GraphQLErrorDetail> graphQLErrors, boolean networkError, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.headers = headers == null ? Map.of() : headers.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(e -> e.getKey().toLowerCase(Locale.ROOT), Map.Entry::getValue, (a, b) -> a));
        this.graphQLErrors = graphQLErrors != null ? List.copyOf(graphQLErrors) : List.of();
        this.networkError = networkError;
    }

    public static RemoteCallException http(int status, Map<String, String> headers, String message, Throwable cause) {
        return new RemoteCallException(message, status, headers, List.of(), false, cause);
    }

    public static RemoteCallException network(String message, Throwable cause) {
        return new RemoteCallException(message, null, Map.of(), List.of(), true, cause);
    }

    public static RemoteCallException graphQL(List<GraphQLErrorDetail> errors) {
        String message = errors.stream().map(GraphQLErrorDetail::message).collect(Collectors.joining("; "));
        return new RemoteCallException("GraphQL error: " + message, null, Map.of(), errors, false, null);
    }

    public Integer getStatus() {
        return status;
    }

    /** Case-insensitive header lookup; null when absent. */
    public String getHeader(String name) {
        return name == null ? null : headers.get(name.toLowerCase(Locale.ROOT));
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public List<GraphQLErrorDetail> getGraphQLErrors() {
        return graphQLErrors;
    }

    public boolean isNetworkError() {
        return networkError;
    }
}
