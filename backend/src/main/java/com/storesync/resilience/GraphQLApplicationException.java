package com.storesync.resilience;

import com.storesync.common.StoreSyncException;

import java.util.List;

/**
 * Application-level GraphQL error, e.g. a mutation payload {@code errors} entry. Never retried.
 */
public class GraphQLApplicationException extends StoreSyncException {

    private final List<GraphQLErrorDetail> errors;

    public GraphQLApplicationException(String message, List<GraphQLErrorDetail> errors) {
        this(message, errors, null);
    }

    public GraphQLApplicationException(String message, List<GraphQLErrorDetail> errors, Throwable cause) {
        super(message, cause);
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public List<GraphQLErrorDetail> getErrors() {
        return errors;
    }

    /** Field paths reported by the server, e.g. ["input", "slug"]. */
    public List<String> getFieldPaths() {
        return errors.stream()
                .filter(e -> !e.path().isEmpty())
                .map(e -> String.join(".", e.path()))
                .toList();
    }
}
