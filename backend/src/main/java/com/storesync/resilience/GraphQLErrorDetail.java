package com.storesync.resilience;

import java.util.List;

/**
 * One entry of a GraphQL {@code errors} array: message, optional extension code, optional path.
 */
public record GraphQLErrorDetail(String message, String code, List<String> path) {

    public GraphQLErrorDetail {
        path = path != null ? List.copyOf(path) : List.of();
    }

    public static GraphQLErrorDetail of(String message) {
        return new GraphQLErrorDetail(message, null, List.of());
    }
}
