package com.storesync.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Executes one GraphQL document against the store API.
 */
public interface GraphQLClient {

    /**
     * @return the {@code data} node of the response
     * @throws com.storesync.resilience.RemoteCallException on HTTP, transport or top-level GraphQL errors
     */
    JsonNode execute(String document, Map<String, Object> variables);
}
