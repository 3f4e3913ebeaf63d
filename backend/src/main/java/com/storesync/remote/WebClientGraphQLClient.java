package com.storesync.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storesync.common.StoreSyncException;
import com.storesync.resilience.GraphQLErrorDetail;
import com.storesync.resilience.RemoteCallException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * GraphQL over HTTP using WebClient. Requests are paced by a local resilience4j limiter; the call
 * blocks until the response arrives or the request timeout passes.
 */
@Slf4j
public class WebClientGraphQLClient implements GraphQLClient {

    private final WebClient webClient;
    private final RateLimiter requestLimiter;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public WebClientGraphQLClient(WebClient.Builder builder, String endpointUrl, String token,
                                  RateLimiter requestLimiter, ObjectMapper objectMapper, Duration requestTimeout) {
        WebClient.Builder b = builder.clone()
                .baseUrl(endpointUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (token != null && !token.isBlank()) {
            b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }
        this.webClient = b.build();
        this.requestLimiter = requestLimiter;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public JsonNode execute(String document, Map<String, Object> variables) {
        long acquireStart = System.nanoTime();
        if (!requestLimiter.acquirePermission()) {
            throw RemoteCallException.network("Local request limiter timed out before GraphQL call", null);
        }
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (waitedMs >= 1000L) {
            log.debug("Local request limiter delayed GraphQL call by {} ms", waitedMs);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", document);
        body.put("variables", variables != null ? variables : Map.of());
        String raw = webClient.post()
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .onErrorMap(WebClientResponseException.class, WebClientGraphQLClient::toRemoteException)
                .onErrorMap(WebClientRequestException.class, e -> RemoteCallException.network(
                        "Network error calling " + e.getUri() + ": " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> RemoteCallException.network(
                        "GraphQL request timed out after " + requestTimeout.toMillis() + " ms", e))
                .block();
        JsonNode root = parse(raw);
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw RemoteCallException.graphQL(readErrors(errors));
        }
        return root.path("data");
    }

    private JsonNode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new StoreSyncException("Empty GraphQL response");
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new StoreSyncException("Invalid GraphQL response: " + e.getOriginalMessage(), e);
        }
    }

    static List<GraphQLErrorDetail> readErrors(JsonNode errors) {
        List<GraphQLErrorDetail> details = new ArrayList<>();
        for (JsonNode err : errors) {
            List<String> path = new ArrayList<>();
            for (JsonNode p : err.path("path")) {
                path.add(p.asText());
            }
            JsonNode code = err.path("extensions").path("code");
            details.add(new GraphQLErrorDetail(err.path("message").asText("Unknown GraphQL error"),
                    code.isMissingNode() || code.isNull() ? null : code.asText(), path));
        }
        return details;
    }

    private static RemoteCallException toRemoteException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        return RemoteCallException.http(status, e.getHeaders().toSingleValueMap(),
                "HTTP " + status + " from GraphQL endpoint: " + e.getStatusText(), e);
    }
}
