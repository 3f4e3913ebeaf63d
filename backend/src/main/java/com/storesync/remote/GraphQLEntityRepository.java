package com.storesync.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.storesync.domain.EntityType;
import com.storesync.domain.RemoteEntity;
import com.storesync.reconcile.EntityRepository;
import com.storesync.resilience.GraphQLApplicationException;
import com.storesync.resilience.GraphQLErrorDetail;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link EntityRepository} over GraphQL. The full listing of the family is fetched once, cached,
 * and used for lookups by key; a successful create or update evicts it.
 */
@Slf4j
public class GraphQLEntityRepository<T> implements EntityRepository<T> {

    static final int PAGE_SIZE = 100;
    private static final int MAX_PAGES = 1000;

    private final GraphQLClient client;
    private final EntityMapping<T> mapping;
    private final ReferenceResolver references;
    private final Cache cache;

    public GraphQLEntityRepository(GraphQLClient client, EntityMapping<T> mapping, ReferenceResolver references, Cache cache) {
        this.client = client;
        this.mapping = mapping;
        this.references = references;
        this.cache = cache;
    }

    @Override
    public EntityType entityType() {
        return mapping.entityType();
    }

    @Override
    public List<T> fetchAll() {
        return listRemote().stream().map(RemoteEntity::entity).toList();
    }

    @Override
    public Optional<RemoteEntity<T>> findByKey(String key) {
        return listRemote().stream()
                .filter(e -> key.equals(mapping.keyOf(e.entity())))
                .findFirst();
    }

    @Override
    public RemoteEntity<T> create(T input) {
        JsonNode data = client.execute(mapping.createMutation(), mapping.createVariables(input, references));
        RemoteEntity<T> created = readPayload(data, mapping.createField());
        evict();
        return created;
    }

    @Override
    public RemoteEntity<T> update(String id, T input) {
        T current = listRemote().stream()
                .filter(e -> id.equals(e.id()))
                .map(RemoteEntity::entity)
                .findFirst()
                .orElse(null);
        Map<String, Object> variables = new HashMap<>();
        variables.put("id", id);
        variables.put("input", mapping.updateInput(input, current, references));
        JsonNode data = client.execute(mapping.updateMutation(), variables);
        RemoteEntity<T> updated = readPayload(data, mapping.updateField());
        evict();
        return updated;
    }

    private List<RemoteEntity<T>> listRemote() {
        if (cache == null) {
            return loadAll();
        }
        try {
            return cache.get(cacheKey(), this::loadAll);
        } catch (Cache.ValueRetrievalException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    private List<RemoteEntity<T>> loadAll() {
        List<RemoteEntity<T>> all = new ArrayList<>();
        String after = null;
        for (int page = 0; page < MAX_PAGES; page++) {
            Map<String, Object> variables = new HashMap<>();
            variables.put("first", PAGE_SIZE);
            variables.put("after", after);
            JsonNode listing = client.execute(mapping.listQuery(), variables).path(mapping.listField());
            if (listing.isArray()) {
                listing.forEach(node -> all.add(toRemote(node)));
                break;
            }
            listing.path("edges").forEach(edge -> all.add(toRemote(edge.path("node"))));
            JsonNode pageInfo = listing.path("pageInfo");
            if (!pageInfo.path("hasNextPage").asBoolean(false)) {
                break;
            }
            after = pageInfo.path("endCursor").asText(null);
        }
        log.debug("Loaded {} remote {}", all.size(), mapping.entityType().getDisplayName().toLowerCase());
        return List.copyOf(all);
    }

    private RemoteEntity<T> readPayload(JsonNode data, String field) {
        JsonNode payload = data.path(field);
        JsonNode errors = payload.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<GraphQLErrorDetail> details = new ArrayList<>();
            List<String> messages = new ArrayList<>();
            for (JsonNode err : errors) {
                String f = err.path("field").isNull() ? null : err.path("field").asText(null);
                String message = err.path("message").asText("unknown error");
                String code = err.path("code").isNull() ? null : err.path("code").asText(null);
                details.add(new GraphQLErrorDetail(message, code, f != null ? List.of(f) : List.of()));
                messages.add(f != null ? f + ": " + message : message);
            }
            throw new GraphQLApplicationException(field + " failed: " + String.join("; ", messages), details);
        }
        JsonNode node = payload.path(mapping.resultField());
        if (node.isMissingNode() || node.isNull()) {
            throw new GraphQLApplicationException(field + " returned no " + mapping.resultField(), List.of());
        }
        return toRemote(node);
    }

    private RemoteEntity<T> toRemote(JsonNode node) {
        return new RemoteEntity<>(node.path("id").asText(), mapping.fromNode(node));
    }

    private void evict() {
        if (cache != null) {
            cache.evict(cacheKey());
        }
    }

    private String cacheKey() {
        return mapping.entityType().name();
    }
}
