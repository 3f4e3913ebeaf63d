package com.storesync.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.storesync.domain.EntityType;

import java.util.Map;

/**
 * GraphQL documents and JSON conversion for one entity family.
 * List queries take {@code $first}/{@code $after} and return either a plain list or a connection.
 */
public interface EntityMapping<T> {

    EntityType entityType();

    String keyOf(T entity);

    String listQuery();

    /** Field under {@code data} holding the listing. */
    String listField();

    /** Mutation taking {@code $input}, plus {@code $parent} where the family needs one. */
    String createMutation();

    String createField();

    /** Mutation taking {@code $id} and {@code $input}. */
    String updateMutation();

    String updateField();

    /** Field of a mutation payload holding the entity, e.g. "channel". */
    String resultField();

    Map<String, Object> createVariables(T input, ReferenceResolver references);

    /** Input for the update mutation; {@code current} is the remote state before the update. */
    Map<String, Object> updateInput(T desired, T current, ReferenceResolver references);

    T fromNode(JsonNode node);
}
