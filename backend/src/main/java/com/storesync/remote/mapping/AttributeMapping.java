package com.storesync.remote.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.storesync.domain.Attribute;
import com.storesync.domain.EntityType;
import com.storesync.remote.EntityMapping;
import com.storesync.remote.ReferenceResolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attribute values only grow: an update adds the missing values and never removes any.
 */
public class AttributeMapping implements EntityMapping<Attribute> {

    private static final String FIELDS = "id name inputType choices(first: 100) { edges { node { name } } }";

    @Override
    public EntityType entityType() {
        return EntityType.ATTRIBUTES;
    }

    @Override
    public String keyOf(Attribute entity) {
        return entity.getName();
    }

    @Override
    public String listQuery() {
        return """
                query Attributes($first: Int!, $after: String) {
                  attributes(first: $first, after: $after) {
                    edges { node { %s } }
                    pageInfo { hasNextPage endCursor }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String listField() {
        return "attributes";
    }

    @Override
    public String createMutation() {
        return """
                mutation CreateAttribute($input: AttributeCreateInput!) {
                  attributeCreate(input: $input) {
                    attribute { %s }
                    errors { field message code }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String createField() {
        return "attributeCreate";
    }

    @Override
    public String updateMutation() {
        return """
                mutation UpdateAttribute($id: ID!, $input: AttributeUpdateInput!) {
                  attributeUpdate(id: $id, input: $input) {
                    attribute { %s }
                    errors { field message code }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String updateField() {
        return "attributeUpdate";
    }

    @Override
    public String resultField() {
        return "attribute";
    }

    @Override
    public Map<String, Object> createVariables(Attribute input, ReferenceResolver references) {
        Map<String, Object> in = new LinkedHashMap<>();
        in.put("name", input.getName());
        in.put("type", "PRODUCT_TYPE");
        in.put("inputType", input.getInputType());
        if (input.getValues() != null) {
            in.put("values", named(input.getValues()));
        }
        return Map.of("input", in);
    }

    @Override
    public Map<String, Object> updateInput(Attribute desired, Attribute current, ReferenceResolver references) {
        Map<String, Object> in = new LinkedHashMap<>();
        in.put("name", desired.getName());
        if (desired.getValues() != null) {
            List<String> missing = new ArrayList<>(desired.getValues());
            if (current != null && current.getValues() != null) {
                missing.removeAll(current.getValues());
            }
            if (!missing.isEmpty()) {
                in.put("addValues", named(missing));
            }
        }
        return in;
    }

    private static List<Map<String, Object>> named(List<String> values) {
        return values.stream().map(v -> Map.<String, Object>of("name", v)).toList();
    }

    @Override
    public Attribute fromNode(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode edge : node.path("choices").path("edges")) {
            String name = Json.text(edge.path("node"), "name");
            if (name != null) {
                values.add(name);
            }
        }
        return new Attribute(Json.text(node, "name"), Json.text(node, "inputType"), values);
    }
}
