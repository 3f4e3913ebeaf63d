package com.storesync.remote.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.storesync.domain.EntityType;
import com.storesync.domain.Warehouse;
import com.storesync.remote.EntityMapping;
import com.storesync.remote.ReferenceResolver;

import java.util.LinkedHashMap;
import java.util.Map;

public class WarehouseMapping implements EntityMapping<Warehouse> {

    private static final String FIELDS =
            "id slug name email address { streetAddress1 city postalCode country { code } }";

    @Override
    public EntityType entityType() {
        return EntityType.WAREHOUSES;
    }

    @Override
    public String keyOf(Warehouse entity) {
        return entity.getSlug();
    }

    @Override
    public String listQuery() {
        return """
                query Warehouses($first: Int!, $after: String) {
                  warehouses(first: $first, after: $after) {
                    edges { node { %s } }
                    pageInfo { hasNextPage endCursor }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String listField() {
        return "warehouses";
    }

    @Override
    public String createMutation() {
        return """
                mutation CreateWarehouse($input: WarehouseCreateInput!) {
                  createWarehouse(input: $input) {
                    warehouse { %s }
                    errors { field message code }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String createField() {
        return "createWarehouse";
    }

    @Override
    public String updateMutation() {
        return """
                mutation UpdateWarehouse($id: ID!, $input: WarehouseUpdateInput!) {
                  updateWarehouse(id: $id, input: $input) {
                    warehouse { %s }
                    errors { field message code }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String updateField() {
        return "updateWarehouse";
    }

    @Override
    public String resultField() {
        return "warehouse";
    }

    @Override
    public Map<String, Object> createVariables(Warehouse input, ReferenceResolver references) {
        Map<String, Object> in = toInput(input);
        in.put("slug", input.getSlug());
        return Map.of("input", in);
    }

    @Override
    public Map<String, Object> updateInput(Warehouse desired, Warehouse current, ReferenceResolver references) {
        return toInput(desired);
    }

    private static Map<String, Object> toInput(Warehouse w) {
        Map<String, Object> in = new LinkedHashMap<>();
        Json.putIfNotNull(in, "name", w.getName());
        Json.putIfNotNull(in, "email", w.getEmail());
        Map<String, Object> address = new LinkedHashMap<>();
        Json.putIfNotNull(address, "streetAddress1", w.getStreetAddress1());
        Json.putIfNotNull(address, "city", w.getCity());
        Json.putIfNotNull(address, "postalCode", w.getPostalCode());
        Json.putIfNotNull(address, "country", w.getCountry());
        if (!address.isEmpty()) {
            in.put("address", address);
        }
        return in;
    }

    @Override
    public Warehouse fromNode(JsonNode node) {
        JsonNode address = node.path("address");
        return new Warehouse(
                Json.text(node, "slug"),
                Json.text(node, "name"),
                Json.text(node, "email"),
                Json.text(address, "streetAddress1"),
                Json.text(address, "city"),
                Json.text(address, "postalCode"),
                Json.text(address.path("country"), "code"));
    }
}
