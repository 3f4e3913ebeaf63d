package com.storesync.remote.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.storesync.domain.EntityType;
import com.storesync.domain.Product;
import com.storesync.remote.EntityMapping;
import com.storesync.remote.ReferenceResolver;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Product type and category are sent as ids resolved from their natural keys. The product type
 * of an existing product is never changed.
 */
public class ProductMapping implements EntityMapping<Product> {

    private static final String FIELDS = "id slug name description productType { name } category { slug }";

    @Override
    public EntityType entityType() {
        return EntityType.PRODUCTS;
    }

    @Override
    public String keyOf(Product entity) {
        return entity.getSlug();
    }

    @Override
    public String listQuery() {
        return """
                query Products($first: Int!, $after: String) {
                  products(first: $first, after: $after) {
                    edges { node { %s } }
                    pageInfo { hasNextPage endCursor }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String listField() {
        return "products";
    }

    @Override
    public String createMutation() {
        return """
                mutation CreateProduct($input: ProductCreateInput!) {
                  productCreate(input: $input) {
                    product { %s }
                    errors { field message code }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String createField() {
        return "productCreate";
    }

    @Override
    public String updateMutation() {
        return """
                mutation UpdateProduct($id: ID!, $input: ProductInput!) {
                  productUpdate(id: $id, input: $input) {
                    product { %s }
                    errors { field message code }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String updateField() {
        return "productUpdate";
    }

    @Override
    public String resultField() {
        return "product";
    }

    @Override
    public Map<String, Object> createVariables(Product input, ReferenceResolver references) {
        Map<String, Object> in = new LinkedHashMap<>();
        in.put("slug", input.getSlug());
        in.put("name", input.getName());
        Json.putIfNotNull(in, "description", input.getDescription());
        in.put("productType", references.requireId(EntityType.PRODUCT_TYPES, input.getProductType()));
        in.put("category", references.requireId(EntityType.CATEGORIES, input.getCategory()));
        return Map.of("input", in);
    }

    @Override
    public Map<String, Object> updateInput(Product desired, Product current, ReferenceResolver references) {
        Map<String, Object> in = new LinkedHashMap<>();
        Json.putIfNotNull(in, "name", desired.getName());
        Json.putIfNotNull(in, "description", desired.getDescription());
        if (desired.getCategory() != null) {
            in.put("category", references.requireId(EntityType.CATEGORIES, desired.getCategory()));
        }
        return in;
    }

    @Override
    public Product fromNode(JsonNode node) {
        return new Product(
                Json.text(node, "slug"),
                Json.text(node, "name"),
                Json.text(node, "description"),
                Json.text(node.path("productType"), "name"),
                Json.text(node.path("category"), "slug"));
    }
}
