package com.storesync.remote.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.storesync.domain.EntityType;
import com.storesync.domain.ProductType;
import com.storesync.remote.EntityMapping;
import com.storesync.remote.ReferenceResolver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attribute assignments are sent as attribute ids, resolved by attribute name.
 */
public class ProductTypeMapping implements EntityMapping<ProductType> {

    private static final String FIELDS =
            "id name isShippingRequired productAttributes { name } variantAttributes { name }";

    @Override
    public EntityType entityType() {
        return EntityType.PRODUCT_TYPES;
    }

    @Override
    public String keyOf(ProductType entity) {
        return entity.getName();
    }

    @Override
    public String listQuery() {
        return """
                query ProductTypes($first: Int!, $after: String) {
                  productTypes(first: $first, after: $after) {
                    edges { node { %s } }
                    pageInfo { hasNextPage endCursor }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String listField() {
        return "productTypes";
    }

    @Override
    public String createMutation() {
        return """
                mutation CreateProductType($input: ProductTypeInput!) {
                  productTypeCreate(input: $input) {
                    productType { %s }
                    errors { field message code }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String createField() {
        return "productTypeCreate";
    }

    @Override
    public String updateMutation() {
        return """
                mutation UpdateProductType($id: ID!, $input: ProductTypeInput!) {
                  productTypeUpdate(id: $id, input: $input) {
                    productType { %s }
                    errors { field message code }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String updateField() {
        return "productTypeUpdate";
    }

    @Override
    public String resultField() {
        return "productType";
    }

    @Override
    public Map<String, Object> createVariables(ProductType input, ReferenceResolver references) {
        return Map.of("input", toInput(input, references));
    }

    @Override
    public Map<String, Object> updateInput(ProductType desired, ProductType current, ReferenceResolver references) {
        return toInput(desired, references);
    }

    private static Map<String, Object> toInput(ProductType type, ReferenceResolver references) {
        Map<String, Object> in = new LinkedHashMap<>();
        in.put("name", type.getName());
        Json.putIfNotNull(in, "isShippingRequired", type.getIsShippingRequired());
        if (type.getProductAttributes() != null) {
            in.put("productAttributes", attributeIds(type.getProductAttributes(), references));
        }
        if (type.getVariantAttributes() != null) {
            in.put("variantAttributes", attributeIds(type.getVariantAttributes(), references));
        }
        return in;
    }

    private static List<String> attributeIds(List<String> names, ReferenceResolver references) {
        return names.stream().map(n -> references.requireId(EntityType.ATTRIBUTES, n)).toList();
    }

    @Override
    public ProductType fromNode(JsonNode node) {
        return new ProductType(
                Json.text(node, "name"),
                Json.bool(node, "isShippingRequired"),
                Json.texts(node.path("productAttributes"), "name"),
                Json.texts(node.path("variantAttributes"), "name"));
    }
}
