package com.storesync.remote.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.storesync.domain.Category;
import com.storesync.domain.EntityType;
import com.storesync.remote.EntityMapping;
import com.storesync.remote.ReferenceResolver;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The parent is passed as a separate mutation argument on create and cannot be moved on update.
 */
public class CategoryMapping implements EntityMapping<Category> {

    private static final String FIELDS = "id slug name description parent { slug }";

    @Override
    public EntityType entityType() {
        return EntityType.CATEGORIES;
    }

    @Override
    public String keyOf(Category entity) {
        return entity.getSlug();
    }

    @Override
    public String listQuery() {
        return """
                query Categories($first: Int!, $after: String) {
                  categories(first: $first, after: $after) {
                    edges { node { %s } }
                    pageInfo { hasNextPage endCursor }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String listField() {
        return "categories";
    }

    @Override
    public String createMutation() {
        return """
                mutation CreateCategory($input: CategoryInput!, $parent: ID) {
                  categoryCreate(input: $input, parent: $parent) {
                    category { %s }
                    errors { field message code }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String createField() {
        return "categoryCreate";
    }

    @Override
    public String updateMutation() {
        return """
                mutation UpdateCategory($id: ID!, $input: CategoryInput!) {
                  categoryUpdate(id: $id, input: $input) {
                    category { %s }
                    errors { field message code }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String updateField() {
        return "categoryUpdate";
    }

    @Override
    public String resultField() {
        return "category";
    }

    @Override
    public Map<String, Object> createVariables(Category input, ReferenceResolver references) {
        Map<String, Object> in = new LinkedHashMap<>();
        in.put("slug", input.getSlug());
        in.put("name", input.getName());
        Json.putIfNotNull(in, "description", input.getDescription());
        Map<String, Object> variables = new HashMap<>();
        variables.put("input", in);
        variables.put("parent", input.getParent() != null
                ? references.requireId(EntityType.CATEGORIES, input.getParent())
                : null);
        return variables;
    }

    @Override
    public Map<String, Object> updateInput(Category desired, Category current, ReferenceResolver references) {
        Map<String, Object> in = new LinkedHashMap<>();
        Json.putIfNotNull(in, "name", desired.getName());
        Json.putIfNotNull(in, "description", desired.getDescription());
        return in;
    }

    @Override
    public Category fromNode(JsonNode node) {
        return new Category(
                Json.text(node, "slug"),
                Json.text(node, "name"),
                Json.text(node, "description"),
                Json.text(node.path("parent"), "slug"));
    }
}
