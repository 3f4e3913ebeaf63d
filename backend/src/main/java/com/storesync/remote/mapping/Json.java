package com.storesync.remote.mapping;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class Json {

    private Json() {
    }

    /** Text value, or null when missing or JSON null. */
    static String text(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isMissingNode() || v.isNull() ? null : v.asText();
    }

    static Boolean bool(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isMissingNode() || v.isNull() ? null : v.asBoolean();
    }

    /** Collects {@code field} of every element of an array. */
    static List<String> texts(JsonNode array, String field) {
        List<String> out = new ArrayList<>();
        for (JsonNode n : array) {
            String v = text(n, field);
            if (v != null) {
                out.add(v);
            }
        }
        return out;
    }

    /** Undeclared (null) values are left out so the server keeps its current value. */
    static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
