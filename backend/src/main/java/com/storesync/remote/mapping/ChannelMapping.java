package com.storesync.remote.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.storesync.domain.Channel;
import com.storesync.domain.EntityType;
import com.storesync.remote.EntityMapping;
import com.storesync.remote.ReferenceResolver;

import java.util.LinkedHashMap;
import java.util.Map;

public class ChannelMapping implements EntityMapping<Channel> {

    private static final String FIELDS = "id slug name currencyCode defaultCountry { code } isActive";

    @Override
    public EntityType entityType() {
        return EntityType.CHANNELS;
    }

    @Override
    public String keyOf(Channel entity) {
        return entity.getSlug();
    }

    @Override
    public String listQuery() {
        return "query Channels { channels { " + FIELDS + " } }";
    }

    @Override
    public String listField() {
        return "channels";
    }

    @Override
    public String createMutation() {
        return """
                mutation CreateChannel($input: ChannelCreateInput!) {
                  channelCreate(input: $input) {
                    channel { %s }
                    errors { field message code }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String createField() {
        return "channelCreate";
    }

    @Override
    public String updateMutation() {
        return """
                mutation UpdateChannel($id: ID!, $input: ChannelUpdateInput!) {
                  channelUpdate(id: $id, input: $input) {
                    channel { %s }
                    errors { field message code }
                  }
                }""".formatted(FIELDS);
    }

    @Override
    public String updateField() {
        return "channelUpdate";
    }

    @Override
    public String resultField() {
        return "channel";
    }

    @Override
    public Map<String, Object> createVariables(Channel input, ReferenceResolver references) {
        Map<String, Object> in = new LinkedHashMap<>();
        in.put("slug", input.getSlug());
        in.put("name", input.getName());
        in.put("currencyCode", input.getCurrencyCode());
        in.put("defaultCountry", input.getDefaultCountry());
        Json.putIfNotNull(in, "isActive", input.getIsActive());
        return Map.of("input", in);
    }

    @Override
    public Map<String, Object> updateInput(Channel desired, Channel current, ReferenceResolver references) {
        // currency is fixed once a channel exists
        Map<String, Object> in = new LinkedHashMap<>();
        Json.putIfNotNull(in, "name", desired.getName());
        Json.putIfNotNull(in, "defaultCountry", desired.getDefaultCountry());
        Json.putIfNotNull(in, "isActive", desired.getIsActive());
        return in;
    }

    @Override
    public Channel fromNode(JsonNode node) {
        return new Channel(
                Json.text(node, "slug"),
                Json.text(node, "name"),
                Json.text(node, "currencyCode"),
                Json.text(node.path("defaultCountry"), "code"),
                Json.bool(node, "isActive"));
    }
}
