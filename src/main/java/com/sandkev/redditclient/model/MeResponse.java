package com.sandkev.redditclient.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The authenticated user, from {@code /api/v1/me}. Unlike most endpoints the payload is
 * not wrapped in {@code kind}/{@code data}.
 */
public record MeResponse(String id, String name, int inboxCount, boolean hasMail) {

    public static MeResponse from(JsonNode node) {
        String id = node.path("id").asText(null);
        if (id == null) throw new IllegalArgumentException("me response without id");
        return new MeResponse(
                id,
                node.path("name").asText(null),
                node.path("inbox_count").asInt(),
                node.path("has_mail").asBoolean());
    }
}
