package com.sandkev.redditclient.model;

import com.fasterxml.jackson.databind.JsonNode;

public record UserResponse(String id, String name, long linkKarma, long commentKarma, boolean employee, long createdUtc) {

    public static UserResponse from(JsonNode node) {
        JsonNode d = node.path("data");
        return new UserResponse(
                d.path("id").asText(null),
                d.path("name").asText(null),
                d.path("link_karma").asLong(),
                d.path("comment_karma").asLong(),
                d.path("is_employee").asBoolean(),
                d.path("created_utc").asLong());
    }
}
