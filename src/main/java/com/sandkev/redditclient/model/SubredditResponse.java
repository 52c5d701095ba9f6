package com.sandkev.redditclient.model;

import com.fasterxml.jackson.databind.JsonNode;

public record SubredditResponse(String id, String name, String displayName, String publicDescription,
                                long subscribers, boolean over18) {

    public static SubredditResponse from(JsonNode node) {
        JsonNode d = node.path("data");
        return new SubredditResponse(
                d.path("id").asText(null),
                d.path("name").asText(null),
                d.path("display_name").asText(null),
                d.path("public_description").asText(null),
                d.path("subscribers").asLong(),
                d.path("over18").asBoolean());
    }
}
