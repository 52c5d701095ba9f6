package com.sandkev.redditclient.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One child of a listing: a post (t3), comment (t1) or message (t4).
 */
public record Thing(
        String kind,
        String id,
        String name,
        String author,
        String subreddit,
        String title,
        String body,
        String context,
        String parentId,
        String permalink,
        long createdUtc
) {

    public static Thing from(JsonNode node) {
        JsonNode d = node.path("data");
        return new Thing(
                node.path("kind").asText(null),
                d.path("id").asText(null),
                d.path("name").asText(null),
                d.path("author").asText(null),
                d.path("subreddit").asText(null),
                d.path("title").asText(null),
                d.has("body") ? d.path("body").asText(null) : d.path("selftext").asText(null),
                d.path("context").asText(null),
                d.path("parent_id").asText(null),
                d.path("permalink").asText(null),
                d.path("created_utc").asLong());
    }
}
