package com.sandkev.redditclient.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A Reddit {@code Listing}: one page of things plus the paging cursors.
 */
public record ListingResponse(String after, String before, List<Thing> children) {

    public static final ListingResponse EMPTY = new ListingResponse(null, null, List.of());

    public ListingResponse {
        children = List.copyOf(children);
    }

    public static ListingResponse from(JsonNode node) {
        if (!"Listing".equals(node.path("kind").asText())) {
            throw new IllegalArgumentException("expected a Listing, got kind=" + node.path("kind").asText("<none>"));
        }
        JsonNode data = node.path("data");
        var children = new ArrayList<Thing>();
        for (JsonNode child : data.path("children")) {
            children.add(Thing.from(child));
        }
        return new ListingResponse(data.path("after").asText(null), data.path("before").asText(null), children);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }
}
