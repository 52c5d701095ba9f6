package com.sandkev.redditclient.model;

import com.fasterxml.jackson.databind.JsonNode;

public record RefreshTokenResponse(String accessToken, String refreshToken, String scope, long expiresIn) {

    public static RefreshTokenResponse from(JsonNode node) {
        String accessToken = node.path("access_token").asText("");
        if (accessToken.isEmpty()) throw new IllegalArgumentException("token response without access_token");
        return new RefreshTokenResponse(
                accessToken,
                node.path("refresh_token").asText(""),
                node.path("scope").asText(""),
                node.path("expires_in").asLong());
    }

    public RefreshTokenResponse withRefreshToken(String token) {
        return new RefreshTokenResponse(accessToken, token, scope, expiresIn);
    }
}
