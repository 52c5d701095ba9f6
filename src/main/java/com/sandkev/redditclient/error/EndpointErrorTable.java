package com.sandkev.redditclient.error;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What a non-200 status means for one particular endpoint. The same status can mean
 * "credential revoked" on one endpoint and be a plain server error on another.
 */
public record EndpointErrorTable(Set<Integer> revokedStatuses) {

    public static final EndpointErrorTable NONE = new EndpointErrorTable(Set.of());

    /** Refresh-token endpoint: 400 means the refresh token itself is dead. */
    public static final EndpointErrorTable TOKEN_REFRESH = revokedOn(400);

    /** Reads that need a valid access token: 403 means it was revoked. */
    public static final EndpointErrorTable AUTHENTICATED_READ = revokedOn(403);

    public EndpointErrorTable {
        revokedStatuses = Set.copyOf(revokedStatuses);
    }

    public static EndpointErrorTable revokedOn(int... statuses) {
        return new EndpointErrorTable(Arrays.stream(statuses).boxed().collect(Collectors.toSet()));
    }

    public boolean isRevoked(int statusCode) {
        return revokedStatuses.contains(statusCode);
    }
}
