package com.sandkev.redditclient.error;

/**
 * Closed set of failure kinds a caller can receive from the client.
 */
public enum ErrorKind {
    TIMEOUT,
    RATE_LIMITED,
    OAUTH_REVOKED,
    SERVER_ERROR,
    STORE_UNAVAILABLE,
    PARSE_ERROR,
    CANCELLED,
    GENERIC;

    /** Kinds that no retry can fix. */
    public boolean isTerminal() {
        return this == RATE_LIMITED || this == OAUTH_REVOKED || this == CANCELLED;
    }

    public String tag() {
        return "kind:" + name().toLowerCase();
    }
}
