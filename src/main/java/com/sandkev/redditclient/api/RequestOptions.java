package com.sandkev.redditclient.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call extras for endpoint methods: paging/filter query params, retry opt-in and a
 * deadline.
 */
public record RequestOptions(Map<String, Object> query, boolean retry, Instant deadline) {

    private static final RequestOptions NONE = new RequestOptions(Map.of(), false, null);

    public RequestOptions {
        query = Collections.unmodifiableMap(new LinkedHashMap<>(query));
    }

    public static RequestOptions none() {
        return NONE;
    }

    public RequestOptions withQuery(String name, Object value) {
        var q = new LinkedHashMap<>(query);
        q.put(name, value);
        return new RequestOptions(q, retry, deadline);
    }

    public RequestOptions retrying() {
        return new RequestOptions(query, true, deadline);
    }

    public RequestOptions withDeadline(Instant deadline) {
        return new RequestOptions(query, retry, deadline);
    }
}
