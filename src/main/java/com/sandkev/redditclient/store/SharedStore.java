package com.sandkev.redditclient.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store shared by every process talking to Reddit. Each call is a single
 * atomic operation; implementations throw
 * {@link com.sandkev.redditclient.error.StoreUnavailableException} when the store
 * cannot be reached.
 */
public interface SharedStore {

    /** Empty when the key does not exist (or has expired). */
    Optional<String> get(String key);

    void setWithTtl(String key, String value, Duration ttl);

    long incrementField(String mapKey, String field, long delta);

    void setField(String mapKey, String field, String value);
}
