package com.sandkev.redditclient.ratelimit;

/**
 * What {@link RateLimitGate#isThrottled(String)} does when the shared store cannot answer.
 */
public enum StoreFailurePolicy {
    /** Refuse to send: the lookup error reaches the caller as STORE_UNAVAILABLE. */
    FAIL_CLOSED,
    /** Send anyway: the error is logged and counted, the account is treated as not throttled. */
    FAIL_OPEN
}
