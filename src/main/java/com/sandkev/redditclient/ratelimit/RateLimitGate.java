package com.sandkev.redditclient.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sandkev.redditclient.error.AccountIdRequiredException;
import com.sandkev.redditclient.error.StoreUnavailableException;
import com.sandkev.redditclient.metrics.Instrumentation;
import com.sandkev.redditclient.store.SharedStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Cross-process gate over Reddit's per-account quota.
 *
 * <p>After each response whose remaining quota has dropped to the buffer, the account gets a
 * cool-down key in the shared store that expires when Reddit's quota window resets. While
 * the key exists every process refuses to call Reddit for that account. Expiry is the only
 * way out of a cool-down.
 */
@Slf4j
public class RateLimitGate {

    /** Account id for internal calls that must not be throttled or counted. */
    public static final String SKIP_RATE_LIMITING = "<SKIP_RATE_LIMITING>";

    public static final double DEFAULT_REMAINING_BUFFER = 50;
    public static final int DEFAULT_ABNORMAL_USED_THRESHOLD = 2000;

    static final String REQUESTS_KEY = "reddit:requests";
    static final String ABNORMAL_USAGE_KEY = "reddit:ratelimited:crazy";

    private static final ObjectMapper JSON = new ObjectMapper();

    private final SharedStore store;
    private final Instrumentation metrics;
    private final double remainingBuffer;
    private final int abnormalUsedThreshold;
    private final StoreFailurePolicy failurePolicy;

    public RateLimitGate(SharedStore store, Instrumentation metrics) {
        this(store, metrics, DEFAULT_REMAINING_BUFFER, DEFAULT_ABNORMAL_USED_THRESHOLD, StoreFailurePolicy.FAIL_CLOSED);
    }

    public RateLimitGate(SharedStore store,
                         Instrumentation metrics,
                         double remainingBuffer,
                         int abnormalUsedThreshold,
                         StoreFailurePolicy failurePolicy) {
        this.store = store;
        this.metrics = metrics;
        this.remainingBuffer = remainingBuffer;
        this.abnormalUsedThreshold = abnormalUsedThreshold;
        this.failurePolicy = failurePolicy;
    }

    public static boolean isBypass(String accountId) {
        return SKIP_RATE_LIMITING.equals(accountId);
    }

    public static String coolDownKey(String accountId) {
        return "reddit:" + accountId + ":ratelimited";
    }

    /**
     * @throws StoreUnavailableException when the store cannot be read and the policy is
     *                                   {@link StoreFailurePolicy#FAIL_CLOSED}
     */
    public boolean isThrottled(String accountId) {
        if (isBypass(accountId)) return false;

        try {
            return store.get(coolDownKey(accountId)).isPresent();
        } catch (StoreUnavailableException e) {
            if (failurePolicy == StoreFailurePolicy.FAIL_CLOSED) throw e;
            metrics.increment("reddit.ratelimit.store_errors", List.of("op:lookup"), 1.0);
            log.warn("Cool-down lookup failed for {}; sending anyway (fail-open): {}", accountId, e.getMessage());
            return false;
        }
    }

    /**
     * Records the quota state Reddit reported for the account, opening a cool-down when
     * the remaining quota is at or under the buffer.
     *
     * @throws AccountIdRequiredException for the bypass account
     */
    public void recordUsage(String accountId, RateLimitSnapshot snapshot) {
        if (isBypass(accountId)) throw new AccountIdRequiredException();
        if (!snapshot.present()) return;
        if (snapshot.remaining() > remainingBuffer) return;

        metrics.increment("reddit.api.ratelimit", List.of(), 1.0);
        String info = describe(snapshot);

        if (snapshot.used() > abnormalUsedThreshold) {
            log.warn("Abnormal usage for {}: {}", accountId, info);
            recordAbnormalUsage(accountId, info);
        }

        if (snapshot.reset() <= 0) {
            // window already rolled over, an expiring key would be gone immediately
            log.info("Quota for {} low ({}) but resets now; no cool-down", accountId, snapshot.remaining());
            return;
        }

        log.info("Cooling down {} for {}s (remaining={}, used={})",
                accountId, snapshot.reset(), snapshot.remaining(), snapshot.used());
        store.setWithTtl(coolDownKey(accountId), info, Duration.ofSeconds(snapshot.reset()));
    }

    // diagnostic record only, failures never block the cool-down write
    private void recordAbnormalUsage(String accountId, String info) {
        try {
            store.setField(ABNORMAL_USAGE_KEY, accountId, info);
        } catch (StoreUnavailableException e) {
            metrics.increment("reddit.ratelimit.store_errors", List.of("op:abnormal"), 1.0);
            log.warn("Could not record abnormal usage for {}: {}", accountId, e.getMessage());
        }
    }

    /** Bumps the per-account request counter. Counting failures never stop a request. */
    public void countRequest(String accountId) {
        if (isBypass(accountId)) return;
        try {
            store.incrementField(REQUESTS_KEY, accountId, 1);
        } catch (StoreUnavailableException e) {
            log.warn("Could not count request for {}: {}", accountId, e.getMessage());
        }
    }

    private static String describe(RateLimitSnapshot s) {
        ObjectNode node = JSON.createObjectNode()
                .put("remaining", s.remaining())
                .put("used", s.used())
                .put("reset", s.reset())
                .put("present", s.present());
        if (s.observedAt() != null) node.put("observedAt", s.observedAt().toString());
        return node.toString();
    }
}
