package com.sandkev.redditclient.config;

import com.sandkev.redditclient.ratelimit.StoreFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties("reddit.client")
public record RedditClientProperties(
        String clientId,
        String clientSecret,
        @DefaultValue("reddit-client/0.1") String userAgent,
        @DefaultValue("https://oauth.reddit.com") String oauthBaseUrl,
        @DefaultValue("https://www.reddit.com") String authBaseUrl,
        @DefaultValue("2000") int connLimit,            // pool sizing input, per-host connections = connLimit / 100
        @DefaultValue("5000") int responseTimeoutMs,
        @DefaultValue("60000") int idleTimeoutMs,
        @DefaultValue("30000") int poolAcquireTimeoutMs,  // how long a caller waits for a free pooled connection
        @DefaultValue("50") double requestRemainingBuffer,
        @DefaultValue("2000") int abnormalUsedThreshold,
        @DefaultValue({"4s", "8s", "16s"}) List<Duration> backoff,
        @DefaultValue("FAIL_CLOSED") StoreFailurePolicy storeFailurePolicy
) {

    public int maxConnectionsPerHost() {
        return Math.max(1, connLimit / 100);
    }
}
