package com.sandkev.redditclient.api;

import com.sandkev.redditclient.shared.http.RequestExecutor;
import com.sandkev.redditclient.shared.http.ResponseDispatcher;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Process-wide entry point. Holds the app credentials and the shared request machinery;
 * hand out one {@link AuthenticatedRedditClient} per Reddit account.
 */
@Getter
@RequiredArgsConstructor
public class RedditClient {

    private final String clientId;
    private final String clientSecret;
    private final String oauthBaseUrl;
    private final String authBaseUrl;
    private final RequestExecutor executor;
    private final ResponseDispatcher dispatcher;

    /**
     * @param accountId the Reddit user whose quota these calls use, or
     *                  {@link com.sandkev.redditclient.ratelimit.RateLimitGate#SKIP_RATE_LIMITING}
     */
    public AuthenticatedRedditClient authenticated(String accountId, String refreshToken, String accessToken) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("requires a reddit account id");
        }
        return new AuthenticatedRedditClient(this, accountId, refreshToken, accessToken);
    }
}
