package com.sandkev.redditclient.error;

import lombok.Getter;

/**
 * The account is in a cool-down window; the request was never sent.
 */
@Getter
public class RateLimitedException extends RedditApiException {

    private final String accountId;

    public RateLimitedException(String accountId) {
        super(ErrorKind.RATE_LIMITED, "Account " + accountId + " is rate limited");
        this.accountId = accountId;
    }
}
