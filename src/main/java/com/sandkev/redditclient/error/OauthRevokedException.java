package com.sandkev.redditclient.error;

import lombok.Getter;

/**
 * The credential used for the call is no longer valid. Callers should send the user
 * back through authorization instead of retrying.
 */
@Getter
public class OauthRevokedException extends RedditApiException {

    private final int statusCode;

    public OauthRevokedException(int statusCode, Throwable cause) {
        super(ErrorKind.OAUTH_REVOKED, "OAuth credential revoked (status " + statusCode + ")", cause);
        this.statusCode = statusCode;
    }
}
