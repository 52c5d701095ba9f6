package com.sandkev.redditclient.error;

public class RedditTimeoutException extends RedditApiException {

    public RedditTimeoutException(Throwable cause) {
        super(ErrorKind.TIMEOUT, "Timed out awaiting response headers", cause);
    }
}
