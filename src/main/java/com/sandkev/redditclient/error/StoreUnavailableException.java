package com.sandkev.redditclient.error;

public class StoreUnavailableException extends RedditApiException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
