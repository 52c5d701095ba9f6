package com.sandkev.redditclient.error;

public class RequestCancelledException extends RedditApiException {

    public RequestCancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }

    public RequestCancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
