package com.sandkev.redditclient.error;

public class ResponseParseException extends RedditApiException {

    public ResponseParseException(String message, Throwable cause) {
        super(ErrorKind.PARSE_ERROR, message, cause);
    }
}
