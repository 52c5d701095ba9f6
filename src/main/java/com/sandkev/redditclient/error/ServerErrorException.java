package com.sandkev.redditclient.error;

import lombok.Getter;

/**
 * Reddit answered with anything other than 200.
 */
@Getter
public class ServerErrorException extends RedditApiException {

    private final int statusCode;

    public ServerErrorException(int statusCode) {
        super(ErrorKind.SERVER_ERROR, "Reddit responded with status " + statusCode);
        this.statusCode = statusCode;
    }
}
