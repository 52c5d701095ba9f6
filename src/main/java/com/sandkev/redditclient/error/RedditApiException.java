package com.sandkev.redditclient.error;

/**
 * Base of every failure surfaced by the client. Thrown as-is for {@link ErrorKind#GENERIC}
 * failures; the other kinds have dedicated subclasses.
 */
public class RedditApiException extends RuntimeException {

    private final ErrorKind kind;

    public RedditApiException(String message, Throwable cause) {
        this(ErrorKind.GENERIC, message, cause);
    }

    protected RedditApiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RedditApiException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
