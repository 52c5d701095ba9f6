package com.sandkev.redditclient.error;

import io.netty.handler.timeout.ReadTimeoutException;

import java.net.SocketTimeoutException;

/**
 * Maps any failure raised while serving a request onto the {@link ErrorKind} taxonomy,
 * using the endpoint's own {@link EndpointErrorTable} for status codes.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    public static RedditApiException classify(Throwable error, EndpointErrorTable table) {
        if (error instanceof ServerErrorException se && table.isRevoked(se.getStatusCode())) {
            return new OauthRevokedException(se.getStatusCode(), se);
        }
        if (error instanceof RedditApiException rae) {
            return rae;
        }
        if (hasCause(error, InterruptedException.class)) {
            return new RequestCancelledException("Interrupted while awaiting response", error);
        }
        // only the wait for response headers counts; pool acquire timeouts stay generic
        if (hasCause(error, ReadTimeoutException.class) || hasCause(error, SocketTimeoutException.class)) {
            return new RedditTimeoutException(error);
        }
        return new RedditApiException("Reddit request failed: " + error.getMessage(), error);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (type.isInstance(t)) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }
}
