package com.sandkev.redditclient.shared.http;

public interface RedditTransport {

    /**
     * Sends the request once. Any status is returned as a {@link RawResponse}; only
     * transport-level failures (connect, timeout, I/O) are thrown.
     */
    RawResponse send(RedditRequest request);
}
