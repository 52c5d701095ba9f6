package com.sandkev.redditclient.shared.http;

import org.springframework.http.HttpHeaders;

/**
 * What came back over the wire, whatever the status.
 */
public record RawResponse(int statusCode, HttpHeaders headers, byte[] body) {

    public boolean isOk() {
        return statusCode == 200;
    }
}
