package com.sandkev.redditclient.shared.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.sandkev.redditclient.error.ResponseParseException;

import java.io.IOException;
import java.util.function.Function;

/**
 * Turns a raw 200 body into a typed result.
 */
public class ResponseDispatcher {

    private final ObjectReader reader;

    public ResponseDispatcher(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @param extractor           pure mapping from the parsed document, no I/O
     * @param emptyValue          returned as-is when the body is Reddit's canned empty payload
     * @param expectedEmptyLength length of that payload; 0 or less disables the shortcut
     * @throws ResponseParseException if the body is not JSON or does not fit the extractor
     */
    public <T> T dispatch(byte[] body, Function<JsonNode, T> extractor, T emptyValue, int expectedEmptyLength) {
        // Reddit's empty inbox is a fixed-size blob, not worth parsing
        if (expectedEmptyLength > 0 && body.length == expectedEmptyLength) {
            return emptyValue;
        }

        JsonNode document;
        try {
            document = reader.readTree(body);
        } catch (IOException e) {
            throw new ResponseParseException("Response body is not valid JSON: " + e.getMessage(), e);
        }
        if (document == null || document.isMissingNode()) {
            throw new ResponseParseException("Response body is empty", null);
        }

        try {
            return extractor.apply(document);
        } catch (RuntimeException e) {
            throw new ResponseParseException("Unexpected response shape: " + e.getMessage(), e);
        }
    }
}
