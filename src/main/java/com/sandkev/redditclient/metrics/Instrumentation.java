package com.sandkev.redditclient.metrics;

import java.util.List;

/**
 * Fire-and-forget metrics sink. Tags are {@code name:value} strings. Implementations
 * must never throw: a broken sink cannot fail a request.
 */
public interface Instrumentation {

    void increment(String name, List<String> tags, double sampleRate);

    void record(String name, double value, List<String> tags, double sampleRate);
}
