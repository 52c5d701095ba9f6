package com.sandkev.redditclient.shared.http;

import java.time.Duration;
import java.util.List;

/**
 * Fixed waits applied before each retry of one logical request. No jitter, no growth:
 * once the list runs out the request has failed.
 */
public record BackoffSchedule(List<Duration> waits) {

    public static final BackoffSchedule DEFAULT = of(
            Duration.ofSeconds(4),
            Duration.ofSeconds(8),
            Duration.ofSeconds(16));

    public BackoffSchedule {
        waits = List.copyOf(waits);
        for (Duration d : waits) {
            if (d.isNegative()) throw new IllegalArgumentException("negative backoff: " + d);
        }
    }

    public static BackoffSchedule of(Duration... waits) {
        return new BackoffSchedule(List.of(waits));
    }

    /** Upper bound on sends for one request, first attempt included. */
    public int maxAttempts() {
        return 1 + waits.size();
    }
}
