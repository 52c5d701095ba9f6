package com.sandkev.redditclient.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.time.Instant;

/**
 * Quota state as reported by Reddit on one response. When {@code present} is false the
 * server sent no rate-limit headers and the numbers mean nothing.
 */
@Slf4j
public record RateLimitSnapshot(double remaining, int used, int reset, boolean present, Instant observedAt) {

    public static final String REMAINING_HEADER = "x-ratelimit-remaining";
    public static final String USED_HEADER = "x-ratelimit-used";
    public static final String RESET_HEADER = "x-ratelimit-reset";

    private static final RateLimitSnapshot ABSENT = new RateLimitSnapshot(0, 0, 0, false, null);

    public static RateLimitSnapshot absent() {
        return ABSENT;
    }

    public static RateLimitSnapshot of(double remaining, int used, int reset, Instant observedAt) {
        return new RateLimitSnapshot(remaining, used, reset, true, observedAt);
    }

    public static RateLimitSnapshot fromHeaders(HttpHeaders headers, Instant observedAt) {
        String remaining = headers.getFirst(REMAINING_HEADER);
        if (remaining == null || remaining.isBlank()) return ABSENT;
        double parsed;
        try {
            parsed = Double.parseDouble(remaining.trim());
        } catch (NumberFormatException e) {
            log.warn("Unreadable {} header '{}'; ignoring rate limit headers", REMAINING_HEADER, remaining);
            return ABSENT;
        }
        return of(parsed, parseInt(headers.getFirst(USED_HEADER)), parseInt(headers.getFirst(RESET_HEADER)), observedAt);
    }

    // used/reset are best effort: a garbled value counts as 0
    private static int parseInt(String v) {
        if (v == null || v.isBlank()) return 0;
        try {
            return (int) Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            log.debug("Unreadable rate limit header value '{}'", v);
            return 0;
        }
    }
}
