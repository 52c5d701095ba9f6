package com.sandkev.redditclient.shared.http;

import com.sandkev.redditclient.error.ErrorClassifier;
import com.sandkev.redditclient.error.RateLimitedException;
import com.sandkev.redditclient.error.RedditApiException;
import com.sandkev.redditclient.error.RequestCancelledException;
import com.sandkev.redditclient.error.ServerErrorException;
import com.sandkev.redditclient.error.StoreUnavailableException;
import com.sandkev.redditclient.metrics.Instrumentation;
import com.sandkev.redditclient.ratelimit.RateLimitGate;
import com.sandkev.redditclient.ratelimit.RateLimitSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one logical request: rate-limit gate, send, fixed-schedule retries, quota
 * bookkeeping. Runs entirely on the caller's thread, so a backoff only ever parks the
 * request that is retrying.
 *
 * <p>Every failure leaves as a {@link RedditApiException} already classified with the
 * request's {@link com.sandkev.redditclient.error.EndpointErrorTable}.
 */
@Slf4j
@RequiredArgsConstructor
public class RequestExecutor {

    private final RateLimitGate gate;
    private final RedditTransport transport;
    private final Instrumentation metrics;
    private final BackoffSchedule backoff;
    private final Clock clock;

    public RequestExecutor(RateLimitGate gate, RedditTransport transport, Instrumentation metrics) {
        this(gate, transport, metrics, BackoffSchedule.DEFAULT, Clock.systemUTC());
    }

    /**
     * @return the body of a 200 response
     * @throws RedditApiException classified failure; never anything else
     */
    public byte[] execute(RedditRequest request) {
        try {
            return doExecute(request);
        } catch (RuntimeException e) {
            RedditApiException classified = ErrorClassifier.classify(e, request.errorTable());
            metrics.increment("reddit.api.errors", withTag(request.tags(), classified.getKind().tag()), 0.1);
            throw classified;
        }
    }

    private byte[] doExecute(RedditRequest request) {
        String account = request.accountId();
        if (gate.isThrottled(account)) {
            throw new RateLimitedException(account);
        }
        checkDeadline(request, Duration.ZERO);

        RawResponse response = null;
        RuntimeException lastError;
        try {
            response = sendOnce(request);
            lastError = null;
        } catch (RuntimeException e) {
            lastError = e;
        }

        if (lastError != null && request.retry()) {
            int attempt = 1;
            for (Duration wait : backoff.waits()) {
                if (!isRetryable(lastError, request)) break;
                log.warn("reddit {} failed (attempt {}/{}): {}; retrying in {}s",
                        request.url(), attempt, backoff.maxAttempts(), lastError.getMessage(), wait.toSeconds());
                pause(request, wait);
                attempt++;
                metrics.increment("reddit.api.retries", request.tags(), 0.1);
                try {
                    response = sendOnce(request);
                    lastError = null;
                    break;
                } catch (RuntimeException e) {
                    lastError = e;
                }
            }
        }

        if (lastError != null) throw lastError;

        recordUsage(account, RateLimitSnapshot.fromHeaders(response.headers(), clock.instant()));
        return response.body();
    }

    private RawResponse sendOnce(RedditRequest request) {
        gate.countRequest(request.accountId());
        RawResponse response = transport.send(request);
        if (!response.isOk()) {
            throw new ServerErrorException(response.statusCode());
        }
        return response;
    }

    private static boolean isRetryable(RuntimeException error, RedditRequest request) {
        return !ErrorClassifier.classify(error, request.errorTable()).getKind().isTerminal();
    }

    private void recordUsage(String account, RateLimitSnapshot snapshot) {
        if (RateLimitGate.isBypass(account)) return;
        try {
            gate.recordUsage(account, snapshot);
        } catch (StoreUnavailableException e) {
            // the call itself succeeded; the next response carries fresh headers anyway
            metrics.increment("reddit.ratelimit.store_errors", List.of("op:record"), 1.0);
            log.warn("Could not record quota for {}: {}", account, e.getMessage());
        }
    }

    private void pause(RedditRequest request, Duration wait) {
        checkDeadline(request, wait);
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException("Interrupted during backoff for " + request.url(), e);
        }
    }

    private void checkDeadline(RedditRequest request, Duration wait) {
        Instant deadline = request.deadline();
        if (deadline != null && clock.instant().plus(wait).isAfter(deadline)) {
            throw new RequestCancelledException("Deadline " + deadline + " reached for " + request.url());
        }
    }

    private static List<String> withTag(List<String> tags, String tag) {
        var out = new ArrayList<String>(tags.size() + 1);
        out.addAll(tags);
        out.add(tag);
        return out;
    }
}
