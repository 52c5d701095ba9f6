package com.sandkev.redditclient.shared.http;

import com.sandkev.redditclient.error.EndpointErrorTable;
import com.sandkev.redditclient.error.ErrorKind;
import com.sandkev.redditclient.error.OauthRevokedException;
import com.sandkev.redditclient.error.RateLimitedException;
import com.sandkev.redditclient.error.RedditApiException;
import com.sandkev.redditclient.error.RequestCancelledException;
import com.sandkev.redditclient.error.ServerErrorException;
import com.sandkev.redditclient.error.StoreUnavailableException;
import com.sandkev.redditclient.ratelimit.RateLimitGate;
import com.sandkev.redditclient.ratelimit.StoreFailurePolicy;
import com.sandkev.redditclient.testsupport.InMemorySharedStore;
import com.sandkev.redditclient.testsupport.MutableClock;
import com.sandkev.redditclient.testsupport.RecordingInstrumentation;
import com.sandkev.redditclient.testsupport.ScriptedTransport;
import io.netty.handler.timeout.ReadTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestExecutorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");
    private static final BackoffSchedule FAST = BackoffSchedule.of(
            Duration.ofMillis(5), Duration.ofMillis(10), Duration.ofMillis(20));

    private MutableClock clock;
    private InMemorySharedStore store;
    private RecordingInstrumentation metrics;
    private RateLimitGate gate;
    private ScriptedTransport transport;
    private RequestExecutor executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemorySharedStore(clock);
        metrics = new RecordingInstrumentation();
        gate = new RateLimitGate(store, metrics);
        transport = new ScriptedTransport();
        executor = new RequestExecutor(gate, transport, metrics, FAST, clock);
    }

    private static RedditRequest.RedditRequestBuilder get(String account) {
        return RedditRequest.builder()
                .accountId(account)
                .url("https://oauth.reddit.com/api/v1/me")
                .tag("url:/api/v1/me");
    }

    private static HttpHeaders quota(String remaining, String used, String reset) {
        var h = new HttpHeaders();
        h.add("x-ratelimit-remaining", remaining);
        h.add("x-ratelimit-used", used);
        h.add("x-ratelimit-reset", reset);
        return h;
    }

    @Test
    void successReturnsBodyAndCountsRequest() {
        transport.ok("{\"id\":\"1\"}");

        byte[] body = executor.execute(get("alice").build());

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("{\"id\":\"1\"}");
        assertThat(store.field("reddit:requests", "alice")).contains("1");
        assertThat(metrics.count("reddit.api.errors")).isZero();
    }

    @Test
    void throttledAccountFailsFastWithoutSending() {
        store.setWithTtl(RateLimitGate.coolDownKey("alice"), "{}", Duration.ofSeconds(30));
        transport.ok("{}");

        assertThatThrownBy(() -> executor.execute(get("alice").retry(true).build()))
                .isInstanceOf(RateLimitedException.class);
        assertThat(transport.sends()).isZero();
        assertThat(metrics.events("reddit.api.errors")).singleElement()
                .satisfies(e -> assertThat(e.tags()).contains("kind:rate_limited"));
    }

    @Test
    void lowQuotaOnSuccessThrottlesNextCall() {
        transport.ok("{}", quota("12.0", "588", "240")).ok("{}");

        executor.execute(get("alice").build());

        assertThat(gate.isThrottled("alice")).isTrue();
        assertThatThrownBy(() -> executor.execute(get("alice").build()))
                .isInstanceOf(RateLimitedException.class);
        assertThat(transport.sends()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(240));
        executor.execute(get("alice").build());
        assertThat(transport.sends()).isEqualTo(2);
    }

    @Test
    void noRetryFlagMeansOneAttempt() {
        transport.status(502).ok("{}");

        assertThatThrownBy(() -> executor.execute(get("alice").build()))
                .isInstanceOfSatisfying(ServerErrorException.class, e -> assertThat(e.getStatusCode()).isEqualTo(502));
        assertThat(transport.sends()).isEqualTo(1);
    }

    @Test
    void retriesStopAtFirstSuccess() {
        transport.status(503).status(500).ok("{\"ok\":true}");

        byte[] body = executor.execute(get("alice").retry(true).build());

        assertThat(new String(body, StandardCharsets.UTF_8)).contains("ok");
        assertThat(transport.sends()).isEqualTo(3);
        assertThat(metrics.count("reddit.api.retries")).isEqualTo(2);
        assertThat(store.field("reddit:requests", "alice")).contains("3");
    }

    @Test
    void exhaustedScheduleSurfacesLastError() {
        transport.status(500).status(500).status(500).status(504);

        assertThatThrownBy(() -> executor.execute(get("alice").retry(true).build()))
                .isInstanceOfSatisfying(ServerErrorException.class, e -> assertThat(e.getStatusCode()).isEqualTo(504));
        assertThat(transport.sends()).isEqualTo(FAST.maxAttempts());
        assertThat(metrics.count("reddit.api.errors")).isEqualTo(1);
    }

    @Test
    void revokedCredentialIsNeverRetried() {
        transport.status(403).ok("{}");

        assertThatThrownBy(() -> executor.execute(get("alice").retry(true)
                .errorTable(EndpointErrorTable.AUTHENTICATED_READ).build()))
                .isInstanceOf(OauthRevokedException.class);
        assertThat(transport.sends()).isEqualTo(1);
    }

    @Test
    void sameStatusIsPlainServerErrorElsewhere() {
        transport.status(400);

        assertThatThrownBy(() -> executor.execute(get("alice").errorTable(EndpointErrorTable.AUTHENTICATED_READ).build()))
                .isInstanceOfSatisfying(RedditApiException.class, e -> assertThat(e.getKind()).isEqualTo(ErrorKind.SERVER_ERROR));
    }

    @Test
    void transportTimeoutsAreClassified() {
        var timeout = new WebClientRequestException(ReadTimeoutException.INSTANCE,
                HttpMethod.GET, URI.create("https://oauth.reddit.com/api/v1/me"), new HttpHeaders());
        transport.fail(timeout);

        assertThatThrownBy(() -> executor.execute(get("alice").build()))
                .isInstanceOfSatisfying(RedditApiException.class, e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT));
    }

    @Test
    void transportFailuresAreRetriedWhenAskedTo() {
        transport.fail(new IllegalStateException("connection reset")).ok("{}");

        executor.execute(get("alice").retry(true).build());

        assertThat(transport.sends()).isEqualTo(2);
    }

    @Test
    void bypassAccountSkipsAllBookkeeping() {
        transport.ok("{}", quota("0", "600", "300"));

        executor.execute(get(RateLimitGate.SKIP_RATE_LIMITING).build());

        assertThat(store.writes()).isZero();
        assertThat(gate.isThrottled(RateLimitGate.SKIP_RATE_LIMITING)).isFalse();
    }

    @Test
    void storeDownFailsClosedBeforeSending() {
        store.setDown(true);
        transport.ok("{}");

        assertThatThrownBy(() -> executor.execute(get("alice").build()))
                .isInstanceOf(StoreUnavailableException.class);
        assertThat(transport.sends()).isZero();
    }

    @Test
    void storeDownFailOpenStillServesTheCall() {
        var openGate = new RateLimitGate(store, metrics, 50, 2000, StoreFailurePolicy.FAIL_OPEN);
        var openExecutor = new RequestExecutor(openGate, transport, metrics, FAST, clock);
        store.setDown(true);
        transport.ok("{}", quota("1", "599", "100"));

        assertThat(openExecutor.execute(get("alice").build())).isNotEmpty();
        assertThat(metrics.events("reddit.ratelimit.store_errors")).hasSize(2);
    }

    @Test
    void deadlineInsideBackoffCancels() {
        transport.status(500).ok("{}");
        var slow = new RequestExecutor(gate, transport, metrics, BackoffSchedule.of(Duration.ofMinutes(1)), clock);

        assertThatThrownBy(() -> slow.execute(get("alice").retry(true).deadline(T0.plusSeconds(10)).build()))
                .isInstanceOf(RequestCancelledException.class);
        assertThat(transport.sends()).isEqualTo(1);
    }

    @Test
    void expiredDeadlineNeverSends() {
        transport.ok("{}");

        assertThatThrownBy(() -> executor.execute(get("alice").deadline(T0.minusSeconds(1)).build()))
                .isInstanceOf(RequestCancelledException.class);
        assertThat(transport.sends()).isZero();
    }

    @Test
    void interruptDuringBackoffAbandonsRetries() throws Exception {
        transport.status(500).ok("{}");
        var slow = new RequestExecutor(gate, transport, metrics, BackoffSchedule.of(Duration.ofMinutes(5)), clock);
        AtomicReference<Thread> worker = new AtomicReference<>();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<byte[]> call = pool.submit(() -> {
                worker.set(Thread.currentThread());
                return slow.execute(get("alice").retry(true).build());
            });

            long waitUntil = System.currentTimeMillis() + 5_000;
            while ((worker.get() == null || worker.get().getState() != Thread.State.TIMED_WAITING)
                    && System.currentTimeMillis() < waitUntil) {
                Thread.sleep(5);
            }
            worker.get().interrupt();

            assertThatThrownBy(() -> call.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(RequestCancelledException.class);
        } finally {
            pool.shutdownNow();
        }
        assertThat(transport.sends()).isEqualTo(1);
    }

    @Test
    void backoffOnOneRequestDoesNotHoldUpAnother() throws Exception {
        var failing = new ScriptedTransport().status(500).ok("{}");
        var healthy = new ScriptedTransport().ok("{}");
        var slowFailing = new RequestExecutor(gate, failing, metrics, BackoffSchedule.of(Duration.ofMillis(500)), clock);
        var sharedGateHealthy = new RequestExecutor(gate, healthy, metrics, BackoffSchedule.of(Duration.ofMillis(500)), clock);

        CompletableFuture<byte[]> retrying = CompletableFuture.supplyAsync(() -> slowFailing.execute(get("alice").retry(true).build()));
        long start = System.nanoTime();
        sharedGateHealthy.execute(get("alice").build());
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(tookMs).isLessThan(400);
        assertThat(retrying.get(5, TimeUnit.SECONDS)).isNotNull();
    }
}
