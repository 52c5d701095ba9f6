package com.sandkev.redditclient.shared.http;

import com.sandkev.redditclient.metrics.Instrumentation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Sends {@link RedditRequest}s through a shared, pooled {@link WebClient}, blocking the
 * calling thread for the duration of one attempt.
 */
@Slf4j
@RequiredArgsConstructor
public class WebClientRedditTransport implements RedditTransport {

    private static final byte[] NO_BODY = new byte[0];

    private final WebClient redditWebClient;
    private final Instrumentation metrics;

    @Override
    public RawResponse send(RedditRequest request) {
        URI uri = toUri(request);
        long start = System.nanoTime();
        try {
            log.debug("reddit {} {}", request.method(), uri.getPath());
            WebClient.RequestBodySpec spec = redditWebClient.method(request.method())
                    .uri(uri)
                    .headers(h -> request.headers().forEach(h::set));

            WebClient.RequestHeadersSpec<?> ready = request.formParams().isEmpty()
                    ? spec
                    : spec.body(BodyInserters.fromFormData(toMultiValueMap(request.formParams())));

            return ready.exchangeToMono(resp -> resp.bodyToMono(byte[].class)
                            .defaultIfEmpty(NO_BODY)
                            .map(body -> new RawResponse(resp.statusCode().value(), resp.headers().asHttpHeaders(), body)))
                    .block();
        } finally {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            metrics.increment("reddit.api.calls", request.tags(), 0.1);
            metrics.record("reddit.api.latency", elapsedMs, request.tags(), 0.1);
        }
    }

    /**
     * Query values go in as URI variables so they are encoded strictly: {@code +},
     * {@code &}, {@code =} and braces reach Reddit as sent.
     */
    static URI toUri(RedditRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(request.url());
        Map<String, String> values = new HashMap<>();
        request.queryParams().forEach((name, value) -> {
            if (value == null) return;
            String var = "q" + values.size();
            builder.queryParam(name, "{" + var + "}");
            values.put(var, value);
        });
        return builder.encode().buildAndExpand(values).toUri();
    }

    private static MultiValueMap<String, String> toMultiValueMap(Map<String, String> params) {
        var out = new LinkedMultiValueMap<String, String>();
        params.forEach((k, v) -> { if (v != null) out.add(k, v); });
        return out;
    }
}
