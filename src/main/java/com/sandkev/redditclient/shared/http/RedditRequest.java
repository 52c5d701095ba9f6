package com.sandkev.redditclient.shared.http;

import com.sandkev.redditclient.error.EndpointErrorTable;
import lombok.Builder;
import lombok.Singular;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One logical call to Reddit, built per call and thrown away afterwards.
 *
 * @param accountId          whose quota the call consumes, or
 *                           {@link com.sandkev.redditclient.ratelimit.RateLimitGate#SKIP_RATE_LIMITING}
 * @param emptyResponseBytes body length Reddit uses for its canned empty listing; 0 disables the check
 * @param deadline           optional; backoff never sleeps past it
 */
@Builder(toBuilder = true)
public record RedditRequest(
        String accountId,
        HttpMethod method,
        String url,
        @Singular Map<String, String> queryParams,
        @Singular Map<String, String> formParams,
        @Singular Map<String, String> headers,
        @Singular List<String> tags,
        boolean retry,
        int emptyResponseBytes,
        EndpointErrorTable errorTable,
        Instant deadline
) {

    public RedditRequest {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(url, "url");
        if (method == null) method = HttpMethod.GET;
        if (errorTable == null) errorTable = EndpointErrorTable.NONE;
    }

    public static class RedditRequestBuilder {

        public RedditRequestBuilder bearerToken(String accessToken) {
            return header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);
        }

        public RedditRequestBuilder basicAuth(String username, String password) {
            return header(HttpHeaders.AUTHORIZATION,
                    "Basic " + HttpHeaders.encodeBasicAuth(username, password, StandardCharsets.UTF_8));
        }
    }
}
