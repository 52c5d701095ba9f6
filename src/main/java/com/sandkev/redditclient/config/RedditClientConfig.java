package com.sandkev.redditclient.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.redditclient.api.RedditClient;
import com.sandkev.redditclient.metrics.Instrumentation;
import com.sandkev.redditclient.metrics.MicrometerInstrumentation;
import com.sandkev.redditclient.ratelimit.RateLimitGate;
import com.sandkev.redditclient.shared.http.BackoffSchedule;
import com.sandkev.redditclient.shared.http.ConnectionInstrumentation;
import com.sandkev.redditclient.shared.http.RedditTransport;
import com.sandkev.redditclient.shared.http.RequestExecutor;
import com.sandkev.redditclient.shared.http.ResponseDispatcher;
import com.sandkev.redditclient.shared.http.WebClientRedditTransport;
import com.sandkev.redditclient.store.RedisSharedStore;
import com.sandkev.redditclient.store.SharedStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(RedditClientProperties.class)
@RequiredArgsConstructor
public class RedditClientConfig {

    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    private final RedditClientProperties props;

    @Bean
    public Instrumentation redditInstrumentation(ObjectProvider<MeterRegistry> registry) {
        return new MicrometerInstrumentation(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider redditConnectionProvider() {
        return connectionProvider(props);
    }

    /**
     * Bounded per-host pool. Callers beyond the bound queue without limit and wait up to
     * {@code poolAcquireTimeoutMs} for a connection instead of being rejected.
     */
    static ConnectionProvider connectionProvider(RedditClientProperties props) {
        return ConnectionProvider.builder("reddit")
                .maxConnections(props.maxConnectionsPerHost())
                .pendingAcquireMaxCount(-1)
                .pendingAcquireTimeout(Duration.ofMillis(props.poolAcquireTimeoutMs()))
                .maxIdleTime(Duration.ofMillis(props.idleTimeoutMs()))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    @Bean("redditWebClient")
    @Qualifier("redditWebClient")
    public WebClient redditWebClient(ConnectionProvider redditConnectionProvider, Instrumentation redditInstrumentation) {
        HttpClient http = HttpClient.create(redditConnectionProvider)
                .responseTimeout(Duration.ofMillis(props.responseTimeoutMs()))
                .compress(true)
                .observe(new ConnectionInstrumentation(redditInstrumentation));
        return WebClient.builder()
                .defaultHeader(HttpHeaders.USER_AGENT, props.userAgent())
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }

    @Bean
    public SharedStore redditSharedStore(StringRedisTemplate redis) {
        return new RedisSharedStore(redis);
    }

    @Bean
    public RateLimitGate rateLimitGate(SharedStore redditSharedStore, Instrumentation redditInstrumentation) {
        return new RateLimitGate(
                redditSharedStore,
                redditInstrumentation,
                props.requestRemainingBuffer(),
                props.abnormalUsedThreshold(),
                props.storeFailurePolicy());
    }

    @Bean
    public RedditTransport redditTransport(@Qualifier("redditWebClient") WebClient redditWebClient,
                                           Instrumentation redditInstrumentation) {
        return new WebClientRedditTransport(redditWebClient, redditInstrumentation);
    }

    @Bean
    public RequestExecutor redditRequestExecutor(RateLimitGate rateLimitGate,
                                                 RedditTransport redditTransport,
                                                 Instrumentation redditInstrumentation) {
        return new RequestExecutor(
                rateLimitGate,
                redditTransport,
                redditInstrumentation,
                new BackoffSchedule(props.backoff()),
                Clock.systemUTC());
    }

    @Bean
    public RedditClient redditClient(RequestExecutor redditRequestExecutor, ObjectProvider<ObjectMapper> objectMapper) {
        return new RedditClient(
                props.clientId(),
                props.clientSecret(),
                props.oauthBaseUrl(),
                props.authBaseUrl(),
                redditRequestExecutor,
                new ResponseDispatcher(objectMapper.getIfAvailable(ObjectMapper::new)));
    }
}
