package com.sandkev.redditclient.shared.http;

import com.sandkev.redditclient.metrics.Instrumentation;
import io.netty.util.AttributeKey;
import reactor.netty.Connection;
import reactor.netty.ConnectionObserver;

import java.util.List;
import java.util.function.LongSupplier;

/**
 * Reports pool behaviour: fresh connections, reused ones, and how long a reused
 * connection sat idle in the pool.
 */
public class ConnectionInstrumentation implements ConnectionObserver {

    static final AttributeKey<Long> RELEASED_AT = AttributeKey.valueOf("reddit.connection.releasedAt");

    private final Instrumentation metrics;
    private final LongSupplier nowMillis;

    public ConnectionInstrumentation(Instrumentation metrics) {
        this(metrics, System::currentTimeMillis);
    }

    ConnectionInstrumentation(Instrumentation metrics, LongSupplier nowMillis) {
        this.metrics = metrics;
        this.nowMillis = nowMillis;
    }

    @Override
    public void onStateChange(Connection connection, State newState) {
        if (newState == State.CONNECTED) {
            metrics.increment("reddit.api.connections.created", List.of(), 0.1);
        } else if (newState == State.ACQUIRED) {
            metrics.increment("reddit.api.connections.reused", List.of(), 0.1);
            Long releasedAt = connection.channel().attr(RELEASED_AT).getAndSet(null);
            if (releasedAt != null) {
                metrics.record("reddit.api.connections.idle_time", nowMillis.getAsLong() - releasedAt, List.of(), 0.1);
            }
        } else if (newState == State.RELEASED) {
            connection.channel().attr(RELEASED_AT).set(nowMillis.getAsLong());
        }
    }
}
