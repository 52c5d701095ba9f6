package com.sandkev.redditclient.store;

import com.sandkev.redditclient.error.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

@RequiredArgsConstructor
public class RedisSharedStore implements SharedStore {

    private final StringRedisTemplate redis;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(call("GET " + key, () -> redis.opsForValue().get(key)));
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        call("SETEX " + key, () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public long incrementField(String mapKey, String field, long delta) {
        Long n = call("HINCRBY " + mapKey, () -> redis.opsForHash().increment(mapKey, field, delta));
        return n == null ? 0L : n;
    }

    @Override
    public void setField(String mapKey, String field, String value) {
        call("HSET " + mapKey, () -> {
            redis.opsForHash().put(mapKey, field, value);
            return null;
        });
    }

    private static <T> T call(String op, Supplier<T> redisCall) {
        try {
            return redisCall.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis " + op + " failed: " + e.getMessage(), e);
        }
    }
}
