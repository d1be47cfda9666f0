package com.workoutapi.refresh.repository.redis;

import com.workoutapi.refresh.repository.KeyValueBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Collections;
import java.util.Set;

/**
 * {@link KeyValueBackend} on Redis. {@code setIfAbsent} maps to
 * {@code SET key value NX EX ttl}.
 */
@RequiredArgsConstructor
@Slf4j
public class RedisKeyValueBackend implements KeyValueBackend {

    private final StringRedisTemplate redisTemplate;

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Boolean set = redisTemplate.opsForValue().setIfAbsent(key, value, ttl);
        log.trace("SET NX key={}, ttl={}s -> {}", key, ttl.getSeconds(), set);
        return Boolean.TRUE.equals(set);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
        log.debug("Deleted from Redis: key={}", key);
    }

    @Override
    public Set<String> keysByPrefix(String prefix) {
        Set<String> keys = redisTemplate.keys(prefix + "*");
        return keys != null ? keys : Collections.emptySet();
    }

    @Override
    public void ping() {
        String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        if (pong == null) {
            throw new IllegalStateException("Redis did not answer PING");
        }
    }
}
