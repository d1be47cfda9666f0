package com.workoutapi.refresh.repository.redis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisKeyValueBackendTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisKeyValueBackend backend;

    @BeforeEach
    void setUp() {
        backend = new RedisKeyValueBackend(redisTemplate);
    }

    @Test
    void testSetIfAbsent_MapsNullReplyToFalse() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent("k", "processed", Duration.ofSeconds(60))).thenReturn(true, false, null);

        assertTrue(backend.setIfAbsent("k", "processed", Duration.ofSeconds(60)));
        assertFalse(backend.setIfAbsent("k", "processed", Duration.ofSeconds(60)));
        assertFalse(backend.setIfAbsent("k", "processed", Duration.ofSeconds(60)));
    }

    @Test
    void testKeysByPrefix_UsesPatternAndHandlesNull() {
        when(redisTemplate.keys("idempotency:*")).thenReturn(Set.of("idempotency:refresh:1:2024-05-01"), (Set<String>) null);

        assertEquals(1, backend.keysByPrefix("idempotency:").size());
        assertTrue(backend.keysByPrefix("idempotency:").isEmpty());
    }

    @Test
    void testDelete_DelegatesToTemplate() {
        backend.delete("idempotency:refresh:1:2024-05-01");

        verify(redisTemplate).delete("idempotency:refresh:1:2024-05-01");
    }

    @Test
    void testPing_PropagatesConnectionFailure() {
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenThrow(new RedisConnectionFailureException("Unable to connect to Redis"));

        assertThrows(RedisConnectionFailureException.class, backend::ping);
    }

    @Test
    void testPing_NoReplyIsAFailure() {
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn(null);

        assertThrows(IllegalStateException.class, backend::ping);
    }
}
