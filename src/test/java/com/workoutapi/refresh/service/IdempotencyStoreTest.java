package com.workoutapi.refresh.service;

import com.workoutapi.refresh.model.IdempotencyStats;
import com.workoutapi.refresh.repository.KeyValueBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdempotencyStoreTest {

    private static final Duration TTL = Duration.ofHours(1);

    @Mock
    private KeyValueBackend backend;

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:15:30Z"));
    }

    @Test
    void testKeyFor_UsesOperationIdAndUtcDay() {
        IdempotencyStore store = new IdempotencyStore(null, TTL, clock);

        assertEquals("idempotency:refresh:42:2024-05-01", store.keyFor("refresh", 42));
        assertEquals(store.keyFor("refresh", 42), store.keyFor("refresh", 42));
    }

    @Test
    void testClaim_InMemory_SecondClaimSameDayIsRejected() {
        IdempotencyStore store = new IdempotencyStore(null, TTL, clock);

        assertTrue(store.claim("refresh", 1));
        assertFalse(store.claim("refresh", 1));
    }

    @Test
    void testClaim_InMemory_DifferentIdsAreIndependent() {
        IdempotencyStore store = new IdempotencyStore(null, TTL, clock);

        assertTrue(store.claim("refresh", 1));
        assertTrue(store.claim("refresh", 2));
        assertTrue(store.claim("recalculate", 1));
    }

    @Test
    void testRelease_InMemory_AllowsClaimAgain() {
        IdempotencyStore store = new IdempotencyStore(null, TTL, clock);

        assertTrue(store.claim("refresh", 1));
        store.release("refresh", 1);

        assertTrue(store.claim("refresh", 1));
    }

    @Test
    void testClaim_NewDay_AllowsReprocessing() {
        IdempotencyStore store = new IdempotencyStore(null, Duration.ofDays(2), clock);
        assertTrue(store.claim("refresh", 1));

        clock.advance(Duration.ofDays(1));

        assertTrue(store.claim("refresh", 1));
    }

    @Test
    void testClaim_InMemory_ExpiredEntryCanBeClaimedAgain() {
        IdempotencyStore store = new IdempotencyStore(null, Duration.ofMinutes(5), clock);
        assertTrue(store.claim("refresh", 1));

        clock.advance(Duration.ofMinutes(6));

        assertTrue(store.claim("refresh", 1));
    }

    @Test
    void testClaim_Redis_DelegatesSetIfAbsentWithTtl() {
        IdempotencyStore store = new IdempotencyStore(backend, TTL, clock);
        when(backend.setIfAbsent("idempotency:refresh:1:2024-05-01", "processed", TTL))
                .thenReturn(true, false);

        assertTrue(store.claim("refresh", 1));
        assertFalse(store.claim("refresh", 1));
        assertEquals("redis", store.storeKind());
    }

    @Test
    void testClaim_RedisError_FallsBackToSharedMemoryMap() {
        IdempotencyStore store = new IdempotencyStore(backend, TTL, clock);
        when(backend.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new IllegalStateException("connection reset"));

        // Both fallback calls see the same in-process map
        assertTrue(store.claim("refresh", 7));
        assertFalse(store.claim("refresh", 7));
    }

    @Test
    void testRelease_Redis_DeletesKeyAndClearsFallback() {
        IdempotencyStore store = new IdempotencyStore(backend, TTL, clock);
        when(backend.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new IllegalStateException("timeout"))
                .thenReturn(true);

        assertTrue(store.claim("refresh", 3));
        store.release("refresh", 3);

        verify(backend).delete("idempotency:refresh:3:2024-05-01");
        assertTrue(store.claim("refresh", 3));
    }

    @Test
    void testRelease_RedisError_IsNotRaised() {
        IdempotencyStore store = new IdempotencyStore(backend, TTL, clock);
        doThrow(new IllegalStateException("down")).when(backend).delete(anyString());

        assertDoesNotThrow(() -> store.release("refresh", 1));
    }

    @Test
    void testStats_Redis_CountsKeysByPrefix() {
        IdempotencyStore store = new IdempotencyStore(backend, TTL, clock);
        when(backend.keysByPrefix("idempotency:")).thenReturn(Set.of("idempotency:refresh:1:2024-05-01",
                "idempotency:refresh:2:2024-05-01"));

        IdempotencyStats stats = store.stats();

        assertEquals("redis", stats.getStoreKind());
        assertEquals(2, stats.getProcessedCount());
        assertEquals(3600, stats.getTtlSeconds());
    }

    @Test
    void testStats_RedisError_ReportsMemoryStore() {
        IdempotencyStore store = new IdempotencyStore(backend, TTL, clock);
        when(backend.keysByPrefix(anyString())).thenThrow(new IllegalStateException("down"));

        IdempotencyStats stats = store.stats();

        assertEquals("memory", stats.getStoreKind());
        assertEquals(0, stats.getProcessedCount());
    }

    @Test
    void testStats_InMemory_CountsClaimedKeys() {
        IdempotencyStore store = new IdempotencyStore(null, TTL, clock);
        store.claim("refresh", 1);
        store.claim("refresh", 2);

        IdempotencyStats stats = store.stats();

        assertEquals("memory", stats.getStoreKind());
        assertEquals(2, stats.getProcessedCount());
        assertEquals(3600, stats.getTtlSeconds());
    }
}
