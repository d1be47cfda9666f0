package com.workoutapi.refresh.service;

import com.workoutapi.refresh.model.IdempotencyStats;
import com.workoutapi.refresh.repository.KeyValueBackend;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Day-scoped idempotency guard for refresh operations.
 *
 * <p>
 * Keys look like {@code idempotency:refresh:42:2024-05-01} (UTC day), so an
 * exercise processed today is skipped until the next day or until the key
 * expires. The shared backend is optional: when it is absent, or when a single
 * call to it fails, the store falls back to one in-process map that lives as
 * long as this instance. That fallback is not shared between worker processes.
 */
@Slf4j
public class IdempotencyStore {

    public static final String KEY_PREFIX = "idempotency:";
    public static final String STORE_REDIS = "redis";
    public static final String STORE_MEMORY = "memory";

    private static final String PROCESSED = "processed";

    private final KeyValueBackend backend;
    private final Duration ttl;
    private final Clock clock;

    // key -> expiry
    private final Map<String, Instant> memoryStore = new ConcurrentHashMap<>();

    /**
     * @param backend shared backend, or {@code null} to run in memory only
     */
    public IdempotencyStore(KeyValueBackend backend, Duration ttl, Clock clock) {
        this.backend = backend;
        this.ttl = ttl;
        this.clock = clock;
    }

    public String keyFor(String operation, long resourceId) {
        String day = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).format(DateTimeFormatter.ISO_LOCAL_DATE);
        return KEY_PREFIX + operation + ":" + resourceId + ":" + day;
    }

    /**
     * Marks the operation as processed for today if nobody has yet.
     *
     * @return true if the caller may proceed, false if it must skip
     */
    public boolean claim(String operation, long resourceId) {
        String key = keyFor(operation, resourceId);

        if (backend != null) {
            try {
                return backend.setIfAbsent(key, PROCESSED, ttl);
            } catch (RuntimeException e) {
                log.warn("⚠️ Redis error on claim for {}, falling back to memory: {}", key, e.getMessage());
            }
        }
        return claimInMemory(key);
    }

    /**
     * Removes the key so a failed exercise can be retried by a later run today.
     * Best-effort: backend errors are logged.
     */
    public void release(String operation, long resourceId) {
        String key = keyFor(operation, resourceId);
        memoryStore.remove(key);

        if (backend != null) {
            try {
                backend.delete(key);
            } catch (RuntimeException e) {
                log.warn("⚠️ Redis error removing key {}: {}", key, e.getMessage());
            }
        }
    }

    public IdempotencyStats stats() {
        if (backend != null) {
            try {
                return IdempotencyStats.builder()
                        .storeKind(STORE_REDIS)
                        .processedCount(backend.keysByPrefix(KEY_PREFIX).size())
                        .ttlSeconds(ttl.getSeconds())
                        .build();
            } catch (RuntimeException e) {
                log.warn("⚠️ Redis error reading stats, reporting memory store: {}", e.getMessage());
            }
        }

        Instant now = clock.instant();
        long live = memoryStore.values().stream().filter(expiresAt -> expiresAt.isAfter(now)).count();
        return IdempotencyStats.builder()
                .storeKind(STORE_MEMORY)
                .processedCount(live)
                .ttlSeconds(ttl.getSeconds())
                .build();
    }

    public String storeKind() {
        return backend != null ? STORE_REDIS : STORE_MEMORY;
    }

    private boolean claimInMemory(String key) {
        Instant now = clock.instant();
        AtomicBoolean claimed = new AtomicBoolean(false);
        memoryStore.compute(key, (k, expiresAt) -> {
            if (expiresAt != null && expiresAt.isAfter(now)) {
                return expiresAt;
            }
            claimed.set(true);
            return now.plus(ttl);
        });
        return claimed.get();
    }
}
