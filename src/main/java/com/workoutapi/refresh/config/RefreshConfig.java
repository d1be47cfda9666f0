package com.workoutapi.refresh.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Immutable configuration snapshot for one refresh worker.
 * Built once at startup and shared read-only by every refresh task.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class RefreshConfig {

    @Builder.Default
    private final String apiUrl = "http://localhost:8000";

    @Builder.Default
    private final String storeUrl = "redis://localhost:6379/0";

    @Builder.Default
    private final int maxConcurrency = 3;

    /**
     * Maximum number of attempts per exercise (not extra retries). Zero still
     * means one attempt.
     */
    @Builder.Default
    private final int maxRetries = 3;

    @Builder.Default
    private final Duration retryBaseDelay = Duration.ofSeconds(1);

    @Builder.Default
    private final Duration idempotencyTtl = Duration.ofSeconds(3600);

    @Builder.Default
    private final Duration timeout = Duration.ofSeconds(10);

    @Builder.Default
    private final int workerThreads = 16;

    /**
     * Checks every constraint and returns this instance.
     *
     * @throws IllegalArgumentException if any value is out of range
     */
    public RefreshConfig validate() {
        requireText(apiUrl, "apiUrl");
        requireText(storeUrl, "storeUrl");
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive, got " + maxConcurrency);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative, got " + maxRetries);
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive, got " + workerThreads);
        }
        requirePositive(retryBaseDelay, "retryBaseDelay");
        requirePositive(idempotencyTtl, "idempotencyTtl");
        requirePositive(timeout, "timeout");
        return this;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration, got " + value);
        }
    }
}
