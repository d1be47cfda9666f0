package com.workoutapi.refresh.service;

import com.workoutapi.refresh.client.ConcurrencyLimiter;
import com.workoutapi.refresh.client.ExerciseSource;
import com.workoutapi.refresh.model.Exercise;
import com.workoutapi.refresh.model.RefreshResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import static com.workoutapi.refresh.util.RefreshUtils.describe;
import static com.workoutapi.refresh.util.RefreshUtils.elapsedMs;

/**
 * Refreshes one exercise: takes a concurrency slot, claims the idempotency key,
 * then verifies the exercise against the Workout API under the retry policy.
 *
 * <p>
 * Every call produces exactly one {@link RefreshResult}; nothing is thrown to
 * the caller. The slot is returned on every path, and the key is released
 * whenever a claimed exercise does not end in success.
 */
@RequiredArgsConstructor
@Slf4j
public class ExerciseRefresher {

    public static final String OPERATION = "refresh";

    private final ExerciseSource exerciseSource;
    private final IdempotencyStore idempotencyStore;
    private final ConcurrencyLimiter limiter;
    private final RetryPolicy retryPolicy;

    public RefreshResult refresh(Exercise exercise) {
        long exerciseId = exercise.getId();

        try (ConcurrencyLimiter.Slot ignored = limiter.acquire()) {
            return refreshInSlot(exercise, exerciseId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ Exercise {}: interrupted while waiting for a refresh slot", exerciseId);
            return RefreshResult.failed(exerciseId, "Interrupted while waiting for a refresh slot", 0.0, 0);
        }
    }

    private RefreshResult refreshInSlot(Exercise exercise, long exerciseId) {
        long startNanos = System.nanoTime();
        boolean claimed = false;
        boolean refreshed = false;

        try {
            claimed = idempotencyStore.claim(OPERATION, exerciseId);
            if (!claimed) {
                log.info("⏭️ [SKIP] Exercise {} ({}) already refreshed today", exerciseId, exercise.getName());
                return RefreshResult.skipped(exerciseId, elapsedMs(startNanos));
            }

            RetryPolicy.RetryOutcome<Exercise> outcome = retryPolicy.execute("Exercise " + exerciseId,
                    () -> exerciseSource.fetchExercise(exerciseId));

            if (outcome.isSuccess()) {
                refreshed = true;
                double durationMs = elapsedMs(startNanos);
                log.info("✅ [OK] Exercise {} ({}) refreshed in {}ms", exerciseId, exercise.getName(),
                        String.format("%.2f", durationMs));
                return RefreshResult.processed(exerciseId, durationMs, outcome.getAttemptIndex());
            }

            String message = String.format("Failed after %d attempt(s): %s",
                    outcome.getAttempts(), describe(outcome.getLastError()));
            log.warn("❌ [FAILED] Exercise {} ({}): {}", exerciseId, exercise.getName(), message);
            return RefreshResult.failed(exerciseId, message, elapsedMs(startNanos), outcome.getAttemptIndex());

        } catch (RuntimeException e) {
            log.error("💥 Unexpected error refreshing exercise {}", exerciseId, e);
            return RefreshResult.failed(exerciseId, "Unexpected error: " + describe(e), elapsedMs(startNanos), 0);
        } finally {
            // Errors as well as failures: a claimed key only survives a successful refresh
            if (claimed && !refreshed) {
                idempotencyStore.release(OPERATION, exerciseId);
            }
        }
    }
}
