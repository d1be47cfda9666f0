package com.workoutapi.refresh.service;

import com.workoutapi.refresh.client.ExerciseSource;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Resources owned by exactly one refresh run: the Workout API client and the
 * idempotency store with its backend connection. Closing releases them in
 * reverse order of acquisition.
 */
@Slf4j
public class RefreshSession implements AutoCloseable {

    @Getter
    private final ExerciseSource exerciseSource;

    @Getter
    private final IdempotencyStore idempotencyStore;

    private final List<Runnable> closeActions;

    public RefreshSession(ExerciseSource exerciseSource, IdempotencyStore idempotencyStore,
            List<Runnable> closeActions) {
        this.exerciseSource = exerciseSource;
        this.idempotencyStore = idempotencyStore;
        this.closeActions = new ArrayList<>(closeActions);
    }

    @Override
    public void close() {
        for (int i = closeActions.size() - 1; i >= 0; i--) {
            try {
                closeActions.get(i).run();
            } catch (RuntimeException e) {
                log.warn("⚠️ Failed to release refresh session resource: {}", e.getMessage(), e);
            }
        }
        closeActions.clear();
    }
}
