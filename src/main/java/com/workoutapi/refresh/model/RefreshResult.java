package com.workoutapi.refresh.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of refreshing a single exercise. Skipped exercises count as
 * successful.
 */
@Value
@Builder
public class RefreshResult {

    public static final String SKIPPED_MESSAGE = "Skipped (already processed today)";
    public static final String REFRESHED_MESSAGE = "Refreshed successfully";

    long exerciseId;
    boolean success;
    String message;
    double durationMs;
    int retries;
    RefreshOutcome outcome;

    public static RefreshResult processed(long exerciseId, double durationMs, int retries) {
        return RefreshResult.builder()
                .exerciseId(exerciseId)
                .success(true)
                .message(REFRESHED_MESSAGE)
                .durationMs(durationMs)
                .retries(retries)
                .outcome(RefreshOutcome.PROCESSED)
                .build();
    }

    public static RefreshResult skipped(long exerciseId, double durationMs) {
        return RefreshResult.builder()
                .exerciseId(exerciseId)
                .success(true)
                .message(SKIPPED_MESSAGE)
                .durationMs(durationMs)
                .retries(0)
                .outcome(RefreshOutcome.SKIPPED)
                .build();
    }

    public static RefreshResult failed(long exerciseId, String message, double durationMs, int retries) {
        return RefreshResult.builder()
                .exerciseId(exerciseId)
                .success(false)
                .message(message)
                .durationMs(durationMs)
                .retries(retries)
                .outcome(RefreshOutcome.FAILED)
                .build();
    }
}
