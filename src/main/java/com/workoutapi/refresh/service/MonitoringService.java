package com.workoutapi.refresh.service;

import com.workoutapi.refresh.model.RunSummary;

public interface MonitoringService {
    /**
     * Records the wall-clock duration and status of a refresh run.
     *
     * @param durationMs The duration of the run in milliseconds
     * @param status     "SUCCESS" when no exercise failed, otherwise "FAILED"
     */
    void recordRunDuration(long durationMs, String status);

    /**
     * Records processed, skipped and failed counts of a finished run.
     */
    void recordOutcomes(RunSummary summary);
}
