package com.workoutapi.refresh.model;

public enum RefreshOutcome {
    PROCESSED,
    SKIPPED,
    FAILED
}
