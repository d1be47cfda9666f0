package com.workoutapi.refresh.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Everything one batch run produces: per-exercise results, the summary and the
 * process exit status (0 when nothing failed, 1 otherwise).
 */
@Value
@Builder
public class RefreshRun {
    Instant startedAt;
    long totalTimeMs;
    List<RefreshResult> results;
    RunSummary summary;
    int exitStatus;

    public static int exitStatusFor(RunSummary summary) {
        return summary.getFailed() == 0 ? 0 : 1;
    }
}
