package com.workoutapi.refresh.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Aggregate counters for one batch run. Computed once from the complete result
 * list; never updated incrementally.
 */
@Value
@Builder
public class RunSummary {
    int processed;
    int skipped;
    int failed;
    int total;
    double avgDurationMs;
    double successRate;

    public static RunSummary from(List<RefreshResult> results) {
        int processed = 0;
        int skipped = 0;
        int failed = 0;
        double processedDurationMs = 0.0;

        for (RefreshResult result : results) {
            switch (result.getOutcome()) {
                case PROCESSED:
                    processed++;
                    processedDurationMs += result.getDurationMs();
                    break;
                case SKIPPED:
                    skipped++;
                    break;
                default:
                    failed++;
            }
        }
        return of(processed, skipped, failed, processedDurationMs);
    }

    /**
     * @param processedDurationMs summed duration of processed exercises only
     */
    public static RunSummary of(int processed, int skipped, int failed, double processedDurationMs) {
        int total = processed + skipped + failed;
        return RunSummary.builder()
                .processed(processed)
                .skipped(skipped)
                .failed(failed)
                .total(total)
                .avgDurationMs(processed > 0 ? processedDurationMs / processed : 0.0)
                .successRate(total > 0 ? (processed + skipped) * 100.0 / total : 0.0)
                .build();
    }
}
