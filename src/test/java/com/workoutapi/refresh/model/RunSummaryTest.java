package com.workoutapi.refresh.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunSummaryTest {

    @Test
    void testOf_ComputesAverageAndSuccessRate() {
        RunSummary summary = RunSummary.of(8, 2, 0, 800.0);

        assertEquals(10, summary.getTotal());
        assertEquals(100.0, summary.getAvgDurationMs(), 1e-9);
        assertEquals(100.0, summary.getSuccessRate(), 1e-9);
    }

    @Test
    void testOf_EmptyRun_NoDivisionByZero() {
        RunSummary summary = RunSummary.of(0, 0, 0, 0.0);

        assertEquals(0, summary.getTotal());
        assertEquals(0.0, summary.getAvgDurationMs());
        assertEquals(0.0, summary.getSuccessRate());
    }

    @Test
    void testFrom_CountsOutcomesAndAveragesProcessedOnly() {
        List<RefreshResult> results = new ArrayList<>();
        results.add(RefreshResult.processed(1, 100.0, 0));
        results.add(RefreshResult.processed(2, 300.0, 1));
        results.add(RefreshResult.skipped(3, 1.0));
        results.add(RefreshResult.failed(4, "Failed after 3 attempt(s): HTTP 503", 5000.0, 2));

        RunSummary summary = RunSummary.from(results);

        assertEquals(2, summary.getProcessed());
        assertEquals(1, summary.getSkipped());
        assertEquals(1, summary.getFailed());
        assertEquals(4, summary.getTotal());
        assertEquals(200.0, summary.getAvgDurationMs(), 1e-9);
        assertEquals(75.0, summary.getSuccessRate(), 1e-9);
        assertEquals(1, RefreshRun.exitStatusFor(summary));
    }

    @Test
    void testFrom_NoResults() {
        RunSummary summary = RunSummary.from(Collections.emptyList());

        assertEquals(0, summary.getTotal());
        assertEquals(0, RefreshRun.exitStatusFor(summary));
    }
}
