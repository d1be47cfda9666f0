package com.workoutapi.refresh.service;

import com.workoutapi.refresh.client.ConcurrencyLimiter;
import com.workoutapi.refresh.client.ExerciseSource;
import com.workoutapi.refresh.config.RefreshConfig;
import com.workoutapi.refresh.exception.ExerciseNotFoundException;
import com.workoutapi.refresh.exception.RefreshInProgressException;
import com.workoutapi.refresh.model.Exercise;
import com.workoutapi.refresh.model.IdempotencyStats;
import com.workoutapi.refresh.model.RefreshResult;
import com.workoutapi.refresh.model.RefreshRun;
import com.workoutapi.refresh.model.RunSummary;
import com.workoutapi.refresh.util.RefreshUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Runs one full refresh batch: lists every exercise, refreshes them all in
 * parallel behind a shared concurrency limiter, and aggregates the results.
 *
 * <p>
 * Item failures are data. The only exceptions that escape {@link #refreshAll()}
 * are raised before any exercise is touched: a
 * {@link com.workoutapi.refresh.exception.RefreshSessionException} when the run
 * cannot open its resources, and a {@link RefreshInProgressException} when
 * another run still holds the run lock. At most one run is active at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExerciseRefreshService {

        private final RefreshConfig config;
        private final RefreshSessionFactory sessionFactory;
        private final MonitoringService monitoringService;
        private final Clock clock;

        private final ReentrantLock runLock = new ReentrantLock();

        public RefreshRun refreshAll() {
                if (!runLock.tryLock()) {
                        log.warn("⏳ Refresh requested while another run is in progress, not starting");
                        throw new RefreshInProgressException();
                }
                try {
                        return runExclusively();
                } finally {
                        runLock.unlock();
                }
        }

        private RefreshRun runExclusively() {
                Instant startedAt = clock.instant();
                long startNanos = System.nanoTime();

                log.info("═══════════════════════════════════════════════════════════════════");
                log.info("🏋️ EXERCISE REFRESH STARTED | Time: {}", startedAt);
                log.info("   API URL: {} | Store: {}", config.getApiUrl(), RefreshUtils.redactUrl(config.getStoreUrl()));
                log.info("   Max Concurrency: {} | Max Retries: {}", config.getMaxConcurrency(), config.getMaxRetries());
                log.info("═══════════════════════════════════════════════════════════════════");

                try (RefreshSession session = sessionFactory.open(config)) {
                        IdempotencyStats stats = session.getIdempotencyStore().stats();
                        log.info("🗄️ Idempotency store: {} ({} keys, ttl={}s)", stats.getStoreKind(),
                                        stats.getProcessedCount(), stats.getTtlSeconds());

                        List<RefreshResult> results = refreshExercises(session);
                        RunSummary summary = RunSummary.from(results);
                        long totalTimeMs = (System.nanoTime() - startNanos) / 1_000_000;

                        RefreshRun run = RefreshRun.builder()
                                        .startedAt(startedAt)
                                        .totalTimeMs(totalTimeMs)
                                        .results(results)
                                        .summary(summary)
                                        .exitStatus(RefreshRun.exitStatusFor(summary))
                                        .build();

                        logSummary(run);
                        monitoringService.recordRunDuration(totalTimeMs, run.getExitStatus() == 0 ? "SUCCESS" : "FAILED");
                        monitoringService.recordOutcomes(summary);
                        return run;
                }
        }

        public IdempotencyStats idempotencyStats() {
                try (RefreshSession session = sessionFactory.open(config)) {
                        return session.getIdempotencyStore().stats();
                }
        }

        List<RefreshResult> refreshExercises(RefreshSession session) {
                List<Exercise> exercises = fetchExercises(session.getExerciseSource());
                if (exercises.isEmpty()) {
                        log.warn("⚠️ No exercises to refresh");
                        return Collections.emptyList();
                }

                log.info("🔄 Starting refresh of {} exercises (max concurrency: {})", exercises.size(),
                                config.getMaxConcurrency());

                ConcurrencyLimiter limiter = new ConcurrencyLimiter(config.getMaxConcurrency());
                RetryPolicy retryPolicy = new RetryPolicy(config.getMaxRetries(), config.getRetryBaseDelay(),
                                ExerciseNotFoundException.class::isInstance);
                ExerciseRefresher refresher = new ExerciseRefresher(session.getExerciseSource(),
                                session.getIdempotencyStore(), limiter, retryPolicy);

                // Never smaller than the limiter, or the concurrency ceiling could not be reached
                int poolSize = Math.min(exercises.size(),
                                Math.max(config.getWorkerThreads(), config.getMaxConcurrency()));
                ExecutorService executor = Executors.newFixedThreadPool(poolSize);
                try {
                        List<CompletableFuture<RefreshResult>> futures = exercises.stream()
                                        .map(exercise -> CompletableFuture
                                                        .supplyAsync(() -> refresher.refresh(exercise), executor)
                                                        .exceptionally(e -> unexpectedFailure(exercise, e)))
                                        .collect(Collectors.toList());

                        return futures.stream()
                                        .map(CompletableFuture::join)
                                        .collect(Collectors.toList());
                } finally {
                        executor.shutdown();
                }
        }

        private List<Exercise> fetchExercises(ExerciseSource exerciseSource) {
                try {
                        List<Exercise> exercises = exerciseSource.listExercises();
                        if (exercises == null) {
                                return Collections.emptyList();
                        }
                        List<Exercise> valid = exercises.stream()
                                        .filter(Objects::nonNull)
                                        .filter(exercise -> exercise.getId() != null)
                                        .collect(Collectors.toList());
                        if (valid.size() < exercises.size()) {
                                log.warn("⚠️ Ignoring {} exercises without an id", exercises.size() - valid.size());
                        }
                        return valid;
                } catch (Exception e) {
                        log.error("❌ Failed to fetch exercises: {}", RefreshUtils.describe(e));
                        return Collections.emptyList();
                }
        }

        private RefreshResult unexpectedFailure(Exercise exercise, Throwable error) {
                Throwable cause = error.getCause() != null ? error.getCause() : error;
                log.error("💥 Refresh task for exercise {} died", exercise.getId(), cause);
                return RefreshResult.failed(exercise.getId(), "Unexpected error: " + RefreshUtils.describe(cause), 0.0, 0);
        }

        private void logSummary(RefreshRun run) {
                RunSummary summary = run.getSummary();
                log.info("═══════════════════════════════════════════════════════════════════");
                log.info("🏁 REFRESH COMPLETE");
                log.info("═══════════════════════════════════════════════════════════════════");
                log.info("Processed: {}", summary.getProcessed());
                log.info("Skipped (idempotent): {}", summary.getSkipped());
                log.info("Failed: {}", summary.getFailed());
                log.info("Total: {}", summary.getTotal());
                log.info("Success Rate: {}%", String.format("%.1f", summary.getSuccessRate()));
                log.info("Avg Duration: {}ms", String.format("%.2f", summary.getAvgDurationMs()));
                log.info("Total Time: {}s", String.format("%.2f", run.getTotalTimeMs() / 1000.0));
                log.info("═══════════════════════════════════════════════════════════════════");
        }
}
