package com.workoutapi.refresh.service;

import com.workoutapi.refresh.util.RefreshUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Attempt loop with exponential backoff.
 *
 * <p>
 * {@code maxAttempts} is the total number of calls, never fewer than one. After
 * a failed attempt {@code i} (0-based) the policy sleeps
 * {@code baseDelay * 2^i} before trying again; no sleep follows the last
 * attempt. Failures matching the terminal predicate stop the loop at once.
 */
@Slf4j
public class RetryPolicy {

    // 2^30 times any sane base delay is already far beyond a useful backoff
    private static final int MAX_BACKOFF_SHIFT = 30;

    @Getter
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Predicate<Throwable> terminal;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, Duration baseDelay, Predicate<Throwable> terminal) {
        this(maxRetries, baseDelay, terminal, Sleeper.THREAD_SLEEP);
    }

    public RetryPolicy(int maxRetries, Duration baseDelay, Predicate<Throwable> terminal, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxRetries);
        this.baseDelay = baseDelay;
        this.terminal = terminal;
        this.sleeper = sleeper;
    }

    /**
     * Backoff slept after the failed attempt with the given 0-based index.
     */
    public Duration delayAfterAttempt(int attemptIndex) {
        int shift = Math.min(Math.max(attemptIndex, 0), MAX_BACKOFF_SHIFT);
        return baseDelay.multipliedBy(1L << shift);
    }

    /**
     * Runs the call until it succeeds, fails terminally, or attempts run out.
     * Never throws: the last error is reported in the outcome.
     *
     * @param label used in retry log lines, e.g. "Exercise 42"
     */
    public <T> RetryOutcome<T> execute(String label, Callable<T> call) {
        Exception lastError = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return RetryOutcome.success(call.call(), attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("⚠️ {}: interrupted during attempt {}", label, attempt + 1);
                return RetryOutcome.failure(e, attempt, false);
            } catch (Exception e) {
                lastError = e;
                if (terminal.test(e)) {
                    log.warn("⛔ {}: {} (not retried)", label, RefreshUtils.describe(e));
                    return RetryOutcome.failure(e, attempt, true);
                }
                log.warn("🔁 [RETRY {}/{}] {}: {}", attempt + 1, maxAttempts, label, RefreshUtils.describe(e));
            }

            if (attempt < maxAttempts - 1) {
                try {
                    sleeper.sleep(delayAfterAttempt(attempt));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("⚠️ {}: interrupted during backoff, giving up", label);
                    return RetryOutcome.failure(lastError, attempt, false);
                }
            }
        }
        return RetryOutcome.failure(lastError, maxAttempts - 1, false);
    }

    @FunctionalInterface
    public interface Sleeper {

        Sleeper THREAD_SLEEP = delay -> TimeUnit.MILLISECONDS.sleep(delay.toMillis());

        void sleep(Duration delay) throws InterruptedException;
    }

    /**
     * Result of {@link #execute}. {@code attemptIndex} is the 0-based index of
     * the last attempt made, which is also the number of retries used.
     */
    @Getter
    public static final class RetryOutcome<T> {

        private final boolean success;
        private final T value;
        private final Exception lastError;
        private final int attemptIndex;
        private final boolean terminal;

        private RetryOutcome(boolean success, T value, Exception lastError, int attemptIndex, boolean terminal) {
            this.success = success;
            this.value = value;
            this.lastError = lastError;
            this.attemptIndex = attemptIndex;
            this.terminal = terminal;
        }

        static <T> RetryOutcome<T> success(T value, int attemptIndex) {
            return new RetryOutcome<>(true, value, null, attemptIndex, false);
        }

        static <T> RetryOutcome<T> failure(Exception lastError, int attemptIndex, boolean terminal) {
            return new RetryOutcome<>(false, null, lastError, attemptIndex, terminal);
        }

        public int getAttempts() {
            return attemptIndex + 1;
        }
    }
}
