package com.hydra.runtime.retry;

import com.hydra.config.BackoffStrategy;
import com.hydra.config.RetryOptions;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Computes the wait before the next attempt.
 *
 * <p>Delay formula: {@code initialWait * 2^(attempt-1)} for exponential backoff,
 * {@code initialWait} for fixed backoff. With jitter the delay is scaled by a factor in
 * [0.9, 1.1). The result is never below {@link #MIN_WAIT}.</p>
 */
public final class BackoffCalculator {

    public static final Duration MIN_WAIT = Duration.ofMillis(100);

    // 2^30 already exceeds any sensible wait; larger shifts are clamped
    private static final int MAX_SHIFT = 30;

    private BackoffCalculator() {
    }

    /**
     * @param options the effective retry options
     * @param attempt the number of attempts made so far, at least 1
     * @param random source of values in [0, 1), used only when jitter is enabled
     * @return the wait before the next attempt
     */
    public static Duration computeWait(RetryOptions options, int attempt, DoubleSupplier random) {
        double baseMillis = options.getInitialWait().toNanos() / 1_000_000.0;
        double waitMillis = baseMillis;
        if (options.getBackoffStrategy() == BackoffStrategy.EXPONENTIAL && attempt > 1) {
            waitMillis = baseMillis * (1L << Math.min(attempt - 1, MAX_SHIFT));
        }
        if (options.isJitter()) {
            waitMillis = waitMillis * (0.9 + random.getAsDouble() * 0.2);
        }
        Duration wait = Duration.ofNanos(Math.round(waitMillis * 1_000_000.0));
        return wait.compareTo(MIN_WAIT) < 0 ? MIN_WAIT : wait;
    }
}
