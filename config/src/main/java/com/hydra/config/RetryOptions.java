package com.hydra.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Fully resolved retry policy for one attempt cycle of a module operation.
 *
 * <p>Instances are immutable. Layering is done with {@link #merge(RetryOverrides)},
 * which replaces only the fields an override block actually sets.</p>
 */
public final class RetryOptions {

    /**
     * Built-in defaults used beneath every configured bucket.
     */
    public static final RetryOptions DEFAULT =
            new RetryOptions(Duration.ofSeconds(1), 5, true, false, BackoffStrategy.EXPONENTIAL);

    private final Duration initialWait;
    private final int maxAttempts;
    private final boolean printWarning;
    private final boolean jitter;
    private final BackoffStrategy backoffStrategy;

    public RetryOptions(Duration initialWait, int maxAttempts, boolean printWarning,
                        boolean jitter, BackoffStrategy backoffStrategy) {
        if (initialWait == null || initialWait.isNegative()) {
            throw new HydraConfigException("initial-wait must be a non-negative duration, got: " + initialWait);
        }
        if (maxAttempts < 1) {
            throw new HydraConfigException("max-attempts must be >= 1, got: " + maxAttempts);
        }
        this.initialWait = initialWait;
        this.maxAttempts = maxAttempts;
        this.printWarning = printWarning;
        this.jitter = jitter;
        this.backoffStrategy = Objects.requireNonNull(backoffStrategy, "backoffStrategy");
    }

    /**
     * Return a copy with every field set in {@code overrides} replaced.
     *
     * @param overrides the override block, may be {@code null}
     * @return merged options, or {@code this} when nothing is overridden
     */
    public RetryOptions merge(RetryOverrides overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        return new RetryOptions(
                overrides.getInitialWait().orElse(initialWait),
                overrides.getMaxAttempts().orElse(maxAttempts),
                overrides.getPrintWarning().orElse(printWarning),
                overrides.getJitter().orElse(jitter),
                overrides.getBackoffStrategy().orElse(backoffStrategy));
    }

    public Duration getInitialWait() {
        return initialWait;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isPrintWarning() {
        return printWarning;
    }

    public boolean isJitter() {
        return jitter;
    }

    public BackoffStrategy getBackoffStrategy() {
        return backoffStrategy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryOptions)) return false;
        RetryOptions that = (RetryOptions) o;
        return maxAttempts == that.maxAttempts
                && printWarning == that.printWarning
                && jitter == that.jitter
                && initialWait.equals(that.initialWait)
                && backoffStrategy == that.backoffStrategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(initialWait, maxAttempts, printWarning, jitter, backoffStrategy);
    }

    @Override
    public String toString() {
        return "RetryOptions{" +
               "initialWait=" + initialWait +
               ", maxAttempts=" + maxAttempts +
               ", printWarning=" + printWarning +
               ", jitter=" + jitter +
               ", backoff=" + backoffStrategy +
               '}';
    }
}
