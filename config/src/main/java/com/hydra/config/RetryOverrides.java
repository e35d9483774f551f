package com.hydra.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.time.Duration;
import java.util.Optional;

/**
 * A partial retry block: every field is optional and only present fields win
 * when merged into {@link RetryOptions}.
 *
 * <p>HOCON form:</p>
 * <pre>{@code
 * init {
 *   initial-wait = 500ms
 *   max-attempts = 10
 *   print-warning = true
 *   jitter = false
 *   backoff = fixed
 * }
 * }</pre>
 */
public final class RetryOverrides {

    public static final RetryOverrides NONE = new RetryOverrides(null, null, null, null, null);

    private final Duration initialWait;
    private final Integer maxAttempts;
    private final Boolean printWarning;
    private final Boolean jitter;
    private final BackoffStrategy backoffStrategy;

    private RetryOverrides(Duration initialWait, Integer maxAttempts, Boolean printWarning,
                           Boolean jitter, BackoffStrategy backoffStrategy) {
        this.initialWait = initialWait;
        this.maxAttempts = maxAttempts;
        this.printWarning = printWarning;
        this.jitter = jitter;
        this.backoffStrategy = backoffStrategy;
    }

    /**
     * Parse an override block. Keys other than the five retry keys are ignored,
     * so a module block may nest per-phase blocks next to its general keys.
     *
     * @param config the block to read
     * @return the parsed overrides
     * @throws HydraConfigException if a present key has the wrong type
     */
    public static RetryOverrides fromConfig(Config config) {
        try {
            Duration initialWait = config.hasPath("initial-wait") ? config.getDuration("initial-wait") : null;
            Integer maxAttempts = config.hasPath("max-attempts") ? config.getInt("max-attempts") : null;
            Boolean printWarning = config.hasPath("print-warning") ? config.getBoolean("print-warning") : null;
            Boolean jitter = config.hasPath("jitter") ? config.getBoolean("jitter") : null;
            BackoffStrategy backoff = config.hasPath("backoff")
                    ? BackoffStrategy.parse(config.getString("backoff")) : null;

            if (initialWait != null && initialWait.isNegative()) {
                throw new HydraConfigException("initial-wait must not be negative: " + initialWait);
            }
            if (maxAttempts != null && maxAttempts < 1) {
                throw new HydraConfigException("max-attempts must be >= 1, got: " + maxAttempts);
            }
            return new RetryOverrides(initialWait, maxAttempts, printWarning, jitter, backoff);
        } catch (ConfigException e) {
            throw new HydraConfigException("Invalid retry options: " + e.getMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return initialWait == null && maxAttempts == null && printWarning == null
                && jitter == null && backoffStrategy == null;
    }

    public Optional<Duration> getInitialWait() {
        return Optional.ofNullable(initialWait);
    }

    public Optional<Integer> getMaxAttempts() {
        return Optional.ofNullable(maxAttempts);
    }

    public Optional<Boolean> getPrintWarning() {
        return Optional.ofNullable(printWarning);
    }

    public Optional<Boolean> getJitter() {
        return Optional.ofNullable(jitter);
    }

    public Optional<BackoffStrategy> getBackoffStrategy() {
        return Optional.ofNullable(backoffStrategy);
    }

    @Override
    public String toString() {
        return "RetryOverrides{" +
               "initialWait=" + initialWait +
               ", maxAttempts=" + maxAttempts +
               ", printWarning=" + printWarning +
               ", jitter=" + jitter +
               ", backoff=" + backoffStrategy +
               '}';
    }

    /**
     * Builder for programmatic overrides.
     */
    public static final class Builder {
        private Duration initialWait;
        private Integer maxAttempts;
        private Boolean printWarning;
        private Boolean jitter;
        private BackoffStrategy backoffStrategy;

        private Builder() {}

        public Builder initialWait(Duration initialWait) {
            this.initialWait = initialWait;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder printWarning(boolean printWarning) {
            this.printWarning = printWarning;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder backoff(BackoffStrategy backoffStrategy) {
            this.backoffStrategy = backoffStrategy;
            return this;
        }

        public RetryOverrides build() {
            return new RetryOverrides(initialWait, maxAttempts, printWarning, jitter, backoffStrategy);
        }
    }
}
