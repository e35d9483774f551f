package com.hydra.runtime.retry;

import com.hydra.config.LifecyclePhase;
import com.hydra.config.ModuleDescriptor;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A retryable operation on behalf of one module and phase.
 *
 * <pre>{@code
 * RetryRequest<ModuleInstance> request = RetryRequest.builder("Data.ProfileLoader", LifecyclePhase.LOAD, operation)
 *     .descriptor(entry.getDescriptor())
 *     .onSuccess(instance -> entry.markLoaded(instance))
 *     .onRetry((attempt, error) -> log.warn("Load retry {}: {}", attempt, error))
 *     .build();
 * }</pre>
 */
public final class RetryRequest<T> {

    /**
     * Per-attempt failure listener.
     */
    @FunctionalInterface
    public interface AttemptListener {
        void onRetry(int attempt, String error);
    }

    private final String moduleName;
    private final LifecyclePhase phase;
    private final AsyncOperation<T> operation;
    private final ModuleDescriptor descriptor;
    private final Consumer<T> onSuccess;
    private final Consumer<T> onRecovered;
    private final AttemptListener onRetry;
    private final Consumer<String> onFailure;

    private RetryRequest(Builder<T> builder) {
        this.moduleName = builder.moduleName;
        this.phase = builder.phase;
        this.operation = builder.operation;
        this.descriptor = builder.descriptor;
        this.onSuccess = builder.onSuccess;
        this.onRecovered = builder.onRecovered;
        this.onRetry = builder.onRetry;
        this.onFailure = builder.onFailure;
    }

    public static <T> Builder<T> builder(String moduleName, LifecyclePhase phase, AsyncOperation<T> operation) {
        return new Builder<>(moduleName, phase, operation);
    }

    public String getModuleName() {
        return moduleName;
    }

    public LifecyclePhase getPhase() {
        return phase;
    }

    public AsyncOperation<T> getOperation() {
        return operation;
    }

    /**
     * Get the module's descriptor; {@code null} when the operation has none.
     */
    public ModuleDescriptor getDescriptor() {
        return descriptor;
    }

    public boolean isCritical() {
        return descriptor != null && descriptor.isCritical();
    }

    /**
     * Get the callback run on success, including late background successes.
     */
    public Optional<Consumer<T>> getOnSuccess() {
        return Optional.ofNullable(onSuccess);
    }

    /**
     * Get the callback run when the recovery queue succeeds in place of the default
     * {@code RECOVERED} bookkeeping.
     */
    public Optional<Consumer<T>> getOnRecovered() {
        return Optional.ofNullable(onRecovered);
    }

    public Optional<AttemptListener> getOnRetry() {
        return Optional.ofNullable(onRetry);
    }

    /**
     * Get the callback run once the request has failed for good: retries exhausted, or the
     * recovery queue's single attempt failed.
     */
    public Optional<Consumer<String>> getOnFailure() {
        return Optional.ofNullable(onFailure);
    }

    @Override
    public String toString() {
        return "RetryRequest{module='" + moduleName + "', phase=" + phase + '}';
    }

    /**
     * Builder for {@link RetryRequest}.
     */
    public static final class Builder<T> {
        private final String moduleName;
        private final LifecyclePhase phase;
        private final AsyncOperation<T> operation;
        private ModuleDescriptor descriptor;
        private Consumer<T> onSuccess;
        private Consumer<T> onRecovered;
        private AttemptListener onRetry;
        private Consumer<String> onFailure;

        private Builder(String moduleName, LifecyclePhase phase, AsyncOperation<T> operation) {
            this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
            this.phase = Objects.requireNonNull(phase, "phase");
            this.operation = Objects.requireNonNull(operation, "operation");
        }

        public Builder<T> descriptor(ModuleDescriptor descriptor) {
            this.descriptor = descriptor;
            return this;
        }

        public Builder<T> onSuccess(Consumer<T> onSuccess) {
            this.onSuccess = onSuccess;
            return this;
        }

        public Builder<T> onRecovered(Consumer<T> onRecovered) {
            this.onRecovered = onRecovered;
            return this;
        }

        public Builder<T> onRetry(AttemptListener onRetry) {
            this.onRetry = onRetry;
            return this;
        }

        public Builder<T> onFailure(Consumer<String> onFailure) {
            this.onFailure = onFailure;
            return this;
        }

        public RetryRequest<T> build() {
            return new RetryRequest<>(this);
        }
    }
}
