package com.hydra.runtime.retry;

import java.util.Optional;

/**
 * How a retried operation's foreground call settled.
 *
 * <p>Critical terminal failures are not an outcome: they complete the future returned by
 * {@link RetryEngine#execute} exceptionally.</p>
 */
public final class RetryOutcome<T> {

    public enum Status {
        /** An attempt succeeded; the value is present. */
        SUCCEEDED,
        /** Retries were exhausted for a non-critical module. */
        FAILED,
        /** The next attempt was handed to the recovery queue. */
        QUEUED,
        /** Retries continue detached on the background schedule. */
        BACKGROUND
    }

    private final Status status;
    private final T value;
    private final int attempts;
    private final String error;

    private RetryOutcome(Status status, T value, int attempts, String error) {
        this.status = status;
        this.value = value;
        this.attempts = attempts;
        this.error = error;
    }

    public static <T> RetryOutcome<T> succeeded(T value, int attempts) {
        return new RetryOutcome<>(Status.SUCCEEDED, value, attempts, null);
    }

    public static <T> RetryOutcome<T> failed(int attempts, String error) {
        return new RetryOutcome<>(Status.FAILED, null, attempts, error);
    }

    public static <T> RetryOutcome<T> queued(int attempts, String error) {
        return new RetryOutcome<>(Status.QUEUED, null, attempts, error);
    }

    public static <T> RetryOutcome<T> background(int attempts, String error) {
        return new RetryOutcome<>(Status.BACKGROUND, null, attempts, error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    /**
     * Get the number of attempts made before the call settled.
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * Get the last failure message, if any attempt failed.
     */
    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "RetryOutcome{" + status + ", attempts=" + attempts + (error != null ? ", error='" + error + '\'' : "") + '}';
    }
}
