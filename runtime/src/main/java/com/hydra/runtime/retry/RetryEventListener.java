package com.hydra.runtime.retry;

import com.hydra.config.LifecyclePhase;

/**
 * Observer of retry activity. All methods default to no-ops.
 */
public interface RetryEventListener {

    /**
     * A single attempt failed.
     *
     * @param attempt the 1-based attempt number
     */
    default void onAttemptFailed(String moduleName, LifecyclePhase phase, int attempt, String message) {
    }

    /**
     * Retries moved from the foreground to the background options.
     */
    default void onEscalated(String moduleName, LifecyclePhase phase) {
    }

    /**
     * The next attempt was handed to the recovery queue.
     */
    default void onQueued(String moduleName, LifecyclePhase phase, int priority) {
    }

    /**
     * The last allowed attempt failed.
     */
    default void onExhausted(String moduleName, LifecyclePhase phase, int attempts, String message) {
    }
}
