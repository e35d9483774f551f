package com.hydra.runtime.registry;

import com.hydra.config.LifecyclePhase;

/**
 * Represents the lifecycle state of a registered module.
 */
public enum ModuleState {

    /**
     * Discovered and registered, not yet instantiated.
     */
    REGISTERED,

    /**
     * Instantiated and cached.
     */
    LOADED,

    /**
     * Init completed.
     */
    INITIALIZED,

    /**
     * Start completed; the module is operational.
     */
    STARTED,

    /**
     * Stop completed.
     */
    STOPPED,

    /**
     * A phase failed terminally, or failed and was deferred to the recovery queue. The last
     * error message is kept on the entry.
     */
    ERROR,

    /**
     * A phase that failed during startup succeeded later, when the recovery queue drained.
     */
    RECOVERED;

    /**
     * Check if transition to the target state is valid from this state.
     *
     * @param target the target state
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(ModuleState target) {
        return switch (this) {
            case REGISTERED -> target == LOADED || target == ERROR || target == RECOVERED;
            case LOADED -> target == INITIALIZED || target == ERROR || target == RECOVERED;
            case INITIALIZED -> target == STARTED || target == ERROR || target == RECOVERED;
            case STARTED -> target == STOPPED || target == ERROR || target == RECOVERED;
            case ERROR -> target == LOADED || target == ERROR || target == RECOVERED;
            case RECOVERED -> target == STOPPED || target == ERROR;
            case STOPPED -> false;  // No transitions from STOPPED
        };
    }

    /**
     * Get the state a module moves to when the given phase succeeds.
     *
     * @param phase a lifecycle phase other than {@link LifecyclePhase#RUNTIME}
     * @return the success state
     * @throws IllegalArgumentException for the runtime phase, which does not change state
     */
    public static ModuleState afterSuccess(LifecyclePhase phase) {
        return switch (phase) {
            case LOAD -> LOADED;
            case INIT -> INITIALIZED;
            case START -> STARTED;
            case STOP -> STOPPED;
            case RUNTIME -> throw new IllegalArgumentException("Runtime operations do not change module state");
        };
    }
}
