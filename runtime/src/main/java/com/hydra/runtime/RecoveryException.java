package com.hydra.runtime;

import com.hydra.config.HydraException;
import com.hydra.config.LifecyclePhase;

/**
 * A deferred operation failed while the recovery queue was drained.
 */
public class RecoveryException extends HydraException {

    private final String moduleName;
    private final LifecyclePhase phase;

    public RecoveryException(String moduleName, LifecyclePhase phase, String message, Throwable cause) {
        super("Recovery of " + phase + " failed for " + moduleName + ": " + message, cause);
        this.moduleName = moduleName;
        this.phase = phase;
    }

    public String getModuleName() {
        return moduleName;
    }

    public LifecyclePhase getPhase() {
        return phase;
    }
}
