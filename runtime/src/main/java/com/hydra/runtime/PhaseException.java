package com.hydra.runtime;

import com.hydra.config.HydraException;
import com.hydra.config.LifecyclePhase;

/**
 * A lifecycle phase failed after exhausting its retries.
 *
 * <p>Only critical modules surface this to callers; it aborts the rest of the lifecycle
 * chain.</p>
 */
public class PhaseException extends HydraException {

    private final String moduleName;
    private final LifecyclePhase phase;
    private final int attempts;
    private final boolean critical;

    public PhaseException(String moduleName, LifecyclePhase phase, int attempts, boolean critical,
                          String message, Throwable cause) {
        super(phase + " failed for " + moduleName + " after " + attempts + " attempt(s): " + message, cause);
        this.moduleName = moduleName;
        this.phase = phase;
        this.attempts = attempts;
        this.critical = critical;
    }

    public String getModuleName() {
        return moduleName;
    }

    public LifecyclePhase getPhase() {
        return phase;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isCritical() {
        return critical;
    }
}
