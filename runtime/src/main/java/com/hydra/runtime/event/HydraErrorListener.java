package com.hydra.runtime.event;

import com.hydra.config.Location;

/**
 * Global error sink. Receives a readable summary of every terminal failure, cycle, and
 * recovery failure.
 */
@FunctionalInterface
public interface HydraErrorListener {

    /**
     * @param source the module name, or {@code "Hydra"} for runtime-wide problems
     * @param message the error summary
     * @param side the side the runtime executes on
     */
    void onError(String source, String message, Location side);
}
