package com.hydra.runtime.module;

import com.hydra.config.Location;

import java.util.List;

/**
 * Discovers the modules available to a runtime side.
 */
@FunctionalInterface
public interface ModuleSource {

    /**
     * Discover modules visible from the given side, in a stable order.
     *
     * @param side {@link Location#SERVER} or {@link Location#CLIENT}
     * @return the discovered modules
     */
    List<DiscoveredModule> discover(Location side);
}
