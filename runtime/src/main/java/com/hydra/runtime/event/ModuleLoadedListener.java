package com.hydra.runtime.event;

import com.hydra.runtime.module.ModuleInstance;

/**
 * Listener for modules that finished loading.
 */
@FunctionalInterface
public interface ModuleLoadedListener {

    /**
     * Called once per module, on the runtime thread, right after the module is cached.
     */
    void onModuleLoaded(String name, ModuleInstance instance);
}
