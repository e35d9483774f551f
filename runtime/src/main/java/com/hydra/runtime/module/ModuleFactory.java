package com.hydra.runtime.module;

/**
 * Creates a module instance. Invoked at most once successfully per process; a failing
 * call is retried by the runtime.
 *
 * <p>Factories named in configuration ({@code factory = "com.example.MyFactory"}) must have
 * a public no-argument constructor.</p>
 */
@FunctionalInterface
public interface ModuleFactory {

    /**
     * Create the module instance.
     *
     * @param context the module's name, config block and access to other modules
     * @return the instance
     * @throws Exception if the module cannot be created; the attempt is retried
     */
    ModuleInstance create(ModuleContext context) throws Exception;
}
