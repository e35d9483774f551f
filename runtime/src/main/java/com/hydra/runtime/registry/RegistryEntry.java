package com.hydra.runtime.registry;

import com.hydra.config.LifecyclePhase;
import com.hydra.config.ModuleDescriptor;
import com.hydra.runtime.module.ModuleFactory;
import com.hydra.runtime.module.ModuleInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Runtime record of one module: its handle, descriptor, instance and state.
 *
 * <p>Mutated only on the runtime scheduler thread; fields are volatile so that state can
 * be observed from other threads (metrics, admin callers).</p>
 */
public final class RegistryEntry {

    private static final Logger log = LoggerFactory.getLogger(RegistryEntry.class);

    private final String name;
    private final ModuleFactory factory;
    private final ModuleDescriptor descriptor;

    private volatile ModuleInstance instance;
    private volatile ModuleState state = ModuleState.REGISTERED;
    private volatile String lastError;
    private volatile LifecyclePhase recoveredPhase;

    RegistryEntry(String name, ModuleFactory factory, ModuleDescriptor descriptor) {
        this.name = name;
        this.factory = factory;
        this.descriptor = descriptor;
    }

    /**
     * Move to a new state.
     *
     * @throws IllegalStateException if the state machine does not allow the move
     */
    public void transitionTo(ModuleState target) {
        ModuleState current = state;
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException("Module '" + name + "' cannot move from " + current + " to " + target);
        }
        state = target;
        log.debug("Module '{}' state: {} -> {}", name, current, target);
    }

    /**
     * Record a successful load.
     */
    public void markLoaded(ModuleInstance loaded) {
        transitionTo(ModuleState.LOADED);
        this.instance = loaded;
        this.lastError = null;
    }

    /**
     * Record a terminal failure and invoke the instance's failure hook. The message is always
     * kept; the state moves to {@link ModuleState#ERROR} where the state machine allows it.
     */
    public void markError(String message) {
        this.lastError = message;
        if (state.canTransitionTo(ModuleState.ERROR)) {
            transitionTo(ModuleState.ERROR);
        } else {
            log.debug("Module '{}' failed in state {}, state kept: {}", name, state, message);
        }
        ModuleInstance current = instance;
        if (current != null) {
            current.getFailureHook().ifPresent(hook -> {
                try {
                    hook.accept(message);
                } catch (Exception e) {
                    log.error("Failure hook of module '{}' threw", name, e);
                }
            });
        }
    }

    /**
     * Record a failure whose next attempt was handed to the recovery queue. Unlike
     * {@link #markError(String)}, the failure hook is not invoked.
     */
    public void markDeferred(String message) {
        this.lastError = message;
        transitionTo(ModuleState.ERROR);
    }

    /**
     * Record a phase that succeeded from the recovery queue.
     */
    public void markRecovered(LifecyclePhase phase) {
        transitionTo(ModuleState.RECOVERED);
        this.recoveredPhase = phase;
        this.lastError = null;
    }

    /**
     * Record a load that succeeded from the recovery queue, keeping the instance.
     */
    public void markRecovered(ModuleInstance loaded) {
        markRecovered(LifecyclePhase.LOAD);
        this.instance = loaded;
    }

    /**
     * Check if the entry is in the state the phase requires. Init needs LOADED, Start needs
     * INITIALIZED, Stop needs STARTED (or RECOVERED when Start was the recovered phase).
     */
    public boolean isReadyFor(LifecyclePhase phase) {
        ModuleState current = state;
        return switch (phase) {
            case LOAD -> current == ModuleState.REGISTERED || current == ModuleState.ERROR;
            case INIT -> current == ModuleState.LOADED;
            case START -> current == ModuleState.INITIALIZED;
            case STOP -> current == ModuleState.STARTED
                    || (current == ModuleState.RECOVERED && recoveredPhase == LifecyclePhase.START);
            case RUNTIME -> true;
        };
    }

    public String getName() {
        return name;
    }

    public ModuleFactory getFactory() {
        return factory;
    }

    public ModuleDescriptor getDescriptor() {
        return descriptor;
    }

    public boolean isCritical() {
        return descriptor.isCritical();
    }

    public Optional<ModuleInstance> getInstance() {
        return Optional.ofNullable(instance);
    }

    public ModuleState getState() {
        return state;
    }

    public Optional<String> getLastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * Get the phase that succeeded from the recovery queue, if the module was recovered.
     */
    public Optional<LifecyclePhase> getRecoveredPhase() {
        return Optional.ofNullable(recoveredPhase);
    }

    @Override
    public String toString() {
        return "RegistryEntry{name='" + name + "', state=" + state
               + (lastError != null ? ", lastError='" + lastError + '\'' : "") + '}';
    }
}
