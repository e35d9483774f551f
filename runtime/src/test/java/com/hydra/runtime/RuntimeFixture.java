package com.hydra.runtime;

import com.hydra.config.HydraConfig;
import com.hydra.config.ModuleDescriptor;
import com.hydra.runtime.event.HydraEvents;
import com.hydra.runtime.lifecycle.LifecycleOrchestrator;
import com.hydra.runtime.load.ModuleLoader;
import com.hydra.runtime.module.ModuleFactory;
import com.hydra.runtime.module.ModuleInstance;
import com.hydra.runtime.recovery.RecoveryQueue;
import com.hydra.runtime.registry.ModuleRegistry;
import com.hydra.runtime.registry.RegistryEntry;
import com.hydra.runtime.retry.RetryEngine;
import com.hydra.runtime.testing.ManualScheduler;
import com.typesafe.config.ConfigFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Wires the runtime collaborators around a {@link ManualScheduler}, with jitter pinned to a
 * factor of exactly 1.0 and every error sink message collected.
 */
public final class RuntimeFixture {

    public final HydraConfig config;
    public final ManualScheduler scheduler = new ManualScheduler();
    public final HydraEvents events;
    public final ModuleRegistry registry;
    public final RecoveryQueue recoveryQueue;
    public final RetryEngine retryEngine;
    public final ModuleLoader loader;
    public final LifecycleOrchestrator orchestrator;
    public final List<String> errors = new CopyOnWriteArrayList<>();

    public RuntimeFixture(String hocon) {
        this(HydraConfig.fromConfig(ConfigFactory.parseString(hocon)));
    }

    public RuntimeFixture(HydraConfig config) {
        this.config = config;
        this.events = new HydraEvents(config.getSide());
        this.events.addErrorListener((source, message, side) -> errors.add(source + ": " + message));
        this.registry = new ModuleRegistry(config.getDuplicatePolicy());
        this.recoveryQueue = new RecoveryQueue(registry, scheduler, events);
        this.retryEngine = new RetryEngine(config, registry, scheduler, recoveryQueue, events, () -> 0.5);
        this.loader = new ModuleLoader(registry, retryEngine, events, config.getSide());
        this.orchestrator = new LifecycleOrchestrator(registry, retryEngine, events);
    }

    public static RuntimeFixture defaults() {
        return new RuntimeFixture("");
    }

    public RegistryEntry register(ModuleDescriptor descriptor, ModuleFactory factory) {
        return registry.register(factory, descriptor).orElseThrow();
    }

    /**
     * Register a module that is already loaded with the given instance.
     */
    public RegistryEntry registerLoaded(ModuleDescriptor descriptor, ModuleInstance instance) {
        RegistryEntry entry = register(descriptor, context -> instance);
        entry.markLoaded(instance);
        return entry;
    }
}
