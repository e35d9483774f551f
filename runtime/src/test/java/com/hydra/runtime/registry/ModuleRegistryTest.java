package com.hydra.runtime.registry;

import com.hydra.config.DuplicatePolicy;
import com.hydra.config.HydraConfigException;
import com.hydra.config.LifecyclePhase;
import com.hydra.config.ModuleDescriptor;
import com.hydra.runtime.module.ModuleFactory;
import com.hydra.runtime.module.ModuleInstance;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModuleRegistryTest {

    private static final ModuleFactory FACTORY = context -> ModuleInstance.of(context.getName(), new Object());

    @Test
    void keepsRegistrationOrder() {
        ModuleRegistry registry = new ModuleRegistry(DuplicatePolicy.SKIP);
        registry.register(FACTORY, ModuleDescriptor.defaults("Core.B"));
        registry.register(FACTORY, ModuleDescriptor.defaults("Core.A"));

        assertEquals(List.of("Core.B", "Core.A"), registry.names());
        assertEquals(2, registry.size());
        assertEquals(ModuleState.REGISTERED, registry.get("Core.A").orElseThrow().getState());
    }

    @Test
    void duplicateIsSkippedByDefault() {
        ModuleRegistry registry = new ModuleRegistry(DuplicatePolicy.SKIP);
        ModuleFactory second = context -> ModuleInstance.of("other", "other");

        assertTrue(registry.register(FACTORY, ModuleDescriptor.defaults("Core.A")).isPresent());
        Optional<RegistryEntry> duplicate = registry.register(second, ModuleDescriptor.defaults(" Core.A "));

        assertTrue(duplicate.isEmpty());
        assertSame(FACTORY, registry.get("Core.A").orElseThrow().getFactory());
        assertEquals(1, registry.size());
    }

    @Test
    void duplicateIsRejectedWhenConfigured() {
        ModuleRegistry registry = new ModuleRegistry(DuplicatePolicy.REJECT);
        registry.register(FACTORY, ModuleDescriptor.defaults("Core.A"));

        HydraConfigException e = assertThrows(HydraConfigException.class,
                () -> registry.register(FACTORY, ModuleDescriptor.defaults("Core.A")));
        assertEquals("Duplicate module name: Core.A", e.getMessage());
    }

    @Test
    void countsEveryState() {
        ModuleRegistry registry = new ModuleRegistry(DuplicatePolicy.SKIP);
        registry.register(FACTORY, ModuleDescriptor.defaults("A"));
        registry.register(FACTORY, ModuleDescriptor.defaults("B")).orElseThrow()
                .markLoaded(ModuleInstance.of("B", "b"));

        Map<ModuleState, Integer> counts = registry.countByState();

        assertEquals(ModuleState.values().length, counts.size());
        assertEquals(1, counts.get(ModuleState.REGISTERED));
        assertEquals(1, counts.get(ModuleState.LOADED));
        assertEquals(0, counts.get(ModuleState.ERROR));
        assertEquals(Map.of("A", ModuleState.REGISTERED, "B", ModuleState.LOADED), registry.stateSnapshot());
    }

    @Test
    void illegalTransitionThrows() {
        ModuleRegistry registry = new ModuleRegistry(DuplicatePolicy.SKIP);
        RegistryEntry entry = registry.register(FACTORY, ModuleDescriptor.defaults("A")).orElseThrow();

        assertThrows(IllegalStateException.class, () -> entry.transitionTo(ModuleState.STARTED));
        assertEquals(ModuleState.REGISTERED, entry.getState());
    }

    @Test
    void markErrorRunsFailureHookAndKeepsMessage() {
        ModuleRegistry registry = new ModuleRegistry(DuplicatePolicy.SKIP);
        List<String> hooked = new ArrayList<>();
        RegistryEntry entry = registry.register(FACTORY, ModuleDescriptor.defaults("A")).orElseThrow();
        entry.markLoaded(ModuleInstance.builder("A", "a").onError(hooked::add).build());

        entry.markError("disk full");

        assertEquals(ModuleState.ERROR, entry.getState());
        assertEquals(Optional.of("disk full"), entry.getLastError());
        assertEquals(List.of("disk full"), hooked);
    }

    @Test
    void failureHookExceptionIsContained() {
        ModuleRegistry registry = new ModuleRegistry(DuplicatePolicy.SKIP);
        RegistryEntry entry = registry.register(FACTORY, ModuleDescriptor.defaults("A")).orElseThrow();
        entry.markLoaded(ModuleInstance.builder("A", "a")
                .onError(message -> { throw new IllegalStateException("hook broke"); })
                .build());

        assertDoesNotThrow(() -> entry.markError("boom"));
        assertEquals(ModuleState.ERROR, entry.getState());
    }

    @Test
    void deferredFailureSkipsFailureHook() {
        ModuleRegistry registry = new ModuleRegistry(DuplicatePolicy.SKIP);
        List<String> hooked = new ArrayList<>();
        RegistryEntry entry = registry.register(FACTORY, ModuleDescriptor.defaults("A")).orElseThrow();
        entry.markLoaded(ModuleInstance.builder("A", "a").onError(hooked::add).build());

        entry.markDeferred("not yet");

        assertEquals(ModuleState.ERROR, entry.getState());
        assertTrue(hooked.isEmpty());
    }

    @Test
    void stopAcceptsModulesRecoveredInStart() {
        ModuleRegistry registry = new ModuleRegistry(DuplicatePolicy.SKIP);
        RegistryEntry started = registry.register(FACTORY, ModuleDescriptor.defaults("A")).orElseThrow();
        started.markLoaded(ModuleInstance.of("A", "a"));
        started.markDeferred("late");
        started.markRecovered(LifecyclePhase.START);

        RegistryEntry initOnly = registry.register(FACTORY, ModuleDescriptor.defaults("B")).orElseThrow();
        initOnly.markLoaded(ModuleInstance.of("B", "b"));
        initOnly.markDeferred("late");
        initOnly.markRecovered(LifecyclePhase.INIT);

        assertTrue(started.isReadyFor(LifecyclePhase.STOP));
        assertFalse(initOnly.isReadyFor(LifecyclePhase.STOP));
        assertEquals(Optional.of(LifecyclePhase.INIT), initOnly.getRecoveredPhase());
    }
}
