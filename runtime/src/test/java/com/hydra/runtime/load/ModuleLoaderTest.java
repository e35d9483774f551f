package com.hydra.runtime.load;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.hydra.config.Location;
import com.hydra.config.ModuleDescriptor;
import com.hydra.runtime.RuntimeFixture;
import com.hydra.runtime.module.ModuleInstance;
import com.hydra.runtime.registry.ModuleState;
import com.hydra.runtime.registry.RegistryEntry;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ModuleLoaderTest {

    @Test
    void modulesAreCreatedOnce() {
        RuntimeFixture fixture = RuntimeFixture.defaults();
        AtomicInteger created = new AtomicInteger();
        List<String> announced = new ArrayList<>();
        fixture.events.addModuleLoadedListener((name, instance) -> announced.add(name));
        fixture.register(ModuleDescriptor.defaults("Core.Log"), context -> {
            created.incrementAndGet();
            return ModuleInstance.of(context.getName(), new StringBuilder());
        });

        ModuleInstance first = fixture.loader.load("Core.Log").join().orElseThrow();
        ModuleInstance second = fixture.loader.load("Core.Log").join().orElseThrow();

        assertSame(first, second);
        assertEquals(1, created.get());
        assertEquals(List.of("Core.Log"), announced);
        assertEquals(ModuleState.LOADED, fixture.registry.get("Core.Log").orElseThrow().getState());
        assertFalse(fixture.loader.isLoading("Core.Log"));
    }

    @Test
    void unknownModuleLoadsEmpty() {
        RuntimeFixture fixture = RuntimeFixture.defaults();

        assertEquals(Optional.empty(), fixture.loader.load("Nope").join());
        assertTrue(fixture.errors.isEmpty());
    }

    @Test
    void clientModuleIsSkippedOnServer() {
        RuntimeFixture fixture = RuntimeFixture.defaults();
        AtomicInteger created = new AtomicInteger();
        RegistryEntry entry = fixture.register(
                ModuleDescriptor.builder("Ui.Hud").location(Location.CLIENT).build(),
                context -> {
                    created.incrementAndGet();
                    return ModuleInstance.of("Ui.Hud", "hud");
                });

        assertEquals(Optional.empty(), fixture.loader.load("Ui.Hud").join());
        assertEquals(0, created.get());
        assertEquals(ModuleState.REGISTERED, entry.getState());
    }

    @Test
    void requireLoadsTheDependencyFirst() {
        RuntimeFixture fixture = RuntimeFixture.defaults();
        List<String> order = new ArrayList<>();
        fixture.register(ModuleDescriptor.defaults("Data.Manager"), context -> {
            String profiles = context.require("Data.Profiles", String.class);
            order.add("Data.Manager");
            return ModuleInstance.of(context.getName(), "manager using " + profiles);
        });
        fixture.register(ModuleDescriptor.defaults("Data.Profiles"), context -> {
            order.add("Data.Profiles");
            return ModuleInstance.of(context.getName(), "profiles");
        });

        ModuleInstance manager = fixture.loader.load("Data.Manager").join().orElseThrow();

        assertEquals("manager using profiles", manager.getValue());
        assertEquals(List.of("Data.Profiles", "Data.Manager"), order);
        assertTrue(fixture.loader.getCached("Data.Profiles").isPresent());
    }

    @Test
    void selfRequireFailsFastThenLoadsOnRetry() {
        RuntimeFixture fixture = new RuntimeFixture("hydra.use-recovery-queue = false");
        AtomicInteger calls = new AtomicInteger();
        RegistryEntry entry = fixture.register(ModuleDescriptor.defaults("Loop"), context -> {
            if (calls.incrementAndGet() == 1) {
                context.require("Loop");
            }
            return ModuleInstance.of(context.getName(), "loop");
        });

        assertEquals(Optional.empty(), fixture.loader.load("Loop").join());
        assertFalse(fixture.loader.isLoading("Loop"));
        assertTrue(fixture.loader.isRetrying("Loop"));
        assertEquals(List.of("Loop: Circular dependency detected in modules: [Loop]"), fixture.errors);

        fixture.scheduler.runUntilIdle();

        assertEquals(ModuleState.LOADED, entry.getState());
        assertFalse(fixture.loader.isRetrying("Loop"));
        assertTrue(fixture.loader.load("Loop").join().isPresent());
        assertEquals(2, calls.get());
    }

    @Test
    void mutualRequireSettlesWithBothModulesFailed() {
        RuntimeFixture fixture = RuntimeFixture.defaults();
        RegistryEntry a = fixture.register(ModuleDescriptor.defaults("A"),
                context -> ModuleInstance.of("A", context.require("B")));
        RegistryEntry b = fixture.register(ModuleDescriptor.defaults("B"),
                context -> ModuleInstance.of("B", context.require("A")));

        Map<String, ModuleInstance> loaded = fixture.loader.loadAll(List.of("A", "B")).join();

        assertTrue(loaded.isEmpty());
        assertFalse(fixture.loader.isLoading("A"));
        assertFalse(fixture.loader.isLoading("B"));
        assertEquals(2, fixture.recoveryQueue.size());
        assertTrue(fixture.errors.contains("A: Circular dependency detected in modules: [A]"));

        CompletableFuture<Void> drained = fixture.recoveryQueue.drain();
        fixture.scheduler.runUntilIdle();

        assertTrue(drained.isDone());
        assertEquals(ModuleState.ERROR, a.getState());
        assertEquals(ModuleState.ERROR, b.getState());
        assertFalse(fixture.loader.isRetrying("A"));
        assertFalse(fixture.loader.isRetrying("B"));
        assertEquals(0, fixture.scheduler.pendingTasks());
    }

    @Test
    void loadAllKeepsOrderAndSkipsFailures() {
        RuntimeFixture fixture = RuntimeFixture.defaults();
        fixture.register(ModuleDescriptor.defaults("One"), context -> ModuleInstance.of("One", 1));
        fixture.register(ModuleDescriptor.defaults("Broken"), context -> {
            throw new IllegalStateException("no disk");
        });
        fixture.register(ModuleDescriptor.defaults("Two"), context -> ModuleInstance.of("Two", 2));

        Map<String, ModuleInstance> loaded = fixture.loader.loadAll(List.of("One", "Broken", "Two")).join();

        assertEquals(List.of("One", "Two"), new ArrayList<>(loaded.keySet()));
        assertEquals(ModuleState.ERROR, fixture.registry.get("Broken").orElseThrow().getState());
        assertTrue(fixture.loader.isRetrying("Broken"));
    }

    @Test
    void criticalLoadFailureResolvesEmpty() {
        RuntimeFixture fixture = new RuntimeFixture("hydra.retry.general.max-attempts = 2");
        RegistryEntry entry = fixture.register(ModuleDescriptor.builder("Core.Db").critical(true).build(),
                context -> {
                    throw new IllegalStateException("connection refused");
                });

        CompletableFuture<Optional<ModuleInstance>> result = fixture.loader.load("Core.Db");
        fixture.scheduler.runUntilIdle();

        assertEquals(Optional.empty(), result.join());
        assertEquals(ModuleState.ERROR, entry.getState());
        assertEquals(Optional.of("connection refused"), entry.getLastError());
        assertFalse(fixture.loader.isLoading("Core.Db"));
    }

    @Test
    void nullInstanceCountsAsFailure() {
        RuntimeFixture fixture = new RuntimeFixture("hydra.retry.general.max-attempts = 1");
        RegistryEntry entry = fixture.register(ModuleDescriptor.defaults("Empty"), context -> null);

        assertEquals(Optional.empty(), fixture.loader.load("Empty").join());
        assertEquals(ModuleState.ERROR, entry.getState());
        assertEquals(Optional.of("Factory for module 'Empty' returned no instance"), entry.getLastError());
    }

    @Test
    void requireOfFailedModuleIsRefused() {
        RuntimeFixture fixture = new RuntimeFixture("hydra.retry.general.max-attempts = 1");
        fixture.register(ModuleDescriptor.defaults("Dead"), context -> {
            throw new IllegalStateException("gone");
        });
        fixture.register(ModuleDescriptor.defaults("User"), context -> ModuleInstance.of("User", context.require("Dead")));
        fixture.loader.load("Dead").join();

        assertEquals(Optional.empty(), fixture.loader.load("User").join());
        assertEquals(Optional.of("Module 'Dead' required by 'User' has failed: gone"),
                     fixture.registry.get("User").orElseThrow().getLastError());
    }

    @Test
    void recoveredLoadIsCachedAndAnnounced() {
        RuntimeFixture fixture = RuntimeFixture.defaults();
        AtomicInteger calls = new AtomicInteger();
        List<String> announced = new ArrayList<>();
        fixture.events.addModuleLoadedListener((name, instance) -> announced.add(name));
        RegistryEntry entry = fixture.register(ModuleDescriptor.defaults("Flaky"), context -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("not yet");
            }
            return ModuleInstance.of("Flaky", "ok");
        });

        assertEquals(Optional.empty(), fixture.loader.load("Flaky").join());
        fixture.recoveryQueue.drain();
        fixture.scheduler.runUntilIdle();

        assertEquals(ModuleState.RECOVERED, entry.getState());
        assertTrue(entry.getInstance().isPresent());
        assertTrue(fixture.loader.getCached("Flaky").isPresent());
        assertEquals(List.of("Flaky"), announced);
    }

    @Test
    void invalidateDropsCachedInstances() {
        RuntimeFixture fixture = RuntimeFixture.defaults();
        fixture.register(ModuleDescriptor.defaults("Core.Log"), context -> ModuleInstance.of("Core.Log", "log"));
        fixture.loader.load("Core.Log").join();

        fixture.loader.invalidate();

        assertEquals(Optional.empty(), fixture.loader.getCached("Core.Log"));
    }

    @Test
    void failedAttemptsAreNotWarnedAgainByTheLoader() {
        Logger loaderLog = (Logger) LoggerFactory.getLogger(ModuleLoader.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        loaderLog.addAppender(appender);
        try {
            RuntimeFixture fixture = new RuntimeFixture("hydra.use-recovery-queue = false");
            AtomicInteger calls = new AtomicInteger();
            RegistryEntry entry = fixture.register(ModuleDescriptor.defaults("Flaky"), context -> {
                if (calls.incrementAndGet() < 3) {
                    throw new IllegalStateException("not yet");
                }
                return ModuleInstance.of("Flaky", "ok");
            });

            fixture.loader.load("Flaky").join();
            fixture.scheduler.runUntilIdle();

            assertEquals(ModuleState.LOADED, entry.getState());
            assertTrue(appender.list.stream().noneMatch(event -> event.getLevel() == Level.WARN));
        } finally {
            loaderLog.detachAppender(appender);
        }
    }
}
