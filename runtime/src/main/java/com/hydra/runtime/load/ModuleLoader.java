package com.hydra.runtime.load;

import com.hydra.config.LifecyclePhase;
import com.hydra.config.Location;
import com.hydra.config.ModuleDescriptor;
import com.hydra.runtime.DependencyCycleException;
import com.hydra.runtime.event.HydraEvents;
import com.hydra.runtime.module.ModuleContext;
import com.hydra.runtime.module.ModuleInstance;
import com.hydra.runtime.registry.ModuleRegistry;
import com.hydra.runtime.registry.ModuleState;
import com.hydra.runtime.registry.RegistryEntry;
import com.hydra.runtime.retry.RetryEngine;
import com.hydra.runtime.retry.RetryOutcome;
import com.hydra.runtime.retry.RetryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Instantiates modules through the retry engine and caches them.
 *
 * <p>A module is created at most once per process. A load that re-enters itself, directly
 * or through {@link ModuleContext#require}, fails fast with {@link DependencyCycleException}
 * instead of waiting forever. Every load settles with a present or empty instance; the
 * module's criticality never changes that contract.</p>
 *
 * <p>While a module's load is retrying in the background or waiting in the recovery queue,
 * further loads of it resolve empty instead of starting a second retry chain, and
 * {@link ModuleContext#require} refuses a module whose load has failed for good.</p>
 */
public class ModuleLoader {

    private static final Logger log = LoggerFactory.getLogger(ModuleLoader.class);

    private final ModuleRegistry registry;
    private final RetryEngine retryEngine;
    private final HydraEvents events;
    private final Location side;

    private final Map<String, ModuleInstance> cache = new ConcurrentHashMap<>();
    private final Set<String> loading = ConcurrentHashMap.newKeySet();
    private final Set<String> retrying = ConcurrentHashMap.newKeySet();

    public ModuleLoader(ModuleRegistry registry, RetryEngine retryEngine, HydraEvents events, Location side) {
        this.registry = registry;
        this.retryEngine = retryEngine;
        this.events = events;
        this.side = side;
    }

    /**
     * Load a module, or return it from the cache.
     *
     * @param name the module name
     * @return the instance, or empty if the module is unknown, skipped, or failed to load;
     *         completes exceptionally with {@link DependencyCycleException} only when the
     *         module is already being loaded
     */
    public CompletableFuture<Optional<ModuleInstance>> load(String name) {
        Optional<RegistryEntry> found = registry.get(name);
        if (found.isEmpty()) {
            log.warn("Entry missing for {}; no retry attempted", name);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        ModuleInstance cached = cache.get(name);
        if (cached != null) {
            return CompletableFuture.completedFuture(Optional.of(cached));
        }

        if (loading.contains(name)) {
            // The outer load owns the marker and clears it when it settles
            DependencyCycleException cycle = new DependencyCycleException(Set.of(name));
            log.warn("Circular dependency detected involving: {}", name);
            events.reportError(name, cycle.getMessage());
            return CompletableFuture.failedFuture(cycle);
        }

        RegistryEntry entry = found.get();
        if (entry.getDescriptor().getLocation() == Location.CLIENT && side == Location.SERVER) {
            log.info("Skipped client-only module on server: {}", name);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        if (retrying.contains(name)) {
            log.debug("Load of {} is already retrying", name);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        loading.add(name);
        RetryRequest<ModuleInstance> request = RetryRequest
                .builder(name, LifecyclePhase.LOAD, () -> instantiate(entry))
                .descriptor(entry.getDescriptor())
                .onSuccess(instance -> onLoaded(entry, instance))
                .onRecovered(instance -> onRecovered(entry, instance))
                .onRetry((attempt, error) -> log.debug("Load retry {} for {}: {}", attempt, name, error))
                .onFailure(error -> retrying.remove(name))
                .build();

        CompletableFuture<Optional<ModuleInstance>> result = new CompletableFuture<>();
        retryEngine.execute(request).whenComplete((outcome, error) -> {
            loading.remove(name);
            if (error != null) {
                log.warn("Load failed for {}: {}", name, RetryEngine.describe(error));
                result.complete(Optional.empty());
            } else if (outcome.isSucceeded()) {
                result.complete(Optional.ofNullable(cache.get(name)));
            } else {
                if (outcome.getStatus() == RetryOutcome.Status.QUEUED
                        || outcome.getStatus() == RetryOutcome.Status.BACKGROUND) {
                    retrying.add(name);
                }
                log.debug("Load of {} settled as {}", name, outcome);
                result.complete(Optional.empty());
            }
        });
        return result;
    }

    /**
     * Load modules one after another, in the given order.
     *
     * @param order the resolved load order
     * @return the instances that loaded, in load order
     */
    public CompletableFuture<Map<String, ModuleInstance>> loadAll(List<String> order) {
        Map<String, ModuleInstance> loaded = new LinkedHashMap<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String name : order) {
            chain = chain.thenCompose(ignored -> load(name).<Void>handle((instance, error) -> {
                if (error != null) {
                    log.warn("Load chain failed for {}: {}", name, RetryEngine.describe(error));
                } else {
                    instance.ifPresent(value -> loaded.put(name, value));
                }
                return null;
            }));
        }
        return chain.thenApply(ignored -> {
            log.info("Loaded {}/{} modules", loaded.size(), order.size());
            return Collections.unmodifiableMap(loaded);
        });
    }

    private CompletionStage<ModuleInstance> instantiate(RegistryEntry entry) throws Exception {
        ModuleInstance instance = entry.getFactory().create(new LoaderContext(entry));
        if (instance == null) {
            throw new IllegalStateException("Factory for module '" + entry.getName() + "' returned no instance");
        }
        return CompletableFuture.completedFuture(instance);
    }

    private void onLoaded(RegistryEntry entry, ModuleInstance instance) {
        String name = entry.getName();
        if (!entry.isReadyFor(LifecyclePhase.LOAD)) {
            log.warn("Discarding late load of {} in state {}", name, entry.getState());
            return;
        }
        retrying.remove(name);
        cache.put(name, instance);
        entry.markLoaded(instance);
        log.info("Loaded module {}", name);
        events.moduleLoaded(name, instance);
    }

    private void onRecovered(RegistryEntry entry, ModuleInstance instance) {
        retrying.remove(entry.getName());
        entry.markRecovered(instance);
        cache.put(entry.getName(), instance);
        events.moduleLoaded(entry.getName(), instance);
    }

    /**
     * Get a cached instance without loading.
     */
    public Optional<ModuleInstance> getCached(String name) {
        return Optional.ofNullable(cache.get(name));
    }

    /**
     * Check if a load of the module is in flight.
     */
    public boolean isLoading(String name) {
        return loading.contains(name);
    }

    /**
     * Check if a failed load of the module is retrying in the background or queued for recovery.
     */
    public boolean isRetrying(String name) {
        return retrying.contains(name);
    }

    /**
     * Drop every cached instance and in-flight marker.
     */
    public void invalidate() {
        int count = cache.size();
        cache.clear();
        loading.clear();
        retrying.clear();
        log.info("Module cache invalidated ({} instances dropped)", count);
    }

    private final class LoaderContext implements ModuleContext {
        private final RegistryEntry entry;

        private LoaderContext(RegistryEntry entry) {
            this.entry = entry;
        }

        @Override
        public String getName() {
            return entry.getName();
        }

        @Override
        public ModuleDescriptor getDescriptor() {
            return entry.getDescriptor();
        }

        @Override
        public Optional<ModuleInstance> dependency(String name) {
            return getCached(name);
        }

        @Override
        public ModuleInstance require(String name) throws Exception {
            Optional<RegistryEntry> required = registry.get(name);
            if (required.isPresent() && required.get().getState() == ModuleState.ERROR
                    && !retrying.contains(name) && !cache.containsKey(name)) {
                throw new IllegalStateException("Module '" + name + "' required by '" + entry.getName()
                        + "' has failed: " + required.get().getLastError().orElse("unknown error"));
            }
            CompletableFuture<Optional<ModuleInstance>> pending = load(name);
            if (!pending.isDone()) {
                throw new IllegalStateException("Module '" + name + "' required by '" + entry.getName()
                        + "' is still loading");
            }
            try {
                return pending.join().orElseThrow(() -> new IllegalStateException(
                        "Module '" + name + "' required by '" + entry.getName() + "' is not available"));
            } catch (CompletionException e) {
                Throwable cause = RetryEngine.unwrap(e);
                if (cause instanceof Exception failure) {
                    throw failure;
                }
                throw e;
            }
        }
    }
}
