package com.hydra.runtime;

import com.hydra.config.ConfigLoader;
import com.hydra.config.HydraConfig;
import com.hydra.config.LifecyclePhase;
import com.hydra.config.Location;
import com.hydra.config.ModuleDescriptor;
import com.hydra.runtime.event.HydraErrorListener;
import com.hydra.runtime.event.HydraEvents;
import com.hydra.runtime.event.ModuleLoadedListener;
import com.hydra.runtime.lifecycle.LifecycleOrchestrator;
import com.hydra.runtime.load.ModuleLoader;
import com.hydra.runtime.module.ConfigModuleSource;
import com.hydra.runtime.module.DiscoveredModule;
import com.hydra.runtime.module.ModuleInstance;
import com.hydra.runtime.module.ModuleSource;
import com.hydra.runtime.recovery.RecoveryQueue;
import com.hydra.runtime.registry.ModuleRegistry;
import com.hydra.runtime.registry.RegistryEntry;
import com.hydra.runtime.resolve.DependencyResolver;
import com.hydra.runtime.resolve.ResolutionResult;
import com.hydra.runtime.retry.AsyncOperation;
import com.hydra.runtime.retry.RetryEngine;
import com.hydra.runtime.retry.RetryEventListener;
import com.hydra.runtime.retry.RetryOutcome;
import com.hydra.runtime.retry.RetryRequest;
import com.hydra.runtime.scheduler.EventLoopScheduler;
import com.hydra.runtime.scheduler.RuntimeScheduler;
import com.hydra.runtime.validate.ConfigValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleSupplier;

/**
 * Entry point of the runtime: discovers modules, resolves their order and drives them
 * through Load, Init and Start, then replays deferred failures from the recovery queue.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Hydra hydra = Hydra.builder()
 *     .config(ConfigLoader.loadHydraConfig("hydra.conf"))
 *     .onError((source, message, side) -> alerts.send(source + ": " + message))
 *     .build();
 *
 * hydra.start().join();
 * ProfileLoader profiles = hydra.getModule("Data.ProfileLoader", ProfileLoader.class).orElseThrow();
 *
 * // Later...
 * hydra.stop().join();
 * }</pre>
 *
 * <p>All registry mutation happens on the {@link RuntimeScheduler}. {@link #start()} and
 * {@link #stop()} each run once; later calls return the same future.</p>
 */
public final class Hydra {

    private static final Logger log = LoggerFactory.getLogger(Hydra.class);

    private final HydraConfig config;
    private final ModuleSource moduleSource;
    private final RuntimeScheduler scheduler;
    private final boolean ownsScheduler;

    private final HydraEvents events;
    private final ModuleRegistry registry;
    private final RecoveryQueue recoveryQueue;
    private final RetryEngine retryEngine;
    private final ModuleLoader loader;
    private final LifecycleOrchestrator orchestrator;
    private final ConfigValidator validator;
    private final DependencyResolver resolver;

    private final AtomicReference<CompletableFuture<Void>> startFuture = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<Void>> stopFuture = new AtomicReference<>();
    private volatile List<String> loadOrder = List.of();

    private Hydra(Builder builder) {
        this.config = builder.config != null ? builder.config : HydraConfig.fromConfig(ConfigLoader.load());
        this.moduleSource = builder.moduleSource != null ? builder.moduleSource : new ConfigModuleSource(config);
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = builder.scheduler != null ? builder.scheduler : new EventLoopScheduler();

        Location side = config.getSide();
        this.events = new HydraEvents(side);
        builder.loadedListeners.forEach(events::addModuleLoadedListener);
        builder.errorListeners.forEach(events::addErrorListener);
        builder.retryListeners.forEach(events::addRetryListener);

        this.registry = new ModuleRegistry(config.getDuplicatePolicy());
        this.recoveryQueue = new RecoveryQueue(registry, scheduler, events);
        this.retryEngine = new RetryEngine(config, registry, scheduler, recoveryQueue, events, builder.random);
        this.loader = new ModuleLoader(registry, retryEngine, events, side);
        this.orchestrator = new LifecycleOrchestrator(registry, retryEngine, events);
        this.validator = new ConfigValidator(events);
        this.resolver = new DependencyResolver(config.isStrictValidation());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Lifecycle ====================

    /**
     * Run startup: validate, discover, register, resolve, Load, Init, Start, drain the
     * recovery queue.
     *
     * @return a future completed when startup settles; completed exceptionally when
     *         validation rejects the configuration or a critical module fails
     */
    public CompletableFuture<Void> start() {
        CompletableFuture<Void> created = new CompletableFuture<>();
        if (!startFuture.compareAndSet(null, created)) {
            return startFuture.get();
        }
        scheduler.execute(() -> runStartup(created));
        return created;
    }

    private void runStartup(CompletableFuture<Void> result) {
        long startNanos = System.nanoTime();
        log.info("Starting Hydra on {}", config.getSide());

        List<String> order;
        try {
            validator.validate(config);
            for (DiscoveredModule module : moduleSource.discover(config.getSide())) {
                registry.register(module.getFactory(), module.getDescriptor());
            }
            ResolutionResult resolution = resolver.resolve(registry.names(), name -> registry.get(name)
                    .map(entry -> entry.getDescriptor().getDependencies())
                    .orElse(List.of()));
            if (resolution.isCyclic()) {
                log.warn("Dependency cycle detected, nothing will be loaded");
                events.reportError(HydraEvents.RUNTIME_SOURCE,
                                   "Dependency cycle in modules: " + resolution.getUnresolved());
                result.complete(null);
                return;
            }
            order = resolution.getOrder();
        } catch (RuntimeException e) {
            log.error("Hydra startup rejected: {}", e.getMessage());
            events.reportError(HydraEvents.RUNTIME_SOURCE, "Startup rejected: " + e.getMessage());
            result.completeExceptionally(e);
            return;
        }

        loadOrder = order;
        log.info("Load order: {}", order);

        loader.loadAll(order)
                .thenCompose(loaded -> orchestrator.runPhase(LifecyclePhase.INIT, order))
                .thenCompose(ignored -> orchestrator.runPhase(LifecyclePhase.START, order))
                .thenCompose(ignored -> recoveryQueue.drain())
                .whenComplete((ignored, error) -> {
                    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                    if (error != null) {
                        Throwable cause = RetryEngine.unwrap(error);
                        log.error("Hydra startup failed after {} ms: {}", elapsedMillis, RetryEngine.describe(cause));
                        events.reportError(HydraEvents.RUNTIME_SOURCE,
                                           "Init chain failed: " + RetryEngine.describe(cause));
                        result.completeExceptionally(cause);
                    } else {
                        log.info("Hydra started in {} ms: {}", elapsedMillis, registry.stateSnapshot());
                        result.complete(null);
                    }
                });
    }

    /**
     * Run Stop over the modules in reverse load order, then release listeners and, if
     * Hydra created it, the scheduler.
     */
    public CompletableFuture<Void> stop() {
        CompletableFuture<Void> created = new CompletableFuture<>();
        if (!stopFuture.compareAndSet(null, created)) {
            return stopFuture.get();
        }
        scheduler.execute(() -> orchestrator.runPhase(LifecyclePhase.STOP, loadOrder)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        String message = RetryEngine.describe(error);
                        log.warn("Stop chain failed: {}", message);
                        events.reportError(HydraEvents.RUNTIME_SOURCE, "Stop chain failed: " + message);
                    } else {
                        log.info("Hydra stopped");
                    }
                    events.clear();
                    if (error != null) {
                        created.completeExceptionally(RetryEngine.unwrap(error));
                    } else {
                        created.complete(null);
                    }
                    if (ownsScheduler) {
                        scheduler.shutdown();
                    }
                }));
        return created;
    }

    // ==================== Runtime surface ====================

    /**
     * Run an arbitrary operation for a module with the {@code runtime} retry options.
     *
     * @param moduleName the module on whose behalf the operation runs
     * @param operation one attempt of the operation
     * @return the foreground outcome; completes exceptionally with {@link PhaseException}
     *         for a critical module that exhausts its retries
     */
    public <T> CompletableFuture<RetryOutcome<T>> runtimeRetry(String moduleName, AsyncOperation<T> operation) {
        CompletableFuture<RetryOutcome<T>> result = new CompletableFuture<>();
        scheduler.execute(() -> {
            ModuleDescriptor descriptor = registry.get(moduleName)
                    .map(RegistryEntry::getDescriptor)
                    .orElseGet(() -> config.getDescriptor(moduleName).orElse(null));
            RetryRequest<T> request = RetryRequest.builder(moduleName, LifecyclePhase.RUNTIME, operation)
                    .descriptor(descriptor)
                    .onRecovered(value -> log.info("Runtime operation for {} recovered", moduleName))
                    .build();
            retryEngine.execute(request).whenComplete((outcome, error) -> {
                if (error != null) {
                    result.completeExceptionally(RetryEngine.unwrap(error));
                } else {
                    result.complete(outcome);
                }
            });
        });
        return result;
    }

    /**
     * Get a loaded module.
     */
    public Optional<ModuleInstance> getModule(String name) {
        return loader.getCached(name);
    }

    /**
     * Get a loaded module's value, if it is of the given type.
     */
    public <T> Optional<T> getModule(String name, Class<T> type) {
        return loader.getCached(name)
                .map(ModuleInstance::getValue)
                .filter(type::isInstance)
                .map(type::cast);
    }

    /**
     * Send a message to the error sink on behalf of the runtime.
     */
    public void reportError(String message) {
        events.reportError(HydraEvents.RUNTIME_SOURCE, message);
    }

    public void addModuleLoadedListener(ModuleLoadedListener listener) {
        events.addModuleLoadedListener(listener);
    }

    public void removeModuleLoadedListener(ModuleLoadedListener listener) {
        events.removeModuleLoadedListener(listener);
    }

    public void addErrorListener(HydraErrorListener listener) {
        events.addErrorListener(listener);
    }

    public void removeErrorListener(HydraErrorListener listener) {
        events.removeErrorListener(listener);
    }

    public void addRetryListener(RetryEventListener listener) {
        events.addRetryListener(listener);
    }

    public void removeRetryListener(RetryEventListener listener) {
        events.removeRetryListener(listener);
    }

    public HydraConfig getConfig() {
        return config;
    }

    public Location getSide() {
        return config.getSide();
    }

    public ModuleRegistry getRegistry() {
        return registry;
    }

    public RecoveryQueue getRecoveryQueue() {
        return recoveryQueue;
    }

    /**
     * Get the resolved load order; empty before startup resolves it.
     */
    public List<String> getLoadOrder() {
        return loadOrder;
    }

    /**
     * Builder for {@link Hydra}.
     */
    public static final class Builder {
        private HydraConfig config;
        private ModuleSource moduleSource;
        private RuntimeScheduler scheduler;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();
        private final List<ModuleLoadedListener> loadedListeners = new ArrayList<>();
        private final List<HydraErrorListener> errorListeners = new ArrayList<>();
        private final List<RetryEventListener> retryListeners = new ArrayList<>();

        private Builder() {
        }

        /**
         * Settings to run with. Defaults to {@link ConfigLoader#load()}.
         */
        public Builder config(HydraConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Where modules come from. Defaults to {@link ConfigModuleSource}.
         */
        public Builder moduleSource(ModuleSource moduleSource) {
            this.moduleSource = moduleSource;
            return this;
        }

        /**
         * Scheduler to run on. When none is given Hydra creates an {@link EventLoopScheduler}
         * and shuts it down in {@link Hydra#stop()}.
         */
        public Builder scheduler(RuntimeScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Source of jitter values in [0, 1).
         */
        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public Builder onModuleLoaded(ModuleLoadedListener listener) {
            loadedListeners.add(listener);
            return this;
        }

        public Builder onError(HydraErrorListener listener) {
            errorListeners.add(listener);
            return this;
        }

        public Builder onRetry(RetryEventListener listener) {
            retryListeners.add(listener);
            return this;
        }

        public Hydra build() {
            return new Hydra(this);
        }
    }
}
