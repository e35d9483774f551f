package com.hydra.runtime.lifecycle;

import com.hydra.config.LifecyclePhase;
import com.hydra.runtime.PhaseException;
import com.hydra.runtime.event.HydraEvents;
import com.hydra.runtime.module.LifecycleHandler;
import com.hydra.runtime.module.ModuleInstance;
import com.hydra.runtime.registry.ModuleRegistry;
import com.hydra.runtime.registry.ModuleState;
import com.hydra.runtime.registry.RegistryEntry;
import com.hydra.runtime.retry.AsyncOperation;
import com.hydra.runtime.retry.RetryEngine;
import com.hydra.runtime.retry.RetryOutcome;
import com.hydra.runtime.retry.RetryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Drives Init, Start and Stop across modules, strictly one module at a time.
 *
 * <p>Init and Start run in load order; Stop runs in reverse load order. A module is skipped
 * when it has no instance, when it is not in the state the phase requires, or when it
 * declared no handler for the phase.</p>
 *
 * <p>A critical module's terminal failure aborts the rest of the phase and completes the
 * returned future with {@link PhaseException}. Any other failure is recorded and the phase
 * moves on to the next module.</p>
 */
public class LifecycleOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(LifecycleOrchestrator.class);

    private final ModuleRegistry registry;
    private final RetryEngine retryEngine;
    private final HydraEvents events;

    public LifecycleOrchestrator(ModuleRegistry registry, RetryEngine retryEngine, HydraEvents events) {
        this.registry = registry;
        this.retryEngine = retryEngine;
        this.events = events;
    }

    /**
     * Run a phase over the modules.
     *
     * @param phase {@link LifecyclePhase#INIT}, {@link LifecyclePhase#START} or {@link LifecyclePhase#STOP}
     * @param order the resolved load order; reversed here for Stop
     * @return a future completed when every module has been handled, or exceptionally with
     *         {@link PhaseException} when a critical module fails
     */
    public CompletableFuture<Void> runPhase(LifecyclePhase phase, List<String> order) {
        if (phase != LifecyclePhase.INIT && phase != LifecyclePhase.START && phase != LifecyclePhase.STOP) {
            throw new IllegalArgumentException("Not an orchestrated phase: " + phase);
        }
        List<String> sequence = new ArrayList<>(order);
        if (phase == LifecyclePhase.STOP) {
            Collections.reverse(sequence);
        }

        log.info("Running {} for {} modules", phase, sequence.size());
        CompletableFuture<Void> done = new CompletableFuture<>();
        runNext(phase, sequence, 0, done);
        return done;
    }

    private void runNext(LifecyclePhase phase, List<String> sequence, int index, CompletableFuture<Void> done) {
        if (index >= sequence.size()) {
            log.info("{} phase complete", phase);
            done.complete(null);
            return;
        }

        String name = sequence.get(index);
        CompletableFuture<Void> step;
        try {
            step = runModule(phase, name);
        } catch (Throwable e) {
            // Any throwable settles the step so the chain always reaches done
            step = CompletableFuture.failedFuture(e);
        }

        step.whenComplete((ignored, error) -> {
            if (error == null) {
                runNext(phase, sequence, index + 1, done);
                return;
            }
            Throwable cause = RetryEngine.unwrap(error);
            if (cause instanceof PhaseException failure && failure.isCritical()) {
                log.error("{} aborted: critical module {} failed", phase, failure.getModuleName());
                done.completeExceptionally(failure);
                return;
            }
            log.warn("{} chain failed at {}: {} (continuing)", phase, name, RetryEngine.describe(cause));
            events.reportError(name, phase + " chain failed: " + RetryEngine.describe(cause));
            runNext(phase, sequence, index + 1, done);
        });
    }

    private CompletableFuture<Void> runModule(LifecyclePhase phase, String name) {
        Optional<RegistryEntry> found = registry.get(name);
        if (found.isEmpty() || found.get().getInstance().isEmpty()) {
            log.debug("Skipping {} for {} (no entry or instance)", phase, name);
            return CompletableFuture.completedFuture(null);
        }
        RegistryEntry entry = found.get();
        if (!entry.isReadyFor(phase)) {
            log.debug("Skipping {} for {} (invalid state: {})", phase, name, entry.getState());
            return CompletableFuture.completedFuture(null);
        }
        ModuleInstance instance = entry.getInstance().get();
        Optional<LifecycleHandler> handler = instance.getHandler(phase);
        if (handler.isEmpty()) {
            log.debug("No {} handler for {}", phase, name);
            return CompletableFuture.completedFuture(null);
        }

        AsyncOperation<Object> operation = () -> {
            @SuppressWarnings("unchecked")
            CompletionStage<Object> stage = (CompletionStage<Object>) handler.get().run();
            return stage;
        };
        RetryRequest<Object> request = RetryRequest.builder(name, phase, operation)
                .descriptor(entry.getDescriptor())
                .onSuccess(ignored -> onPhaseSucceeded(entry, phase))
                .onRetry((attempt, error) -> log.debug("{} retry {} for {}: {}", phase, attempt, name, error))
                .build();

        return retryEngine.execute(request).thenAccept(outcome -> logOutcome(phase, name, outcome));
    }

    private void onPhaseSucceeded(RegistryEntry entry, LifecyclePhase phase) {
        // A late background success may find the module already moved on
        if (!entry.isReadyFor(phase)) {
            log.warn("Discarding late {} success for {} in state {}", phase, entry.getName(), entry.getState());
            return;
        }
        entry.transitionTo(ModuleState.afterSuccess(phase));
        log.info("{} completed for {}", phase, entry.getName());
    }

    private static void logOutcome(LifecyclePhase phase, String name, RetryOutcome<Object> outcome) {
        switch (outcome.getStatus()) {
            case SUCCEEDED -> log.debug("{} of {} settled after {} attempt(s)", phase, name, outcome.getAttempts());
            case FAILED -> log.warn("{} failed for {}: {}", phase, name, outcome.getError().orElse("unknown error"));
            case QUEUED -> log.info("{} of {} deferred to the recovery queue", phase, name);
            case BACKGROUND -> log.info("{} of {} continues in the background", phase, name);
        }
    }
}
