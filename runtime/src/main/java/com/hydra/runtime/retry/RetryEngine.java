package com.hydra.runtime.retry;

import com.hydra.config.HydraConfig;
import com.hydra.config.LifecyclePhase;
import com.hydra.config.RetryOptions;
import com.hydra.runtime.PhaseException;
import com.hydra.runtime.event.HydraEvents;
import com.hydra.runtime.recovery.QueueEntry;
import com.hydra.runtime.recovery.RecoveryQueue;
import com.hydra.runtime.registry.ModuleRegistry;
import com.hydra.runtime.registry.ModuleState;
import com.hydra.runtime.scheduler.RuntimeScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Runs operations with retry, backoff and escalation.
 *
 * <p>The first attempt runs on the calling thread. If its stage is already settled, the
 * result is handled inline; otherwise handling hops back onto the runtime scheduler.</p>
 *
 * <p>Failure handling:</p>
 * <ul>
 *   <li>Once {@code max-attempts} is reached the module moves to {@code ERROR}, its failure
 *       hook runs and the error sink is notified. Critical modules then complete the returned
 *       future with {@link PhaseException}; others resolve {@link RetryOutcome.Status#FAILED}.</li>
 *   <li>After the first failure, non-critical modules (and critical ones when
 *       {@code critical-background-retries} is set) switch to the {@code background} options.
 *       With {@code use-recovery-queue} the next attempt is queued, the module is marked
 *       {@code ERROR} until the queue drains, and the call resolves
 *       {@link RetryOutcome.Status#QUEUED}; after the queue has drained, or without the queue,
 *       retries continue detached and the call resolves {@link RetryOutcome.Status#BACKGROUND}.</li>
 *   <li>Foreground retries keep the returned future pending until they settle.</li>
 * </ul>
 */
public class RetryEngine {

    private static final Logger log = LoggerFactory.getLogger(RetryEngine.class);

    private final HydraConfig config;
    private final ModuleRegistry registry;
    private final RuntimeScheduler scheduler;
    private final RecoveryQueue recoveryQueue;
    private final HydraEvents events;
    private final DoubleSupplier random;

    public RetryEngine(HydraConfig config, ModuleRegistry registry, RuntimeScheduler scheduler,
                       RecoveryQueue recoveryQueue, HydraEvents events) {
        this(config, registry, scheduler, recoveryQueue, events, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of jitter values in [0, 1)
     */
    public RetryEngine(HydraConfig config, ModuleRegistry registry, RuntimeScheduler scheduler,
                       RecoveryQueue recoveryQueue, HydraEvents events, DoubleSupplier random) {
        this.config = config;
        this.registry = registry;
        this.scheduler = scheduler;
        this.recoveryQueue = recoveryQueue;
        this.events = events;
        this.random = random;
    }

    /**
     * Run an operation until it succeeds, is handed off, or exhausts its attempts.
     *
     * @param request the operation and its module context
     * @return the foreground outcome; completes exceptionally with {@link PhaseException}
     *         when a critical module exhausts its foreground retries
     */
    public <T> CompletableFuture<RetryOutcome<T>> execute(RetryRequest<T> request) {
        RetryOptions options = config.effectiveRetryOptions(request.getPhase(), request.getDescriptor(), true);
        Cycle<T> cycle = new Cycle<>(request, options);
        attempt(cycle);
        return cycle.result;
    }

    private <T> void attempt(Cycle<T> cycle) {
        cycle.attempts++;
        if (cycle.attempts > 1) {
            log.info("Retry attempt {}/{} for {} in {}", cycle.attempts, cycle.options.getMaxAttempts(),
                     cycle.request.getPhase(), cycle.request.getModuleName());
        }

        CompletableFuture<T> settled = cycle.request.getOperation().attempt();
        boolean immediate = settled.isDone();
        settled.whenComplete((value, error) -> {
            Runnable handle = () -> onSettled(cycle, value, error);
            if (immediate) {
                handle.run();
            } else {
                scheduler.execute(handle);
            }
        });
    }

    private <T> void onSettled(Cycle<T> cycle, T value, Throwable error) {
        if (error == null) {
            onSuccess(cycle, value);
        } else {
            onFailure(cycle, unwrap(error));
        }
    }

    private <T> void onSuccess(Cycle<T> cycle, T value) {
        RetryRequest<T> request = cycle.request;
        if (cycle.attempts > 1) {
            log.info("{} succeeded for {} after {} attempts", request.getPhase(), request.getModuleName(),
                     cycle.attempts);
        }
        request.getOnSuccess().ifPresent(callback -> {
            try {
                callback.accept(value);
            } catch (RuntimeException e) {
                log.error("Success handler failed for {} in {}", request.getModuleName(), request.getPhase(), e);
                events.reportError(request.getModuleName(),
                                   "Success handler failed for " + request.getModuleName() + ": " + describe(e));
            }
        });
        // No-op when the foreground call has already settled
        cycle.result.complete(RetryOutcome.succeeded(value, cycle.attempts));
    }

    private <T> void onFailure(Cycle<T> cycle, Throwable error) {
        RetryRequest<T> request = cycle.request;
        String module = request.getModuleName();
        LifecyclePhase phase = request.getPhase();
        String message = describe(error);
        int attempts = cycle.attempts;

        events.onAttemptFailed(module, phase, attempts, message);
        request.getOnRetry().ifPresent(listener -> {
            try {
                listener.onRetry(attempts, message);
            } catch (RuntimeException e) {
                log.error("Retry listener failed for {} in {}", module, phase, e);
            }
        });
        if (cycle.options.isPrintWarning()) {
            if (attempts == 1) {
                log.warn("Initial {} failed for {}: {}; starting retries", phase, module, message);
            } else {
                log.warn("Attempt {}/{} failed for {} in {}: {}", attempts, cycle.options.getMaxAttempts(),
                         phase, module, message);
            }
        }

        if (attempts >= cycle.options.getMaxAttempts()) {
            exhaust(cycle, message, error);
            return;
        }

        if (cycle.foreground && attempts == 1 && escalates(request)) {
            cycle.foreground = false;
            cycle.options = config.effectiveRetryOptions(phase, request.getDescriptor(), false);
            events.onEscalated(module, phase);
            log.debug("{} for {} escalated to background retries: {}", phase, module, cycle.options);

            if (config.isUseRecoveryQueue() && recoveryQueue.isAcceptingEntries()) {
                QueueEntry<T> entry = recoveryQueue.enqueue(request, attempts, cycle.options);
                if (phase != LifecyclePhase.RUNTIME) {
                    registry.get(module)
                            .filter(registryEntry -> registryEntry.getState().canTransitionTo(ModuleState.ERROR))
                            .ifPresent(registryEntry -> registryEntry.markDeferred(message));
                }
                events.onQueued(module, phase, entry.getPriority());
                cycle.result.complete(RetryOutcome.queued(attempts, message));
                return;
            }
        }

        Duration wait = BackoffCalculator.computeWait(cycle.options, attempts, random);
        log.debug("Next {} attempt for {} in {} ms", phase, module, wait.toMillis());
        scheduler.schedule(() -> attempt(cycle), wait);
        if (!cycle.foreground) {
            cycle.result.complete(RetryOutcome.background(attempts, message));
        }
    }

    private <T> void exhaust(Cycle<T> cycle, String message, Throwable error) {
        RetryRequest<T> request = cycle.request;
        String module = request.getModuleName();
        LifecyclePhase phase = request.getPhase();

        log.warn("{} failed for {} after {} attempts: {}", phase, module, cycle.attempts, message);
        events.onExhausted(module, phase, cycle.attempts, message);
        registry.get(module).ifPresent(entry -> entry.markError(message));
        events.reportError(module, phase + " failed for " + module + ": " + message);
        notifyFailure(request, message);

        if (request.isCritical() && !cycle.result.isDone()) {
            cycle.result.completeExceptionally(
                    new PhaseException(module, phase, cycle.attempts, true, message, error));
        } else {
            cycle.result.complete(RetryOutcome.failed(cycle.attempts, message));
        }
    }

    /**
     * Run the request's terminal failure callback, logging anything it throws.
     */
    public static void notifyFailure(RetryRequest<?> request, String message) {
        request.getOnFailure().ifPresent(callback -> {
            try {
                callback.accept(message);
            } catch (RuntimeException e) {
                log.error("Failure handler failed for {} in {}", request.getModuleName(), request.getPhase(), e);
            }
        });
    }

    private boolean escalates(RetryRequest<?> request) {
        return !request.isCritical() || config.isCriticalBackgroundRetries();
    }

    /**
     * Strip the wrappers that futures put around a failure.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
               && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Get a readable one-line description of a failure.
     */
    public static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }

    private static final class Cycle<T> {
        private final RetryRequest<T> request;
        private final CompletableFuture<RetryOutcome<T>> result = new CompletableFuture<>();
        private RetryOptions options;
        private int attempts;
        private boolean foreground = true;

        private Cycle(RetryRequest<T> request, RetryOptions options) {
            this.request = request;
            this.options = options;
        }
    }
}
