package com.hydra.runtime.recovery;

import com.hydra.config.LifecyclePhase;
import com.hydra.config.RetryOptions;
import com.hydra.runtime.RecoveryException;
import com.hydra.runtime.event.HydraEvents;
import com.hydra.runtime.registry.ModuleRegistry;
import com.hydra.runtime.retry.RetryEngine;
import com.hydra.runtime.retry.RetryRequest;
import com.hydra.runtime.scheduler.RuntimeScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Holds attempts deferred during startup and replays them once, after Start.
 *
 * <p>{@link #drain()} sorts entries by priority (critical first, otherwise in queue order)
 * and runs each captured attempt strictly one after another. A success marks the module
 * {@code RECOVERED}; a failure marks it {@code ERROR}, is reported to the error sink and is
 * not queued again. After the drain the queue stops accepting entries.</p>
 */
public class RecoveryQueue {

    private static final Logger log = LoggerFactory.getLogger(RecoveryQueue.class);

    private final ModuleRegistry registry;
    private final RuntimeScheduler scheduler;
    private final HydraEvents events;

    private final List<QueueEntry<?>> entries = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean drained = new AtomicBoolean(false);

    public RecoveryQueue(ModuleRegistry registry, RuntimeScheduler scheduler, HydraEvents events) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.events = events;
    }

    /**
     * Queue the next attempt of a request.
     *
     * @param request the request whose next attempt is deferred
     * @param retryCount attempts already made
     * @param options the options in effect
     * @return the queued entry
     * @throws IllegalStateException if the queue has already been drained
     */
    public synchronized <T> QueueEntry<T> enqueue(RetryRequest<T> request, int retryCount, RetryOptions options) {
        if (drained.get()) {
            throw new IllegalStateException("Recovery queue has already been drained");
        }
        QueueEntry<T> entry = new QueueEntry<>(request, retryCount, options, sequence.getAndIncrement());
        entries.add(entry);
        log.info("Queued {} of {} for recovery (priority {})", entry.getPhase(), entry.getModuleName(),
                 entry.getPriority());
        return entry;
    }

    /**
     * Check if {@link #enqueue} may still be called.
     */
    public boolean isAcceptingEntries() {
        return !drained.get();
    }

    /**
     * Run every queued attempt once. Only the first call does any work.
     *
     * @return a future completed when every entry has settled; never completes exceptionally
     */
    public CompletableFuture<Void> drain() {
        List<QueueEntry<?>> batch;
        synchronized (this) {
            if (!drained.compareAndSet(false, true)) {
                log.debug("Recovery queue already drained");
                return CompletableFuture.completedFuture(null);
            }
            batch = new ArrayList<>(entries);
            entries.clear();
        }
        if (batch.isEmpty()) {
            log.debug("Recovery queue is empty");
            return CompletableFuture.completedFuture(null);
        }

        batch.sort(Comparator.<QueueEntry<?>>comparingInt(QueueEntry::getPriority)
                .thenComparingLong(QueueEntry::getSequence));
        log.info("Processing recovery queue: {} entries", batch.size());

        CompletableFuture<Void> done = new CompletableFuture<>();
        runNext(batch, 0, done);
        return done;
    }

    private void runNext(List<QueueEntry<?>> batch, int index, CompletableFuture<Void> done) {
        if (index >= batch.size()) {
            log.info("Recovery queue drained");
            done.complete(null);
            return;
        }
        recover(batch.get(index)).thenRun(() -> runNext(batch, index + 1, done));
    }

    private <T> CompletableFuture<Void> recover(QueueEntry<T> entry) {
        RetryRequest<T> request = entry.getRequest();
        log.info("Recovering {} for {} after {} failed attempt(s)", entry.getPhase(), entry.getModuleName(),
                 entry.getRetryCount());

        CompletableFuture<Void> settled = new CompletableFuture<>();
        request.getOperation().attempt().whenComplete((value, error) -> scheduler.execute(() -> {
            try {
                if (error == null) {
                    onRecovered(request, value);
                } else {
                    onFailed(entry, RetryEngine.unwrap(error));
                }
            } finally {
                settled.complete(null);
            }
        }));
        return settled;
    }

    private <T> void onRecovered(RetryRequest<T> request, T value) {
        String name = request.getModuleName();
        LifecyclePhase phase = request.getPhase();
        try {
            Optional<Consumer<T>> handler = request.getOnRecovered();
            if (handler.isPresent()) {
                handler.get().accept(value);
            } else {
                registry.get(name).ifPresent(entry -> entry.markRecovered(phase));
            }
            log.info("Recovered {} for {}", phase, name);
        } catch (IllegalStateException e) {
            log.warn("Discarding recovery of {} for {}: {}", phase, name, e.getMessage());
        }
    }

    private void onFailed(QueueEntry<?> entry, Throwable error) {
        RecoveryException failure = new RecoveryException(entry.getModuleName(), entry.getPhase(),
                                                           RetryEngine.describe(error), error);
        log.warn("Recovery failed for {}: {}", entry.getModuleName(), RetryEngine.describe(error));
        registry.get(entry.getModuleName()).ifPresent(e -> e.markError(failure.getMessage()));
        events.reportError(entry.getModuleName(), failure.getMessage());
        RetryEngine.notifyFailure(entry.getRequest(), failure.getMessage());
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Get a snapshot of the queued entries, in queue order.
     */
    public synchronized List<QueueEntry<?>> entries() {
        return List.copyOf(entries);
    }

    public boolean isDrained() {
        return drained.get();
    }
}
