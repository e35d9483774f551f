package com.hydra.metrics;

import com.hydra.config.LifecyclePhase;
import com.hydra.runtime.Hydra;
import com.hydra.runtime.recovery.RecoveryQueue;
import com.hydra.runtime.registry.ModuleRegistry;
import com.hydra.runtime.registry.ModuleState;
import com.hydra.runtime.retry.RetryEventListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registers module state gauges and retry counters for a {@link Hydra} runtime.
 *
 * <p>Gauges read the registry and recovery queue on every scrape. Counters are tagged by
 * phase and created on first use.</p>
 *
 * <pre>{@code
 * HydraMetricsBinder binder = new HydraMetricsBinder(hydra);
 * binder.bindTo(meterRegistry);
 * hydra.start();
 * }</pre>
 */
public class HydraMetricsBinder implements MeterBinder, RetryEventListener {

    private static final Logger log = LoggerFactory.getLogger(HydraMetricsBinder.class);

    private final ModuleRegistry modules;
    private final RecoveryQueue recoveryQueue;

    private volatile MeterRegistry registry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    /**
     * Bind to a runtime and subscribe to its retry events.
     */
    public HydraMetricsBinder(Hydra hydra) {
        this(hydra.getRegistry(), hydra.getRecoveryQueue());
        hydra.addRetryListener(this);
    }

    /**
     * Bind to the runtime parts directly. Retry counters only move if this binder is also
     * registered as a retry listener.
     */
    public HydraMetricsBinder(ModuleRegistry modules, RecoveryQueue recoveryQueue) {
        this.modules = modules;
        this.recoveryQueue = recoveryQueue;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder("hydra.modules.total", modules, ModuleRegistry::size)
                .description("Registered modules")
                .register(registry);

        for (ModuleState state : ModuleState.values()) {
            Gauge.builder("hydra.modules.state", modules, m -> m.countByState().get(state))
                    .tag("state", state.name().toLowerCase(Locale.ROOT))
                    .description("Modules per lifecycle state")
                    .register(registry);
        }

        Gauge.builder("hydra.recovery.queue.size", recoveryQueue, RecoveryQueue::size)
                .description("Attempts waiting for the recovery drain")
                .register(registry);

        log.info("Registered hydra runtime metrics");
    }

    @Override
    public void onAttemptFailed(String moduleName, LifecyclePhase phase, int attempt, String message) {
        increment("hydra.retry.failures", "Failed attempts", phase);
    }

    @Override
    public void onEscalated(String moduleName, LifecyclePhase phase) {
        increment("hydra.retry.escalations", "Retries moved to background", phase);
    }

    @Override
    public void onQueued(String moduleName, LifecyclePhase phase, int priority) {
        increment("hydra.recovery.queued", "Attempts deferred to the recovery queue", phase);
    }

    @Override
    public void onExhausted(String moduleName, LifecyclePhase phase, int attempts, String message) {
        increment("hydra.retry.exhausted", "Retry cycles that ran out of attempts", phase);
    }

    private void increment(String name, String description, LifecyclePhase phase) {
        MeterRegistry target = registry;
        if (target == null) {
            return;
        }
        String tag = phase.getBucketKey();
        counters.computeIfAbsent(name + ':' + tag, key ->
                Counter.builder(name)
                        .tag("phase", tag)
                        .description(description)
                        .register(target)
        ).increment();
    }
}
