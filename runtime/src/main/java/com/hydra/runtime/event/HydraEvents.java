package com.hydra.runtime.event;

import com.hydra.config.LifecyclePhase;
import com.hydra.config.Location;
import com.hydra.runtime.module.ModuleInstance;
import com.hydra.runtime.retry.RetryEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fire-and-forget broadcaster for runtime notifications.
 *
 * <p>Listeners are held in {@link CopyOnWriteArrayList}s. A listener that throws is logged
 * and does not prevent delivery to the others.</p>
 */
public class HydraEvents implements RetryEventListener {

    private static final Logger log = LoggerFactory.getLogger(HydraEvents.class);

    /**
     * Source name used for runtime-wide errors.
     */
    public static final String RUNTIME_SOURCE = "Hydra";

    private final Location side;
    private final CopyOnWriteArrayList<ModuleLoadedListener> loadedListeners = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<HydraErrorListener> errorListeners = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<RetryEventListener> retryListeners = new CopyOnWriteArrayList<>();

    public HydraEvents(Location side) {
        this.side = side;
    }

    // ========== Subscription ==========

    public void addModuleLoadedListener(ModuleLoadedListener listener) {
        loadedListeners.addIfAbsent(listener);
    }

    public void removeModuleLoadedListener(ModuleLoadedListener listener) {
        loadedListeners.remove(listener);
    }

    public void addErrorListener(HydraErrorListener listener) {
        errorListeners.addIfAbsent(listener);
    }

    public void removeErrorListener(HydraErrorListener listener) {
        errorListeners.remove(listener);
    }

    public void addRetryListener(RetryEventListener listener) {
        retryListeners.addIfAbsent(listener);
    }

    public void removeRetryListener(RetryEventListener listener) {
        retryListeners.remove(listener);
    }

    /**
     * Drop every subscription.
     */
    public void clear() {
        loadedListeners.clear();
        errorListeners.clear();
        retryListeners.clear();
    }

    // ========== Broadcast ==========

    public void moduleLoaded(String name, ModuleInstance instance) {
        for (ModuleLoadedListener listener : loadedListeners) {
            try {
                listener.onModuleLoaded(name, instance);
            } catch (Exception e) {
                log.error("Error notifying listener of module load: {}", name, e);
            }
        }
    }

    /**
     * Send a message to the error sink.
     *
     * @param source a module name, or {@link #RUNTIME_SOURCE}
     * @param message the error summary
     */
    public void reportError(String source, String message) {
        log.warn("[{}] {}", source, message);
        for (HydraErrorListener listener : errorListeners) {
            try {
                listener.onError(source, message, side);
            } catch (Exception e) {
                log.error("Error notifying error listener of: {}", message, e);
            }
        }
    }

    @Override
    public void onAttemptFailed(String moduleName, LifecyclePhase phase, int attempt, String message) {
        for (RetryEventListener listener : retryListeners) {
            try {
                listener.onAttemptFailed(moduleName, phase, attempt, message);
            } catch (Exception e) {
                log.error("Error notifying retry listener of failed attempt: {}", moduleName, e);
            }
        }
    }

    @Override
    public void onEscalated(String moduleName, LifecyclePhase phase) {
        for (RetryEventListener listener : retryListeners) {
            try {
                listener.onEscalated(moduleName, phase);
            } catch (Exception e) {
                log.error("Error notifying retry listener of escalation: {}", moduleName, e);
            }
        }
    }

    @Override
    public void onQueued(String moduleName, LifecyclePhase phase, int priority) {
        for (RetryEventListener listener : retryListeners) {
            try {
                listener.onQueued(moduleName, phase, priority);
            } catch (Exception e) {
                log.error("Error notifying retry listener of queued recovery: {}", moduleName, e);
            }
        }
    }

    @Override
    public void onExhausted(String moduleName, LifecyclePhase phase, int attempts, String message) {
        for (RetryEventListener listener : retryListeners) {
            try {
                listener.onExhausted(moduleName, phase, attempts, message);
            } catch (Exception e) {
                log.error("Error notifying retry listener of exhausted retries: {}", moduleName, e);
            }
        }
    }

    public Location getSide() {
        return side;
    }
}
