package com.hydra.runtime.module;

import com.hydra.config.LifecyclePhase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The loaded value of a module together with its lifecycle capabilities.
 *
 * <p>Capabilities are declared explicitly when the instance is built, so the runtime never
 * has to probe the module object for methods.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * public ModuleInstance create(ModuleContext context) {
 *     DataManager manager = new DataManager(context.require("Data.ProfileLoader", ProfileLoader.class));
 *     return ModuleInstance.builder(context.getName(), manager)
 *         .onInit(LifecycleHandler.sync(manager::openStores))
 *         .onStart(manager::startAsync)
 *         .onStop(LifecycleHandler.sync(manager::close))
 *         .onError(manager::degrade)
 *         .build();
 * }
 * }</pre>
 */
public final class ModuleInstance {

    private final String name;
    private final Object value;
    private final Map<LifecyclePhase, LifecycleHandler> handlers;
    private final Consumer<String> failureHook;

    private ModuleInstance(Builder builder) {
        this.name = builder.name;
        this.value = builder.value;
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(builder.handlers));
        this.failureHook = builder.failureHook;
    }

    /**
     * Create an instance without lifecycle capabilities.
     */
    public static ModuleInstance of(String name, Object value) {
        return builder(name, value).build();
    }

    public static Builder builder(String name, Object value) {
        return new Builder(name, value);
    }

    public String getName() {
        return name;
    }

    /**
     * Get the module's own object, as exposed to dependents.
     */
    public Object getValue() {
        return value;
    }

    /**
     * Get the module's own object cast to the expected type.
     *
     * @throws ClassCastException if the value is not of that type
     */
    public <T> T getValue(Class<T> type) {
        return type.cast(value);
    }

    /**
     * Check if the module declared a handler for the phase.
     */
    public boolean hasCapability(LifecyclePhase phase) {
        return handlers.containsKey(phase);
    }

    public Optional<LifecycleHandler> getHandler(LifecyclePhase phase) {
        return Optional.ofNullable(handlers.get(phase));
    }

    /**
     * Get the hook invoked with the error message when a phase fails terminally.
     */
    public Optional<Consumer<String>> getFailureHook() {
        return Optional.ofNullable(failureHook);
    }

    @Override
    public String toString() {
        return "ModuleInstance{name='" + name + "', capabilities=" + handlers.keySet() + '}';
    }

    /**
     * Builder for {@link ModuleInstance}.
     */
    public static final class Builder {
        private final String name;
        private final Object value;
        private final Map<LifecyclePhase, LifecycleHandler> handlers = new EnumMap<>(LifecyclePhase.class);
        private Consumer<String> failureHook;

        private Builder(String name, Object value) {
            this.name = Objects.requireNonNull(name, "name");
            this.value = Objects.requireNonNull(value, "value");
        }

        public Builder onInit(LifecycleHandler handler) {
            handlers.put(LifecyclePhase.INIT, Objects.requireNonNull(handler));
            return this;
        }

        public Builder onStart(LifecycleHandler handler) {
            handlers.put(LifecyclePhase.START, Objects.requireNonNull(handler));
            return this;
        }

        public Builder onStop(LifecycleHandler handler) {
            handlers.put(LifecyclePhase.STOP, Objects.requireNonNull(handler));
            return this;
        }

        public Builder onError(Consumer<String> hook) {
            this.failureHook = Objects.requireNonNull(hook);
            return this;
        }

        public ModuleInstance build() {
            return new ModuleInstance(this);
        }
    }
}
