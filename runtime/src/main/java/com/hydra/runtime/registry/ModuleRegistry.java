package com.hydra.runtime.registry;

import com.hydra.config.DuplicatePolicy;
import com.hydra.config.HydraConfigException;
import com.hydra.config.ModuleDescriptor;
import com.hydra.runtime.module.ModuleFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Name to {@link RegistryEntry} map, in registration order.
 *
 * <p>Names are unique keys. A second registration under the same name is skipped with a
 * warning ({@link DuplicatePolicy#SKIP}) or rejected ({@link DuplicatePolicy#REJECT}).</p>
 */
public class ModuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModuleRegistry.class);

    private final DuplicatePolicy duplicatePolicy;
    private final Map<String, RegistryEntry> entries = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();

    public ModuleRegistry(DuplicatePolicy duplicatePolicy) {
        this.duplicatePolicy = duplicatePolicy;
    }

    /**
     * Register a module.
     *
     * @param factory the loadable handle
     * @param descriptor the module's descriptor
     * @return the new entry, or empty if a module with that name was already registered
     * @throws HydraConfigException on a duplicate name under {@link DuplicatePolicy#REJECT}
     */
    public synchronized Optional<RegistryEntry> register(ModuleFactory factory, ModuleDescriptor descriptor) {
        String name = descriptor.getName().trim();
        if (entries.containsKey(name)) {
            if (duplicatePolicy == DuplicatePolicy.REJECT) {
                throw new HydraConfigException("Duplicate module name: " + name);
            }
            log.warn("Duplicate module name '{}', keeping the first registration", name);
            return Optional.empty();
        }
        RegistryEntry entry = new RegistryEntry(name, factory, descriptor);
        entries.put(name, entry);
        order.add(name);
        log.debug("Registered module '{}' ({})", name, descriptor.getLocation());
        return Optional.of(entry);
    }

    public Optional<RegistryEntry> get(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    /**
     * Get the registered names in registration order.
     */
    public List<String> names() {
        return List.copyOf(order);
    }

    /**
     * Get the entries in registration order.
     */
    public List<RegistryEntry> entries() {
        List<RegistryEntry> result = new ArrayList<>(order.size());
        for (String name : order) {
            RegistryEntry entry = entries.get(name);
            if (entry != null) {
                result.add(entry);
            }
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Get a snapshot of every module's state, in registration order.
     */
    public Map<String, ModuleState> stateSnapshot() {
        Map<String, ModuleState> snapshot = new LinkedHashMap<>();
        for (RegistryEntry entry : entries()) {
            snapshot.put(entry.getName(), entry.getState());
        }
        return snapshot;
    }

    /**
     * Count modules per state. States with no module are present with a count of zero.
     */
    public Map<ModuleState, Integer> countByState() {
        Map<ModuleState, Integer> counts = new EnumMap<>(ModuleState.class);
        for (ModuleState state : ModuleState.values()) {
            counts.put(state, 0);
        }
        for (RegistryEntry entry : entries.values()) {
            counts.merge(entry.getState(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Remove every entry.
     */
    public synchronized void invalidate() {
        int count = entries.size();
        entries.clear();
        order.clear();
        log.info("Registry invalidated ({} entries removed)", count);
    }
}
