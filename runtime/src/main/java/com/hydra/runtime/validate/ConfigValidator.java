package com.hydra.runtime.validate;

import com.hydra.config.HydraConfig;
import com.hydra.config.HydraConfigException;
import com.hydra.config.Location;
import com.hydra.config.ModuleDescriptor;
import com.hydra.runtime.event.HydraEvents;
import com.hydra.runtime.resolve.DependencyResolver;
import com.hydra.runtime.resolve.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Static checks of the configured module graph, run before anything is loaded.
 *
 * <p>For enabled modules visible from the runtime side it checks that:</p>
 * <ul>
 *   <li>every module block parsed</li>
 *   <li>every dependency is configured</li>
 *   <li>no shared module depends on a side-only module, and no server module depends on a
 *       client module or the other way round</li>
 *   <li>the dependencies have no cycle</li>
 * </ul>
 * <p>Problems are aggregated. Under strict validation they throw
 * {@link HydraConfigException}; otherwise they are logged and reported to the error sink.</p>
 */
public class ConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    private final HydraEvents events;

    public ConfigValidator(HydraEvents events) {
        this.events = events;
    }

    /**
     * Validate the configuration.
     *
     * @return the problems found, empty when the configuration is valid
     * @throws HydraConfigException under strict validation, if any problem is found
     */
    public List<String> validate(HydraConfig config) {
        Location side = config.getSide();
        Map<String, ModuleDescriptor> descriptors = config.getDescriptors();
        List<String> problems = new ArrayList<>(config.getDescriptorErrors());

        List<String> relevant = new ArrayList<>();
        for (ModuleDescriptor descriptor : descriptors.values()) {
            if (descriptor.isEnabled() && descriptor.getLocation().isVisibleFrom(side)) {
                relevant.add(descriptor.getName());
            }
        }

        for (String name : relevant) {
            ModuleDescriptor descriptor = descriptors.get(name);
            for (String dep : descriptor.getDependencies()) {
                ModuleDescriptor depDescriptor = descriptors.get(dep);
                if (depDescriptor == null) {
                    problems.add("Missing dependency config '" + dep + "' for " + name);
                    continue;
                }
                String mismatch = sideMismatch(descriptor, depDescriptor);
                if (mismatch != null) {
                    problems.add(mismatch);
                }
            }
        }

        ResolutionResult resolution = new DependencyResolver(false)
                .resolve(relevant, name -> descriptors.get(name).getDependencies());
        if (resolution.isCyclic()) {
            problems.add("Cycle detected in dependencies: " + resolution.getUnresolved());
        }

        if (!problems.isEmpty()) {
            String aggregated = String.join("; ", problems);
            if (config.isStrictValidation()) {
                throw new HydraConfigException("Config validation failed: " + aggregated);
            }
            log.warn("Config validation warnings: {}", aggregated);
            events.reportError(HydraEvents.RUNTIME_SOURCE, "Validate: " + aggregated);
        } else {
            log.debug("Config validation passed for {} modules", relevant.size());
        }
        return problems;
    }

    private static String sideMismatch(ModuleDescriptor module, ModuleDescriptor dependency) {
        Location location = module.getLocation();
        Location depLocation = dependency.getLocation();
        if (location == Location.SHARED && depLocation != Location.SHARED) {
            return "Side mismatch: Shared module " + module.getName() + " depends on "
                   + depLocation + "-only " + dependency.getName();
        }
        if (location != Location.SHARED && depLocation != Location.SHARED && location != depLocation) {
            return "Side mismatch: " + location + " module " + module.getName() + " depends on "
                   + depLocation + " " + dependency.getName();
        }
        return null;
    }
}
