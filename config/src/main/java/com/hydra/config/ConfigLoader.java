package com.hydra.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Optional;

/**
 * Layers Hydra configuration: {@code reference.conf} &lt; {@code application.conf} &lt;
 * the given files, in order &lt; system properties.
 *
 * <pre>{@code
 * HydraConfig settings = ConfigLoader.loadHydraConfig("modules.conf", "prod.conf");
 * }</pre>
 *
 * <p>A file path that does not exist on disk is looked up on the classpath, then skipped
 * with a warning. A file that exists but does not parse fails the load.</p>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    /**
     * Load reference.conf, application.conf and system properties.
     */
    public static Config load() {
        return ConfigFactory.load();
    }

    /**
     * Load with extra config files layered between application.conf and system properties.
     *
     * @param configFiles paths on disk or classpath resource names, later ones win
     * @return the merged, resolved configuration
     * @throws HydraConfigException if a file exists but cannot be parsed
     */
    public static Config load(String... configFiles) {
        Config merged = ConfigFactory.defaultApplication().withFallback(ConfigFactory.defaultReference());
        for (String path : configFiles) {
            Optional<Config> layer = parse(path);
            if (layer.isPresent()) {
                merged = layer.get().withFallback(merged);
                log.info("Loaded config file: {}", path);
            }
        }
        return ConfigFactory.systemProperties().withFallback(merged).resolve();
    }

    /**
     * Load config files and parse the {@code hydra} section.
     *
     * @param configFiles paths on disk or classpath resource names, later ones win
     * @return parsed settings
     */
    public static HydraConfig loadHydraConfig(String... configFiles) {
        return HydraConfig.fromConfig(load(configFiles));
    }

    private static Optional<Config> parse(String path) {
        File file = new File(path);
        try {
            if (file.exists()) {
                return Optional.of(ConfigFactory.parseFile(file));
            }
            Config resource = ConfigFactory.parseResources(path);
            if (!resource.isEmpty()) {
                return Optional.of(resource);
            }
        } catch (ConfigException e) {
            log.error("Failed to parse config file: {}", path, e);
            throw new HydraConfigException("Failed to parse config file: " + path, e);
        }
        log.warn("Config file not found: {}", path);
        return Optional.empty();
    }
}
