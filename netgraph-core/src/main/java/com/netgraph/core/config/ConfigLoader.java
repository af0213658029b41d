package com.netgraph.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading netgraph configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code netgraph.yaml} into {@link NetgraphConfig} records.
 * If the config file is missing or invalid, returns {@link NetgraphConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * NetgraphConfig config = ConfigLoader.load(Path.of("netgraph.yaml"));
 * Path json = config.output().jsonPath();
 * }</pre>
 */
public final class ConfigLoader {

    /** Default configuration file name, looked up in the working directory */
    public static final String DEFAULT_CONFIG_FILE = "netgraph.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link NetgraphConfig#defaults()}.
     *
     * @param configPath path to {@code netgraph.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static NetgraphConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return NetgraphConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return NetgraphConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            NetgraphConfig config = YAML_MAPPER.readValue(configPath.toFile(), NetgraphConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return NetgraphConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return NetgraphConfig.defaults();
        }
    }
}
