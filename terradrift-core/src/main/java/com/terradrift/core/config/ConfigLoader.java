package com.terradrift.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading TerraDrift configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code terradrift.yaml} into {@link TerraDriftConfig} records.
 * If the config file is missing or invalid, returns {@link TerraDriftConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TerraDriftConfig config = ConfigLoader.load(Paths.get("terradrift.yaml"));
 * ComparisonOptions options = config.check().toComparisonOptions();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "terradrift.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link TerraDriftConfig#defaults()}. Never throws.
     *
     * @param configPath path to {@code terradrift.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static TerraDriftConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return TerraDriftConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return TerraDriftConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            TerraDriftConfig config = YAML_MAPPER.readValue(configPath.toFile(), TerraDriftConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return TerraDriftConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return TerraDriftConfig.defaults();
        }
    }
}
