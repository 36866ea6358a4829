package com.columncascade.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading the cascading configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code cascade.yaml} into {@link CascadeConfig} records.
 * If the config file is missing or invalid, returns {@link CascadeConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CascadeConfig config = ConfigLoader.load(Paths.get("cascade.yaml"));
 * int limit = config.lookup().limit();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "cascade.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link CascadeConfig#defaults()}.
     *
     * @param configPath path to {@code cascade.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CascadeConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return CascadeConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CascadeConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CascadeConfig config = YAML_MAPPER.readValue(configPath.toFile(), CascadeConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CascadeConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CascadeConfig.defaults();
        }
    }

    /**
     * Writes a configuration as YAML.
     *
     * @param config configuration to write
     * @param configPath destination file
     * @throws IOException if the file cannot be written
     */
    public static void write(CascadeConfig config, Path configPath) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        YAML_MAPPER.writeValue(configPath.toFile(), config);
        log.info("Wrote configuration to: {}", configPath);
    }
}
