package com.structgrep.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@link EngineConfig} from {@code structgrep.yaml}.
 *
 * <p>Configuration problems never stop a scan: a file that cannot be read or parsed as
 * YAML is reported in the log and {@link EngineConfig#defaults()} is used instead. Values left
 * out of the file take their defaults from the {@link EngineConfig} constructor.
 *
 * @see EngineConfig
 */
public class ConfigLoader {

    /** Conventional configuration file name, looked up in the working directory. */
    public static final String DEFAULT_FILE_NAME = "structgrep.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads a configuration file that was asked for explicitly.
     *
     * @param configPath path to the YAML file
     * @return configuration from the file, or defaults with a warning when it cannot be used
     */
    public static EngineConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file {} does not exist, using defaults", configPath);
            return EngineConfig.defaults();
        }
        return read(configPath).orElseGet(EngineConfig::defaults);
    }

    /**
     * Loads the configuration file if there is one.
     *
     * @param configPath path to the YAML file, may be {@code null}
     * @return configuration from the file, or defaults when there is no file or it cannot be used
     */
    public static EngineConfig loadOrDefaults(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("No configuration file at {}, using defaults", configPath);
            return EngineConfig.defaults();
        }
        return read(configPath).orElseGet(EngineConfig::defaults);
    }

    private static Optional<EngineConfig> read(Path configPath) {
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Cannot read configuration file {}, using defaults", configPath);
            return Optional.empty();
        }
        try {
            EngineConfig config = YAML_MAPPER.readValue(configPath.toFile(), EngineConfig.class);
            if (config == null) {
                log.warn("Configuration file {} is empty, using defaults", configPath);
                return Optional.empty();
            }
            log.info("Using configuration from {}: {}", configPath, config);
            return Optional.of(config);
        } catch (JsonProcessingException e) {
            log.error("Invalid configuration in {}, using defaults: {}", configPath, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.error("Failed to read configuration file {}, using defaults: {}", configPath, e.getMessage());
            return Optional.empty();
        }
    }
}
