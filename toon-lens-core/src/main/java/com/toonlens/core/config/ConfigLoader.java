package com.toonlens.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading Toon Lens configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code .toonlens.yaml} into {@link ToonConfig} records.
 * If the config file is missing or invalid, returns {@link ToonConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ToonConfig config = ConfigLoader.load(Path.of(ConfigLoader.DEFAULT_FILE_NAME));
 * ToonParser parser = new ToonParser(config.parser().toOptions());
 * }</pre>
 */
public final class ConfigLoader {

    /** File name looked up in the working directory when no path is given. */
    public static final String DEFAULT_FILE_NAME = ".toonlens.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>Never throws. A missing, unreadable, malformed or out-of-range file is logged and
     * replaced by {@link ToonConfig#defaults()}.
     *
     * @param configPath path to {@code .toonlens.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ToonConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ToonConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ToonConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ToonConfig config = YAML_MAPPER.readValue(configPath.toFile(), ToonConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ToonConfig.defaults();
            }
            // Surface invalid values here rather than at first use.
            config.parser().toOptions();
            config.format().toOptions();
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ToonConfig.defaults();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration in {}: {}. Using defaults.", configPath, e.getMessage());
            return ToonConfig.defaults();
        }
    }
}
