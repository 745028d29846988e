package com.bpmnnarrator.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading narrator configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code bpmn-narrator.yaml} into {@link NarratorConfig} records.
 * If the config file is missing or invalid, returns {@link NarratorConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * NarratorConfig config = ConfigLoader.load(Path.of("bpmn-narrator.yaml"));
 *
 * if (config.narrative().showLinkEvents()) {
 *     // Link events get their own numbered lines
 * }
 * }</pre>
 */
public class ConfigLoader {

    /**
     * Conventional configuration file name.
     */
    public static final String DEFAULT_FILE_NAME = "bpmn-narrator.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link NarratorConfig#defaults()}.
     *
     * @param configPath path to {@code bpmn-narrator.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static NarratorConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return NarratorConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return NarratorConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            NarratorConfig config = YAML_MAPPER.readValue(configPath.toFile(), NarratorConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return NarratorConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return NarratorConfig.defaults();
        }
    }

    /**
     * Serializes a configuration to YAML.
     *
     * @param config configuration to write
     * @return YAML document
     * @throws IOException if serialization fails
     */
    public static String toYaml(NarratorConfig config) throws IOException {
        return YAML_MAPPER.writeValueAsString(config);
    }
}
