package com.docfusion.core.config;

import com.docfusion.core.exception.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link DocFusionConfig} from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code docfusion.yaml} into records.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DocFusionConfig config = ConfigLoader.load(Paths.get("docfusion.yaml"));
 * ConfigValidator.validateOrThrow(config);
 * new DocGenerator(config, logger).generate();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code docfusion.yaml}
     * @return loaded configuration
     * @throws ConfigurationException if the file is missing, unreadable or malformed
     */
    public static DocFusionConfig load(Path configPath) {
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigurationException("Configuration file is not readable: " + configPath);
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            DocFusionConfig config = YAML_MAPPER.readValue(configPath.toFile(), DocFusionConfig.class);
            if (config == null) {
                throw new ConfigurationException("Configuration file is empty: " + configPath);
            }
            log.info("Loaded configuration from: {} ({} pass(es))", configPath, config.passes().size());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException(
                "Failed to parse configuration file: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from a YAML file, or returns {@link DocFusionConfig#defaults()} if the
     * file does not exist.
     *
     * @param configPath path to {@code docfusion.yaml}
     * @return loaded configuration or defaults
     * @throws ConfigurationException if the file exists but cannot be parsed
     */
    public static DocFusionConfig loadOrDefaults(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults (one JVM pass over src/main/java).",
                configPath);
            return DocFusionConfig.defaults();
        }
        return load(configPath);
    }

    /**
     * Parses configuration from YAML text.
     *
     * @param yaml YAML document
     * @return parsed configuration
     * @throws ConfigurationException if the text is malformed
     */
    public static DocFusionConfig parse(String yaml) {
        try {
            DocFusionConfig config = YAML_MAPPER.readValue(yaml, DocFusionConfig.class);
            if (config == null) {
                throw new ConfigurationException("Configuration is empty");
            }
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse configuration: " + e.getMessage(), e);
        }
    }
}
