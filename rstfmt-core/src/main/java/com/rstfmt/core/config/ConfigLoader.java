package com.rstfmt.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading rstfmt configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code .rstfmt.yaml} into {@link RstFmtConfig} records.
 * If the config file is missing or invalid, returns {@link RstFmtConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * RstFmtConfig config = ConfigLoader.load(Path.of(".rstfmt.yaml"));
 * RstParser parser = new RstParser(config.markupRegistry());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Configuration file looked up in the working directory. */
    public static final String DEFAULT_FILE_NAME = ".rstfmt.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs why and returns
     * {@link RstFmtConfig#defaults()}.
     *
     * @param configPath path to the configuration file
     * @return loaded configuration or defaults if unavailable
     */
    public static RstFmtConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return RstFmtConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return RstFmtConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            RstFmtConfig config = YAML_MAPPER.readValue(configPath.toFile(), RstFmtConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return RstFmtConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return RstFmtConfig.defaults();
        }
    }

    /**
     * Loads {@value #DEFAULT_FILE_NAME} from the given directory.
     *
     * @param directory directory to look in
     * @return loaded configuration or defaults
     */
    public static RstFmtConfig loadFromDirectory(Path directory) {
        return load(directory.resolve(DEFAULT_FILE_NAME));
    }
}
