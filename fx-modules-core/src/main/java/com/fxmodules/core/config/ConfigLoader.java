package com.fxmodules.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading FX configuration from YAML.
 *
 * <p>Uses Jackson to deserialize {@code fx.yaml} into {@link FxConfig} records.
 * A missing or empty config yields {@link FxConfig#defaults()}. A document that is present
 * but malformed raises {@link ConfigurationException}, since it would otherwise drop
 * entity declarations and the autowire root.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FxConfig config = ConfigLoader.load(Path.of("fx.yaml"));
 * Autowire autowire = new Autowire(config.scanContext());
 * }</pre>
 */
public class ConfigLoader {

    /** Conventional configuration file and class-path resource name. */
    public static final String DEFAULT_RESOURCE = "fx.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or isn't a readable file, logs a warning and returns
     * {@link FxConfig#defaults()}.
     *
     * @param configPath path to {@code fx.yaml}
     * @return loaded configuration or defaults if unavailable
     * @throws ConfigurationException if the file exists but cannot be parsed
     */
    public static FxConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return FxConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return FxConfig.defaults();
        }

        log.debug("Loading configuration from: {}", configPath);
        String yaml;
        try {
            yaml = Files.readString(configPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException(configPath.toString(), e);
        }
        FxConfig config = read(yaml, configPath.toString());
        log.info("Loaded configuration from: {}", configPath);
        return config;
    }

    /**
     * Loads configuration from a class-path resource, e.g. {@code fx.yaml} in {@code src/main/resources}.
     *
     * @param resource resource name
     * @return loaded configuration or defaults if the resource is absent
     * @throws ConfigurationException if the resource exists but cannot be parsed
     */
    public static FxConfig loadResource(String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        String yaml;
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Configuration resource not found: {}. Using defaults.", resource);
                return FxConfig.defaults();
            }
            yaml = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException(resource, e);
        }
        FxConfig config = read(yaml, resource);
        log.info("Loaded configuration resource: {}", resource);
        return config;
    }

    /**
     * Parses configuration from YAML text.
     *
     * @param yaml configuration document
     * @return parsed configuration, defaults for blank text
     * @throws ConfigurationException if the text is not a valid configuration document
     */
    public static FxConfig parse(String yaml) {
        return read(yaml, "<inline>");
    }

    private static FxConfig read(String yaml, String source) {
        if (yaml == null || yaml.isBlank()) {
            log.warn("Configuration {} is empty. Using defaults.", source);
            return FxConfig.defaults();
        }
        try {
            FxConfig config = YAML_MAPPER.readValue(yaml, FxConfig.class);
            return config != null ? config : FxConfig.defaults();
        } catch (IOException e) {
            log.error("Failed to parse configuration {}: {}", source, e.getMessage());
            throw new ConfigurationException(source, e);
        }
    }
}
