package com.mermaiduml.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads {@code mermaid-uml.yaml} into {@link ProjectConfig}.
 *
 * <p>Configuration is optional. Every failure falls back to {@link ProjectConfig#defaults()}
 * after logging; a missing file is normal and only logged at debug level.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.discover(Paths.get(""));
 * DiagramOptions options = config.diagram().toOptions();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    /** Default configuration file name. */
    public static final String DEFAULT_FILE_NAME = "mermaid-uml.yaml";

    /** File names looked up by {@link #discover(Path)}, in order. */
    public static final List<String> CANDIDATE_FILE_NAMES = List.of(DEFAULT_FILE_NAME, "mermaid-uml.yml");

    private ConfigLoader() {
    }

    /**
     * Loads the first configuration file found in a directory.
     *
     * @param directory directory to search
     * @return loaded configuration, or defaults when no candidate exists
     */
    public static ProjectConfig discover(Path directory) {
        for (String candidate : CANDIDATE_FILE_NAMES) {
            Path path = directory.resolve(candidate);
            if (Files.exists(path)) {
                return load(path);
            }
        }
        log.debug("No configuration file in {}. Using defaults.", directory.toAbsolutePath());
        return ProjectConfig.defaults();
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to the YAML file
     * @return loaded configuration or defaults if unavailable
     */
    public static ProjectConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }

        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            ProjectConfig config = YAML_MAPPER.readValue(reader, ProjectConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ProjectConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ProjectConfig.defaults();
        }
    }
}
