package com.mermaiduml.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.Stream;

/**
 * Root configuration for Mermaid UML runs.
 *
 * <p>Loaded from {@code mermaid-uml.yaml}. Every section is optional; missing values
 * fall back to the defaults of {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Zoo"
 *
 * diagram:
 *   excludeEnums: true
 *   nestedInheritance: false
 *   groupByNamespace: true
 *   systemNamespacePrefixes:
 *     - System
 *     - Microsoft
 *
 * output:
 *   directory: "./docs/uml"
 * }</pre>
 *
 * @param project project metadata
 * @param diagram diagram switches
 * @param output output configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("diagram") DiagramSettings diagram,
    @JsonProperty("output") OutputConfig output
) {
    /** Namespace prefix of library types that never produce member-derived edges. */
    public static final String SYSTEM_NAMESPACE_PREFIX = "System";

    public ProjectConfig {
        if (project == null) {
            project = new ProjectInfo(null);
        }
        if (diagram == null) {
            diagram = DiagramSettings.defaults();
        }
        if (output == null) {
            output = new OutputConfig(null);
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(new ProjectInfo(null), DiagramSettings.defaults(), new OutputConfig(null));
    }

    /**
     * Project metadata.
     *
     * @param name project name overriding the snapshot's, or null
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name
    ) {}

    /**
     * Diagram switches as written in the configuration file.
     *
     * @param excludeClasses drop classes
     * @param excludeInterfaces drop interfaces
     * @param excludeEnums drop enums
     * @param nestedInheritance draw edges to all ancestors
     * @param groupByNamespace render namespace containers
     * @param systemNamespacePrefixes namespace prefixes treated as library code, always led by {@code System}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiagramSettings(
        @JsonProperty("excludeClasses") boolean excludeClasses,
        @JsonProperty("excludeInterfaces") boolean excludeInterfaces,
        @JsonProperty("excludeEnums") boolean excludeEnums,
        @JsonProperty("nestedInheritance") boolean nestedInheritance,
        @JsonProperty("groupByNamespace") boolean groupByNamespace,
        @JsonProperty("systemNamespacePrefixes") List<String> systemNamespacePrefixes
    ) {
        public DiagramSettings {
            Stream<String> configured = systemNamespacePrefixes == null ? Stream.empty() : systemNamespacePrefixes.stream();
            systemNamespacePrefixes = Stream.concat(Stream.of(SYSTEM_NAMESPACE_PREFIX), configured)
                .filter(prefix -> prefix != null && !prefix.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
        }

        public static DiagramSettings defaults() {
            return new DiagramSettings(false, false, false, false, false, null);
        }

        /**
         * Converts the file settings into run options.
         *
         * @return diagram options
         */
        public DiagramOptions toOptions() {
            return new DiagramOptions(excludeClasses, excludeInterfaces, excludeEnums, nestedInheritance, groupByNamespace);
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path, or null for the working directory
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {}
}
