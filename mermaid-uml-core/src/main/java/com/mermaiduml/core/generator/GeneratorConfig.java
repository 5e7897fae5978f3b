package com.mermaiduml.core.generator;

import com.mermaiduml.core.config.DiagramOptions;

/**
 * Configuration for diagram generation.
 *
 * @param groupByNamespace render entities inside namespace containers
 * @param title diagram title, or null to use the first entity's name
 */
public record GeneratorConfig(
    boolean groupByNamespace,
    String title
) {
    /**
     * Compact constructor normalizing a blank title to null.
     */
    public GeneratorConfig {
        if (title != null && title.isBlank()) {
            title = null;
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(false, null);
    }

    /**
     * Derives the generator settings from run options.
     *
     * @param options diagram options
     * @param title title override, or null
     * @return generator config
     */
    public static GeneratorConfig from(DiagramOptions options, String title) {
        return new GeneratorConfig(options.groupByNamespace(), title);
    }
}
