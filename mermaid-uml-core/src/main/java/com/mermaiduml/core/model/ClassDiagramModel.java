package com.mermaiduml.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The assembled set of entities handed to a diagram generator.
 *
 * <p>Entity order is the first-seen order of the input and is preserved by every stage,
 * which keeps generated output reproducible.
 *
 * @param projectName name of the analyzed project
 * @param entities entities to render, in order
 */
public record ClassDiagramModel(
    String projectName,
    List<DiagramEntity> entities
) {
    /**
     * Compact constructor with validation.
     */
    public ClassDiagramModel {
        Objects.requireNonNull(projectName, "projectName must not be null");
        entities = entities == null ? List.of() : List.copyOf(entities);
    }
}
