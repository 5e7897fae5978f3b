package com.mermaiduml.core.pipeline;

import com.mermaiduml.core.generator.GeneratedDiagram;
import com.mermaiduml.core.model.ClassDiagramModel;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one pipeline run.
 *
 * @param model assembled model after filtering
 * @param diagram generated diagram
 * @param fileName suggested output file name
 * @param collisions simple names declared in several namespaces
 * @param skippedDeclarations declarations skipped for missing symbol data
 */
public record ClassDiagramResult(
    ClassDiagramModel model,
    GeneratedDiagram diagram,
    String fileName,
    List<NameCollision> collisions,
    int skippedDeclarations
) {
    public ClassDiagramResult {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(fileName, "fileName must not be null");
        collisions = collisions == null ? List.of() : List.copyOf(collisions);
    }
}
