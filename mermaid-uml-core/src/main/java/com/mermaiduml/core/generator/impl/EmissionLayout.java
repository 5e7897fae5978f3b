package com.mermaiduml.core.generator.impl;

import com.mermaiduml.core.model.DiagramEntity;

import java.util.List;

/**
 * Orders the statements of a class diagram body.
 *
 * <p>Layouts decide only where bodies, stereotypes and relationships go; the text of
 * each statement comes from {@link MermaidSyntax}.
 */
interface EmissionLayout {

    /**
     * Appends the {@code classDiagram} body for the entities.
     *
     * @param sb target buffer
     * @param entities entities in original order
     */
    void appendBody(StringBuilder sb, List<DiagramEntity> entities);
}
