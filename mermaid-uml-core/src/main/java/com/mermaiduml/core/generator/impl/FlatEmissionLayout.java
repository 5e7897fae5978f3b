package com.mermaiduml.core.generator.impl;

import com.mermaiduml.core.model.DiagramEntity;

import java.util.List;

/**
 * Emits each entity as body, stereotype and relationships before moving to the next.
 */
final class FlatEmissionLayout implements EmissionLayout {

    @Override
    public void appendBody(StringBuilder sb, List<DiagramEntity> entities) {
        for (DiagramEntity entity : entities) {
            MermaidSyntax.appendBody(sb, entity, MermaidSyntax.INDENT);
            MermaidSyntax.appendStereotype(sb, entity);
            MermaidSyntax.appendRelationships(sb, entity);
        }
    }
}
