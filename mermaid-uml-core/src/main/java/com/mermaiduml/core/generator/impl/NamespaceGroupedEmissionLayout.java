package com.mermaiduml.core.generator.impl;

import com.mermaiduml.core.model.DiagramEntity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Emits entities grouped into namespace containers in three passes.
 *
 * <p>Mermaid requires every namespace block to be declared before annotations or
 * edges refer to its classes, so the passes are:
 * <ol>
 *   <li>class bodies, inside {@code namespace} blocks sorted by key; entities without
 *       a namespace come first and sit outside any block</li>
 *   <li>stereotype lines for all entities, in original order</li>
 *   <li>relationship lines for all entities, in original order</li>
 * </ol>
 *
 * <p>Stereotypes are shared with the flat layout, so an abstract class is annotated
 * {@code <<abstract>>} here too. Older grouped output printed {@code <<Class>>} for
 * abstract classes; diagrams regenerated from the same input differ on those lines.
 */
final class NamespaceGroupedEmissionLayout implements EmissionLayout {

    private static final String NAMESPACE_INDENT = MermaidSyntax.INDENT + MermaidSyntax.INDENT;

    @Override
    public void appendBody(StringBuilder sb, List<DiagramEntity> entities) {
        for (Map.Entry<String, List<DiagramEntity>> group : groupByNamespace(entities).entrySet()) {
            String key = group.getKey();
            if (key == null) {
                for (DiagramEntity entity : group.getValue()) {
                    MermaidSyntax.appendBody(sb, entity, MermaidSyntax.INDENT);
                }
            } else {
                sb.append(MermaidSyntax.INDENT).append("namespace ").append(key).append(" {").append(MermaidSyntax.NEWLINE);
                for (DiagramEntity entity : group.getValue()) {
                    MermaidSyntax.appendBody(sb, entity, NAMESPACE_INDENT);
                }
                sb.append(MermaidSyntax.INDENT).append("}").append(MermaidSyntax.NEWLINE);
            }
        }
        sb.append(MermaidSyntax.NEWLINE);

        for (DiagramEntity entity : entities) {
            MermaidSyntax.appendStereotype(sb, entity);
        }
        sb.append(MermaidSyntax.NEWLINE);

        for (DiagramEntity entity : entities) {
            MermaidSyntax.appendRelationships(sb, entity);
        }
    }

    /**
     * Groups entities by namespace key, keys sorted with the no-namespace group first.
     *
     * @param entities entities in original order
     * @return ordered groups; entity order inside a group is preserved
     */
    static Map<String, List<DiagramEntity>> groupByNamespace(List<DiagramEntity> entities) {
        Map<String, List<DiagramEntity>> groups = new TreeMap<>(Comparator.nullsFirst(Comparator.<String>naturalOrder()));
        for (DiagramEntity entity : entities) {
            groups.computeIfAbsent(namespaceKey(entity.namespace()), k -> new ArrayList<>()).add(entity);
        }
        return groups;
    }

    /**
     * Normalizes a namespace into a Mermaid namespace identifier.
     *
     * @param namespace dotted namespace, or null
     * @return key with {@code .} replaced by {@code -}, or null when there is no namespace
     */
    static String namespaceKey(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            return null;
        }
        return namespace.replace('.', '-');
    }
}
