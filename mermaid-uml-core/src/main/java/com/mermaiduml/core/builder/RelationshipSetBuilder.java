package com.mermaiduml.core.builder;

import com.mermaiduml.core.model.DiagramRelationship;
import com.mermaiduml.core.model.LinkStyle;
import com.mermaiduml.core.model.RelationshipKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates the relationships of one entity, dropping duplicates on (from, to, kind).
 *
 * <p>Insertion order is kept. After {@link #freeze()} the builder rejects further additions.
 */
public class RelationshipSetBuilder {

    private final Map<DiagramRelationship.Key, DiagramRelationship> edges = new LinkedHashMap<>();
    private boolean frozen;

    /**
     * Adds an edge unless one with the same (from, to, kind) is already present.
     *
     * @param from source entity name
     * @param to target entity name
     * @param kind relationship kind
     * @param linkStyle line style
     * @return true if the edge was added
     * @throws IllegalStateException if the builder has been frozen
     */
    public boolean add(String from, String to, RelationshipKind kind, LinkStyle linkStyle) {
        return add(new DiagramRelationship(from, to, kind, linkStyle));
    }

    /**
     * Adds an edge unless one with the same (from, to, kind) is already present.
     *
     * @param relationship edge to add
     * @return true if the edge was added
     * @throws IllegalStateException if the builder has been frozen
     */
    public boolean add(DiagramRelationship relationship) {
        if (frozen) {
            throw new IllegalStateException("Relationship set is frozen");
        }
        return edges.putIfAbsent(relationship.key(), relationship) == null;
    }

    public int size() {
        return edges.size();
    }

    /**
     * Freezes the builder and returns the collected edges.
     *
     * @return immutable list in insertion order
     */
    public List<DiagramRelationship> freeze() {
        frozen = true;
        return List.copyOf(edges.values());
    }
}
