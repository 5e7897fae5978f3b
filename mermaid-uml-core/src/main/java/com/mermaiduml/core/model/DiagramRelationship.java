package com.mermaiduml.core.model;

import java.util.Objects;

/**
 * A directed, classified edge between two entities, identified by simple names.
 *
 * @param from source entity name
 * @param to target entity name
 * @param kind relationship kind
 * @param linkStyle line style
 */
public record DiagramRelationship(
    String from,
    String to,
    RelationshipKind kind,
    LinkStyle linkStyle
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramRelationship {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(linkStyle, "linkStyle must not be null");
    }

    /**
     * Returns the identity used for deduplication. Link style is not part of it.
     *
     * @return key over (from, to, kind)
     */
    public Key key() {
        return new Key(from, to, kind);
    }

    /**
     * Deduplication key of a relationship.
     *
     * @param from source entity name
     * @param to target entity name
     * @param kind relationship kind
     */
    public record Key(String from, String to, RelationshipKind kind) {}
}
