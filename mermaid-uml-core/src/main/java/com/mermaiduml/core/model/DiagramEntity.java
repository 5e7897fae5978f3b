package com.mermaiduml.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One class, interface or enum rendered as a box in the class diagram.
 *
 * <p>Entities are identified by their simple {@code name}. The relationships list
 * holds the edges this entity owns; every inferred edge is owned by exactly one entity.
 *
 * @param name simple type name
 * @param kind entity kind
 * @param isAbstract whether the type is abstract (meaningful for classes only)
 * @param visibility declared visibility of the type
 * @param namespace containing namespace, or null when the type has none
 * @param properties ordered properties
 * @param methods ordered methods
 * @param relationships edges owned by this entity
 */
public record DiagramEntity(
    String name,
    EntityKind kind,
    boolean isAbstract,
    Visibility visibility,
    String namespace,
    List<DiagramMember> properties,
    List<DiagramMethod> methods,
    List<DiagramRelationship> relationships
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramEntity {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (visibility == null) {
            visibility = Visibility.UNKNOWN;
        }
        if (namespace != null && namespace.isBlank()) {
            namespace = null;
        }
        properties = properties == null ? List.of() : List.copyOf(properties);
        methods = methods == null ? List.of() : List.copyOf(methods);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    /**
     * Returns a copy of this entity carrying the given relationships.
     *
     * @param inferred frozen relationship list
     * @return new entity with the relationships replaced
     */
    public DiagramEntity withRelationships(List<DiagramRelationship> inferred) {
        return new DiagramEntity(name, kind, isAbstract, visibility, namespace, properties, methods, inferred);
    }

    /**
     * Returns whether this entity is an abstract class.
     *
     * @return true for abstract classes, false for everything else
     */
    public boolean isAbstractClass() {
        return isAbstract && kind == EntityKind.CLASS;
    }
}
