package com.mermaiduml.core.model;

/**
 * Structural relationships between diagram entities.
 */
public enum RelationshipKind {
    /** Class extends class, or interface extends interface */
    INHERITANCE,

    /** Strong whole/part ownership */
    COMPOSITION,

    /** Has-many relationship inferred from a collection-shaped member */
    AGGREGATION,

    /** Plain reference to another type */
    ASSOCIATION,

    /** Reference to an enum-typed member */
    DEPENDENCY,

    /** Class implements interface */
    REALIZATION,

    /** Untyped link */
    LINK
}
