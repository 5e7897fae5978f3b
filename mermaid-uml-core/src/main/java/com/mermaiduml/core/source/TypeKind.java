package com.mermaiduml.core.source;

/**
 * Kind of a type symbol in the snapshot.
 */
public enum TypeKind {
    CLASS,
    INTERFACE,
    ENUM,
    STRUCT
}
