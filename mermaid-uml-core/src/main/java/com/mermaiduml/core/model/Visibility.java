package com.mermaiduml.core.model;

/**
 * Member and type visibility as shown in a class diagram.
 */
public enum Visibility {
    PUBLIC,
    PRIVATE,
    PROTECTED,
    INTERNAL,
    PROTECTED_OR_INTERNAL,
    UNKNOWN
}
