package com.mermaiduml.core.source;

/**
 * Declared accessibility of a type or member, as reported by the analysis front end.
 */
public enum Accessibility {
    PUBLIC,
    PRIVATE,
    PROTECTED,
    INTERNAL,
    PROTECTED_OR_INTERNAL,
    PROTECTED_AND_INTERNAL,
    NOT_APPLICABLE
}
