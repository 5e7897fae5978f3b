package com.mermaiduml.core.model;

/**
 * Line style of a relationship edge.
 */
public enum LinkStyle {
    SOLID,
    DASHED
}
