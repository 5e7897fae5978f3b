package com.mermaiduml.core.model;

/**
 * Kinds of types that can appear as boxes in a class diagram.
 */
public enum EntityKind {
    /** Concrete or abstract class */
    CLASS("Class"),

    /** Interface */
    INTERFACE("Interface"),

    /** Enumeration, rendered with its members as properties */
    ENUM("Enum");

    private final String stereotype;

    EntityKind(String stereotype) {
        this.stereotype = stereotype;
    }

    /**
     * Returns the label used inside the {@code <<...>>} stereotype annotation.
     *
     * @return stereotype label, e.g. "Interface"
     */
    public String stereotype() {
        return stereotype;
    }
}
