package com.mermaiduml.core.config;

import com.mermaiduml.core.model.EntityKind;

/**
 * Switches that shape one class diagram run.
 *
 * @param excludeClasses drop class entities from the diagram
 * @param excludeInterfaces drop interface entities from the diagram
 * @param excludeEnums drop enum entities from the diagram
 * @param nestedInheritance draw inheritance edges to every ancestor instead of the direct base only
 * @param groupByNamespace render entities inside namespace containers
 */
public record DiagramOptions(
    boolean excludeClasses,
    boolean excludeInterfaces,
    boolean excludeEnums,
    boolean nestedInheritance,
    boolean groupByNamespace
) {
    /**
     * Creates options with every switch off.
     *
     * @return default options
     */
    public static DiagramOptions defaults() {
        return new DiagramOptions(false, false, false, false, false);
    }

    /**
     * Returns whether entities of the given kind are filtered out.
     *
     * @param kind entity kind
     * @return true if the kind is excluded
     */
    public boolean excludes(EntityKind kind) {
        return switch (kind) {
            case CLASS -> excludeClasses;
            case INTERFACE -> excludeInterfaces;
            case ENUM -> excludeEnums;
        };
    }
}
