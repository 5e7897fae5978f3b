package com.mermaiduml.core.model;

import java.util.Objects;

/**
 * A property shown inside a class box.
 *
 * @param name property name
 * @param type display type, generics as {@code Outer<Arg>} and arrays as {@code Elem[]}
 * @param visibility property visibility
 * @param collection whether the declared type is a collection shape or an array
 */
public record DiagramMember(
    String name,
    String type,
    Visibility visibility,
    boolean collection
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramMember {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (visibility == null) {
            visibility = Visibility.UNKNOWN;
        }
    }
}
