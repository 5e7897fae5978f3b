package com.mermaiduml.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A method signature shown inside a class box.
 *
 * @param name method name
 * @param returnType simple name of the return type
 * @param visibility method visibility
 * @param parameters ordered parameters, each formatted as {@code "Type name"}
 * @param async whether the method is declared async
 */
public record DiagramMethod(
    String name,
    String returnType,
    Visibility visibility,
    List<String> parameters,
    boolean async
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramMethod {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(returnType, "returnType must not be null");
        if (visibility == null) {
            visibility = Visibility.UNKNOWN;
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
