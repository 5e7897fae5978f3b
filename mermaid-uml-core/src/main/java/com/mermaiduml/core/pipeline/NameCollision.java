package com.mermaiduml.core.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A simple type name declared in more than one namespace.
 *
 * <p>Diagram nodes are keyed by simple name, so colliding declarations render as one box.
 *
 * @param name the shared simple name
 * @param namespaces distinct namespaces declaring it, in first-seen order; null stands for no namespace
 */
public record NameCollision(
    String name,
    List<String> namespaces
) {
    public NameCollision {
        // List.copyOf rejects the null entry of the no-namespace group
        namespaces = Collections.unmodifiableList(new ArrayList<>(namespaces));
    }
}
