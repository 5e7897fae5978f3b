package com.mermaiduml.core.generator;

import java.util.Objects;

/**
 * A rendered class diagram document.
 *
 * @param title title written into the diagram front matter
 * @param content complete document text
 * @param fileExtension file extension for this content, without leading dot
 * @param entityCount number of entity boxes drawn
 */
public record GeneratedDiagram(
    String title,
    String content,
    String fileExtension,
    int entityCount
) {
    public GeneratedDiagram {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
        if (entityCount < 0) {
            throw new IllegalArgumentException("entityCount must not be negative");
        }
    }
}
