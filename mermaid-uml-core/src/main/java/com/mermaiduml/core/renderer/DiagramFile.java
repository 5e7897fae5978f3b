package com.mermaiduml.core.renderer;

import java.util.Objects;

/**
 * A rendered diagram document and the file name it should be stored under.
 *
 * @param fileName file name relative to the output directory, e.g. {@code Zoo_WithNamespaces.md}
 * @param content complete document text
 */
public record DiagramFile(
    String fileName,
    String content
) {
    public DiagramFile {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be blank");
        }
    }
}
