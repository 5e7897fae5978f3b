package com.mermaiduml.core.source;

import java.nio.file.Path;

/**
 * Thrown when a type snapshot cannot be read or parsed.
 */
public class SnapshotReadException extends RuntimeException {

    private final transient Path path;

    public SnapshotReadException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * Returns the snapshot file that failed to load.
     *
     * @return snapshot path
     */
    public Path getPath() {
        return path;
    }
}
