package com.mermaiduml.core.renderer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where and how diagram files are rendered.
 *
 * @param outputDirectory directory receiving written files; ignored by console output
 * @param showHeaders print a {@code File i/n: name} line before each file on the console
 * @param separator text repeated to a full line between files on the console
 */
public record RenderTarget(
    Path outputDirectory,
    boolean showHeaders,
    String separator
) {
    /** Separator used when none is given. */
    public static final String DEFAULT_SEPARATOR = "---";

    public RenderTarget {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (separator == null || separator.isEmpty()) {
            separator = DEFAULT_SEPARATOR;
        }
    }

    /**
     * Target for writing files into a directory.
     *
     * @param outputDirectory output directory
     * @return render target
     */
    public static RenderTarget directory(Path outputDirectory) {
        return new RenderTarget(outputDirectory, true, DEFAULT_SEPARATOR);
    }

    /**
     * Target for printing raw documents, suitable for shell redirection.
     *
     * @return render target without headers
     */
    public static RenderTarget rawConsole() {
        return new RenderTarget(Path.of("."), false, DEFAULT_SEPARATOR);
    }
}
