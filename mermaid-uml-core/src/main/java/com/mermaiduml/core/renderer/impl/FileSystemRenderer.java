package com.mermaiduml.core.renderer.impl;

import com.mermaiduml.core.renderer.DiagramFile;
import com.mermaiduml.core.renderer.OutputRenderer;
import com.mermaiduml.core.renderer.RenderTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes diagram files into the target directory as UTF-8, replacing existing files.
 *
 * <p>File names must stay inside the output directory; {@code ../} escapes are rejected.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * new FileSystemRenderer().render(
 *     List.of(new DiagramFile("Zoo.md", diagram.content())),
 *     RenderTarget.directory(Path.of("docs/uml")));
 * // Creates: docs/uml/Zoo.md
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(List<DiagramFile> files, RenderTarget target) {
        Path outputDir = target.outputDirectory().toAbsolutePath().normalize();
        logger.debug("Writing {} diagram files to {}", files.size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (DiagramFile file : files) {
            write(resolveInside(outputDir, file.fileName()), file.content());
        }
    }

    private static Path resolveInside(Path outputDir, String fileName) {
        Path resolved = outputDir.resolve(fileName).normalize();
        if (!resolved.startsWith(outputDir)) {
            throw new IllegalStateException("Diagram file escapes the output directory: " + fileName);
        }
        return resolved;
    }

    private void write(Path path, String content) {
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
            logger.info("Wrote diagram: {} ({} chars)", path, content.length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write diagram file: " + path, e);
        }
    }
}
