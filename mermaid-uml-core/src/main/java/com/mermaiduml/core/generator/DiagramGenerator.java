package com.mermaiduml.core.generator;

import com.mermaiduml.core.model.ClassDiagramModel;

/**
 * Interface for generators that turn a class diagram model into diagram text.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.mermaiduml.core.generator.DiagramGenerator}
 *
 * @see ClassDiagramModel
 * @see GeneratorConfig
 * @see GeneratedDiagram
 */
public interface DiagramGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for selecting the generator from the command line. Should be lowercase
     * (e.g., "mermaid-class").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated diagrams, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Generates a diagram from the model.
     *
     * <p>Implementations must be deterministic: the same model and config always
     * produce byte-identical content. An empty model still produces a valid document.
     *
     * @param model the assembled class diagram model
     * @param config configuration settings for generation
     * @return generated diagram content
     */
    GeneratedDiagram generate(ClassDiagramModel model, GeneratorConfig config);
}
