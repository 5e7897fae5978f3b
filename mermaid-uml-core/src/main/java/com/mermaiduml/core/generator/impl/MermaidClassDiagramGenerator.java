package com.mermaiduml.core.generator.impl;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mermaiduml.core.generator.DiagramGenerator;
import com.mermaiduml.core.generator.GeneratedDiagram;
import com.mermaiduml.core.generator.GeneratorConfig;
import com.mermaiduml.core.model.ClassDiagramModel;
import com.mermaiduml.core.model.DiagramEntity;

/**
 * Generates Mermaid class diagrams embedded in Markdown.
 *
 * <p>The document is a {@code ```mermaid} code block holding a front-matter header
 * (title and a switch hiding empty member boxes) followed by a {@code classDiagram}.
 *
 * <h2>Body layouts</h2>
 * <ul>
 *   <li><b>Flat:</b> per entity, its class body, stereotype and relationships</li>
 *   <li><b>Grouped by namespace:</b> all bodies inside namespace blocks, then all
 *       stereotypes, then all relationships</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MermaidClassDiagramGenerator generator = new MermaidClassDiagramGenerator();
 * GeneratedDiagram diagram = generator.generate(model, GeneratorConfig.defaults());
 * // diagram.content() contains Markdown with an embedded classDiagram
 * }</pre>
 *
 * @see <a href="https://mermaid.js.org/syntax/classDiagram.html">Mermaid class diagrams</a>
 */
public class MermaidClassDiagramGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidClassDiagramGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid-class";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Class Diagram Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    // Front matter
    private static final String FRONT_MATTER_DELIMITER = "---\n";
    private static final String DEFAULT_TITLE = "UML Diagram";
    private static final String CLASS_DIAGRAM = "classDiagram\n";

    private final EmissionLayout flatLayout = new FlatEmissionLayout();
    private final EmissionLayout groupedLayout = new NamespaceGroupedEmissionLayout();

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public GeneratedDiagram generate(ClassDiagramModel model, GeneratorConfig config) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(config, "config must not be null");

        log.debug("Generating Mermaid class diagram for {} entities (grouped: {})",
            model.entities().size(), config.groupByNamespace());

        String title = resolveTitle(model, config);
        StringBuilder sb = new StringBuilder();
        sb.append(CODE_BLOCK_START);
        appendFrontMatter(sb, title);
        sb.append(CLASS_DIAGRAM);

        EmissionLayout layout = config.groupByNamespace() ? groupedLayout : flatLayout;
        layout.appendBody(sb, model.entities());

        sb.append(CODE_BLOCK_END);

        log.info("Generated Mermaid class diagram '{}' with {} entities", title, model.entities().size());
        return new GeneratedDiagram(title, sb.toString(), getFileExtension(), model.entities().size());
    }

    /**
     * Resolves the diagram title: explicit title, else the first entity's name, else a fixed default.
     *
     * @param model the model
     * @param config generator configuration
     * @return diagram title
     */
    private String resolveTitle(ClassDiagramModel model, GeneratorConfig config) {
        if (config.title() != null) {
            return config.title();
        }
        return model.entities().stream()
            .findFirst()
            .map(DiagramEntity::name)
            .orElse(DEFAULT_TITLE);
    }

    private void appendFrontMatter(StringBuilder sb, String title) {
        sb.append(FRONT_MATTER_DELIMITER);
        sb.append("title: ").append(title).append(MermaidSyntax.NEWLINE);
        sb.append("config:\n");
        sb.append("  class:\n");
        sb.append("    hideEmptyMembersBox: true\n");
        sb.append(FRONT_MATTER_DELIMITER);
    }
}
