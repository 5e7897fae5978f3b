package com.mermaiduml.core.pipeline;

import com.mermaiduml.core.builder.DiagramAssembler;
import com.mermaiduml.core.builder.EntityCatalog;
import com.mermaiduml.core.builder.RelationshipInferencer;
import com.mermaiduml.core.builder.TypeModelBuilder;
import com.mermaiduml.core.config.DiagramOptions;
import com.mermaiduml.core.config.ProjectConfig;
import com.mermaiduml.core.generator.DiagramGenerator;
import com.mermaiduml.core.generator.GeneratedDiagram;
import com.mermaiduml.core.generator.GeneratorConfig;
import com.mermaiduml.core.generator.impl.MermaidClassDiagramGenerator;
import com.mermaiduml.core.model.ClassDiagramModel;
import com.mermaiduml.core.model.DiagramEntity;
import com.mermaiduml.core.source.EnumDescriptor;
import com.mermaiduml.core.source.SourceUnit;
import com.mermaiduml.core.source.TypeDescriptor;
import com.mermaiduml.core.source.TypeSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the full snapshot-to-diagram transformation.
 *
 * <p>Orchestrates the pipeline:
 * <ol>
 *   <li>Build an entity per declared type and infer its relationships</li>
 *   <li>Build an entity per declared enum</li>
 *   <li>Collect entities in first-seen order: per source unit, types then enums</li>
 *   <li>Filter by entity kind</li>
 *   <li>Generate the diagram text</li>
 * </ol>
 *
 * <p>The pipeline holds no state between runs and produces identical output for
 * identical input.
 */
public class ClassDiagramPipeline {

    private static final Logger log = LoggerFactory.getLogger(ClassDiagramPipeline.class);

    private final DiagramGenerator generator;
    private final List<String> systemNamespacePrefixes;
    private final TypeModelBuilder typeModelBuilder = new TypeModelBuilder();
    private final DiagramAssembler assembler = new DiagramAssembler();

    /**
     * Creates a pipeline with the Mermaid generator and the default system namespace prefix.
     */
    public ClassDiagramPipeline() {
        this(new MermaidClassDiagramGenerator(), List.of(ProjectConfig.SYSTEM_NAMESPACE_PREFIX));
    }

    /**
     * Creates a pipeline.
     *
     * @param generator diagram generator
     * @param systemNamespacePrefixes namespace prefixes treated as library code
     */
    public ClassDiagramPipeline(DiagramGenerator generator, List<String> systemNamespacePrefixes) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.systemNamespacePrefixes = List.copyOf(
            Objects.requireNonNull(systemNamespacePrefixes, "systemNamespacePrefixes must not be null"));
    }

    /**
     * Runs the pipeline with the snapshot's project name and no title override.
     *
     * @param snapshot type snapshot
     * @param options diagram options
     * @return run result
     */
    public ClassDiagramResult run(TypeSnapshot snapshot, DiagramOptions options) {
        return run(snapshot, snapshot.project(), options, null);
    }

    /**
     * Runs the pipeline.
     *
     * @param snapshot type snapshot
     * @param projectName project name used for the output file name
     * @param options diagram options
     * @param title diagram title override, or null
     * @return run result
     */
    public ClassDiagramResult run(TypeSnapshot snapshot, String projectName, DiagramOptions options, String title) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(projectName, "projectName must not be null");
        Objects.requireNonNull(options, "options must not be null");

        log.info("Generating class diagram for project: {}", projectName);

        List<DiagramEntity> entities = buildEntities(snapshot, options);
        int skipped = snapshot.typeCount() + snapshot.enumCount() - entities.size();
        if (skipped > 0) {
            log.debug("Skipped {} declarations without usable symbol data", skipped);
        }

        List<NameCollision> collisions = NameCollisionDetector.detect(entities);
        for (NameCollision collision : collisions) {
            log.warn("Type name '{}' is declared in several namespaces {}; they share one diagram node",
                collision.name(), collision.namespaces());
        }

        ClassDiagramModel model = new ClassDiagramModel(projectName, assembler.assemble(entities, options));
        GeneratedDiagram diagram = generator.generate(model, GeneratorConfig.from(options, title));
        String fileName = OutputFileNames.forProject(projectName, options, generator.getFileExtension());

        return new ClassDiagramResult(model, diagram, fileName, collisions, skipped);
    }

    /**
     * Builds all entities with their relationships, before kind filtering.
     *
     * @param snapshot type snapshot
     * @param options diagram options; only nested inheritance is consulted
     * @return entities in first-seen order
     */
    public List<DiagramEntity> buildEntities(TypeSnapshot snapshot, DiagramOptions options) {
        RelationshipInferencer inferencer = new RelationshipInferencer(options.nestedInheritance(), systemNamespacePrefixes);
        EntityCatalog catalog = new EntityCatalog();

        for (SourceUnit unit : snapshot.units()) {
            log.debug("Processing source unit: {}", unit.path());
            for (TypeDescriptor type : unit.types()) {
                typeModelBuilder.build(type)
                    .map(entity -> entity.withRelationships(inferencer.infer(entity, type)))
                    .ifPresent(catalog::append);
            }
            for (EnumDescriptor enumeration : unit.enums()) {
                typeModelBuilder.build(enumeration).ifPresent(catalog::append);
            }
        }

        log.debug("Built {} entities", catalog.size());
        return catalog.seal();
    }
}
