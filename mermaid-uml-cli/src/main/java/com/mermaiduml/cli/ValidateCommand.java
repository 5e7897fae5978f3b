package com.mermaiduml.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mermaiduml.core.config.DiagramOptions;
import com.mermaiduml.core.model.DiagramEntity;
import com.mermaiduml.core.model.EntityKind;
import com.mermaiduml.core.pipeline.ClassDiagramPipeline;
import com.mermaiduml.core.pipeline.NameCollision;
import com.mermaiduml.core.pipeline.NameCollisionDetector;
import com.mermaiduml.core.source.SnapshotReadException;
import com.mermaiduml.core.source.SnapshotReader;
import com.mermaiduml.core.source.TypeSnapshot;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check a type snapshot without writing a diagram.
 *
 * <p>Reports declaration counts, entities per kind, relationships, skipped
 * declarations and simple-name collisions across namespaces.
 */
@Command(
    name = "validate",
    description = "Check a type snapshot and report what the diagram would contain",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Type snapshot file (.json, .yaml or .yml)")
    private Path snapshotPath;

    @Override
    public Integer call() {
        TypeSnapshot snapshot;
        try {
            snapshot = SnapshotReader.read(snapshotPath);
        } catch (SnapshotReadException e) {
            log.error("Validation failed", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        }

        List<DiagramEntity> entities = new ClassDiagramPipeline().buildEntities(snapshot, DiagramOptions.defaults());
        int skipped = snapshot.typeCount() + snapshot.enumCount() - entities.size();
        int relationships = entities.stream().mapToInt(e -> e.relationships().size()).sum();

        System.out.println("Project: " + snapshot.project());
        System.out.println("✓ " + snapshot.units().size() + " source units, "
            + snapshot.typeCount() + " types, " + snapshot.enumCount() + " enums");
        System.out.println("✓ " + count(entities, EntityKind.CLASS) + " classes, "
            + count(entities, EntityKind.INTERFACE) + " interfaces, "
            + count(entities, EntityKind.ENUM) + " enums, "
            + relationships + " relationships");
        if (skipped > 0) {
            System.out.println("⚠ " + skipped + " declarations skipped (missing symbol data)");
        }

        List<NameCollision> collisions = NameCollisionDetector.detect(entities);
        for (NameCollision collision : collisions) {
            System.out.println("⚠ Type '" + collision.name() + "' is declared in namespaces " + collision.namespaces());
        }
        return 0;
    }

    private static long count(List<DiagramEntity> entities, EntityKind kind) {
        return entities.stream().filter(e -> e.kind() == kind).count();
    }
}
