package com.mermaiduml.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mermaiduml.core.config.ConfigLoader;
import com.mermaiduml.core.config.DiagramOptions;
import com.mermaiduml.core.config.ProjectConfig;
import com.mermaiduml.core.pipeline.ClassDiagramPipeline;
import com.mermaiduml.core.pipeline.ClassDiagramResult;
import com.mermaiduml.core.pipeline.NameCollision;
import com.mermaiduml.core.generator.DiagramGenerator;
import com.mermaiduml.core.renderer.DiagramFile;
import com.mermaiduml.core.renderer.OutputRenderer;
import com.mermaiduml.core.renderer.RenderTarget;
import com.mermaiduml.core.source.SnapshotReadException;
import com.mermaiduml.core.source.SnapshotReader;
import com.mermaiduml.core.source.TypeSnapshot;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to generate a Mermaid class diagram from a type snapshot.
 *
 * <p>Switches given on the command line are combined with those of the configuration
 * file: a switch is on when either source turns it on.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * mermaiduml generate types.json --outputDir docs/uml --enableNamespaces
 * mermaiduml generate types.json --stdout > diagram.md
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate a Mermaid class diagram from a type snapshot",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final String GENERATOR_ID = "mermaid-class";
    static final String FILE_RENDERER_ID = "filesystem";
    static final String CONSOLE_RENDERER_ID = "console";

    @Parameters(index = "0", description = "Type snapshot file (.json, .yaml or .yml)")
    private Path snapshotPath;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: mermaid-uml.yaml or .yml in the working directory)")
    private Path configPath;

    @Option(names = {"-o", "--outputDir"}, description = "Output directory (overrides config, default: current directory)")
    private Path outputDir;

    @Option(names = "--disableClasses", description = "Leave classes out of the diagram")
    private boolean disableClasses;

    @Option(names = "--disableInterfaces", description = "Leave interfaces out of the diagram")
    private boolean disableInterfaces;

    @Option(names = "--disableEnums", description = "Leave enums out of the diagram")
    private boolean disableEnums;

    @Option(names = "--enableNestedInheritance", description = "Draw inheritance to every ancestor, not only the direct base")
    private boolean enableNestedInheritance;

    @Option(names = "--enableNamespaces", description = "Group classes into namespace blocks")
    private boolean enableNamespaces;

    @Option(names = "--title", description = "Diagram title (default: first type name)")
    private String title;

    @Option(names = "--stdout", description = "Print the diagram instead of writing a file")
    private boolean stdout;

    @Override
    public Integer call() {
        try {
            ProjectConfig config = configPath != null
                ? ConfigLoader.load(configPath)
                : ConfigLoader.discover(Paths.get(""));
            TypeSnapshot snapshot = SnapshotReader.read(snapshotPath);

            String projectName = config.project().name() != null ? config.project().name() : snapshot.project();
            DiagramOptions options = mergeOptions(config.diagram().toOptions());
            log.debug("Effective diagram options: {}", options);

            ClassDiagramPipeline pipeline = new ClassDiagramPipeline(
                discoverGenerator(GENERATOR_ID), config.diagram().systemNamespacePrefixes());

            if (!stdout) {
                System.out.println("Generating Mermaid UML for project: " + projectName);
            }
            ClassDiagramResult result = pipeline.run(snapshot, projectName, options, title);
            reportCollisions(result.collisions());

            List<DiagramFile> files = List.of(new DiagramFile(result.fileName(), result.diagram().content()));

            if (stdout) {
                render(discoverRenderer(CONSOLE_RENDERER_ID), files, RenderTarget.rawConsole());
            } else {
                Path targetDir = resolveOutputDirectory(config);
                render(discoverRenderer(FILE_RENDERER_ID), files, RenderTarget.directory(targetDir));
                System.out.println("✓ " + result.diagram().entityCount() + " types drawn");
                System.out.println("UML diagram saved to: " + targetDir.resolve(result.fileName()));
            }
            return 0;

        } catch (SnapshotReadException e) {
            log.error("Could not read snapshot", e);
            System.err.println("✗ " + e.getMessage());
            return 1;
        } catch (IllegalStateException e) {
            log.error("Generation failed", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Combines command line switches with the configured ones.
     *
     * @param configured switches from the configuration file
     * @return effective options
     */
    DiagramOptions mergeOptions(DiagramOptions configured) {
        return new DiagramOptions(
            disableClasses || configured.excludeClasses(),
            disableInterfaces || configured.excludeInterfaces(),
            disableEnums || configured.excludeEnums(),
            enableNestedInheritance || configured.nestedInheritance(),
            enableNamespaces || configured.groupByNamespace()
        );
    }

    private Path resolveOutputDirectory(ProjectConfig config) {
        if (outputDir != null) {
            return outputDir;
        }
        if (config.output().directory() != null) {
            return Paths.get(config.output().directory());
        }
        return Paths.get("").toAbsolutePath();
    }

    static DiagramGenerator discoverGenerator(String id) {
        log.debug("Discovering diagram generators via ServiceLoader");
        List<DiagramGenerator> generators = new ArrayList<>();
        ServiceLoader.load(DiagramGenerator.class).forEach(generators::add);

        return generators.stream()
            .filter(generator -> id.equals(generator.getId()))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Diagram generator not found: " + id));
    }

    static OutputRenderer discoverRenderer(String id) {
        log.debug("Discovering output renderers via ServiceLoader");
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);

        return renderers.stream()
            .filter(renderer -> id.equals(renderer.getId()))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Output renderer not found: " + id));
    }

    private void render(OutputRenderer renderer, List<DiagramFile> files, RenderTarget target) {
        log.debug("Rendering with {}", renderer.getId());
        renderer.render(files, target);
    }

    private void reportCollisions(List<NameCollision> collisions) {
        for (NameCollision collision : collisions) {
            System.err.println("⚠ Type '" + collision.name() + "' is declared in " + collision.namespaces().size()
                + " namespaces and is drawn as a single node");
        }
    }
}
