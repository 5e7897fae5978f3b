package com.mermaiduml;

import com.mermaiduml.cli.GenerateCommand;
import com.mermaiduml.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for Mermaid UML.
 *
 * <p>Mermaid UML turns a type snapshot of a codebase into a Mermaid class diagram.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate a class diagram from a snapshot</li>
 *   <li>{@code validate} - Check a snapshot and report what would be drawn</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Flat diagram next to the snapshot
 * mermaiduml generate types.json
 *
 * # Grouped by namespace, without enums
 * mermaiduml -v generate types.yaml --enableNamespaces --disableEnums --outputDir docs/uml
 * }</pre>
 */
@Command(
    name = "mermaiduml",
    mixinStandardHelpOptions = true,
    version = "Mermaid UML 1.0.0-SNAPSHOT",
    description = "Generates Mermaid class diagrams from type snapshots",
    subcommands = {
        GenerateCommand.class,
        ValidateCommand.class
    }
)
public class MermaidUmlCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MermaidUmlCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("Mermaid UML - Class Diagram Generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'mermaiduml --help' to see available commands");
        System.out.println("Use 'mermaiduml <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        MermaidUmlCLI cli = new MermaidUmlCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
