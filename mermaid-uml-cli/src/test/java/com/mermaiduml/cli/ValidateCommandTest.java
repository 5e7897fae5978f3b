package com.mermaiduml.cli;

import com.mermaiduml.MermaidUmlCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void validate_fixture_reportsCountsAndSkippedDeclarations() {
        int exitCode = MermaidUmlCLI.createCommandLine()
            .execute("validate", "src/test/resources/snapshots/zoo.yaml");

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("Project: Zoo")
            .contains("2 source units, 4 types, 1 enums")
            .contains("2 classes, 1 interfaces, 1 enums, 4 relationships")
            .contains("1 declarations skipped");
    }

    @Test
    void validate_collidingNames_reportsThem() throws IOException {
        Path snapshot = tempDir.resolve("shop.json");
        Files.writeString(snapshot, """
            {
              "project": "Shop",
              "units": [
                { "path": "a.cs", "types": [ { "name": "Item", "namespace": "Shop.Catalog" } ] },
                { "path": "b.cs", "types": [ { "name": "Item", "namespace": "Shop.Kitchen" } ] }
              ]
            }
            """);

        int exitCode = MermaidUmlCLI.createCommandLine().execute("validate", snapshot.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("Type 'Item' is declared in namespaces [Shop.Catalog, Shop.Kitchen]");
    }

    @Test
    void validate_missingSnapshot_returnsErrorCode() {
        int exitCode = MermaidUmlCLI.createCommandLine()
            .execute("validate", tempDir.resolve("missing.yaml").toString());

        assertThat(exitCode).isEqualTo(1);
    }
}
