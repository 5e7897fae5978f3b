package com.mermaiduml.core.pipeline;

import com.mermaiduml.core.config.DiagramOptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OutputFileNames}.
 */
class OutputFileNamesTest {

    @Test
    void forProject_defaults_isProjectNameOnly() {
        assertThat(OutputFileNames.forProject("Zoo", DiagramOptions.defaults(), "md")).isEqualTo("Zoo.md");
    }

    @Test
    void forProject_allSwitches_appendsSuffixesInFixedOrder() {
        DiagramOptions options = new DiagramOptions(true, true, true, true, true);

        assertThat(OutputFileNames.forProject("Zoo", options, "md"))
            .isEqualTo("Zoo_NoClasses_NoInterfaces_NoEnums_NestedInheritance_WithNamespaces.md");
    }

    @Test
    void forProject_someSwitches_appendsOnlyActiveSuffixes() {
        DiagramOptions options = new DiagramOptions(false, true, false, false, true);

        assertThat(OutputFileNames.forProject("Zoo", options, "md")).isEqualTo("Zoo_NoInterfaces_WithNamespaces.md");
    }
}
