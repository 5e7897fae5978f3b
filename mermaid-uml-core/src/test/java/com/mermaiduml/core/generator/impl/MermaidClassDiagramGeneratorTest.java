package com.mermaiduml.core.generator.impl;

import com.mermaiduml.core.generator.GeneratedDiagram;
import com.mermaiduml.core.generator.GeneratorConfig;
import com.mermaiduml.core.model.ClassDiagramModel;
import com.mermaiduml.core.model.DiagramEntity;
import com.mermaiduml.core.model.DiagramMember;
import com.mermaiduml.core.model.DiagramMethod;
import com.mermaiduml.core.model.DiagramRelationship;
import com.mermaiduml.core.model.EntityKind;
import com.mermaiduml.core.model.LinkStyle;
import com.mermaiduml.core.model.RelationshipKind;
import com.mermaiduml.core.model.Visibility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MermaidClassDiagramGenerator}.
 */
class MermaidClassDiagramGeneratorTest {

    private MermaidClassDiagramGenerator generator;

    private final DiagramEntity animal = new DiagramEntity("Animal", EntityKind.CLASS, true, Visibility.PUBLIC,
        "Zoo.Animals",
        List.of(new DiagramMember("Name", "String", Visibility.PUBLIC, false)),
        List.of(new DiagramMethod("Eat", "Void", Visibility.PROTECTED, List.of("Food food"), false)),
        null);

    private final DiagramEntity dog = new DiagramEntity("Dog", EntityKind.CLASS, false, Visibility.PUBLIC,
        "Zoo.Animals", null,
        List.of(new DiagramMethod("FetchAsync", "Task", Visibility.PUBLIC, List.of(), true)),
        List.of(
            new DiagramRelationship("Dog", "Animal", RelationshipKind.INHERITANCE, LinkStyle.SOLID),
            new DiagramRelationship("Toy", "Dog", RelationshipKind.AGGREGATION, LinkStyle.SOLID)));

    private final DiagramEntity status = new DiagramEntity("Status", EntityKind.ENUM, false, Visibility.PUBLIC,
        null, List.of(new DiagramMember("Active", "enum", Visibility.PUBLIC, false)), null, null);

    @BeforeEach
    void setUp() {
        generator = new MermaidClassDiagramGenerator();
    }

    @Test
    void identification_matchesRegisteredGenerator() {
        assertThat(generator.getId()).isEqualTo("mermaid-class");
        assertThat(generator.getDisplayName()).isEqualTo("Mermaid Class Diagram Generator");
        assertThat(generator.getFileExtension()).isEqualTo("md");
    }

    @Test
    void generate_flatLayout_producesExactDocument() {
        ClassDiagramModel model = new ClassDiagramModel("Zoo", List.of(animal, dog, status));

        GeneratedDiagram diagram = generator.generate(model, GeneratorConfig.defaults());

        assertThat(diagram.title()).isEqualTo("Animal");
        assertThat(diagram.fileExtension()).isEqualTo("md");
        assertThat(diagram.entityCount()).isEqualTo(3);
        assertThat(diagram.content()).isEqualTo("""
            ```mermaid
            ---
            title: Animal
            config:
              class:
                hideEmptyMembersBox: true
            ---
            classDiagram
                class Animal {
                    + String Name
                    # Void Eat(Food food)
                }
                <<abstract>> Animal
                class Dog {
                    + async Task FetchAsync()
                }
                <<Class>> Dog
                Dog --|> Animal : inherits
                Toy --o Dog : aggregates
                class Status {
                    + enum Active
                }
                <<Enum>> Status
            ```
            """);
    }

    @Test
    void generate_groupedLayout_emitsBodiesThenStereotypesThenRelationships() {
        ClassDiagramModel model = new ClassDiagramModel("Zoo", List.of(animal, dog, status));

        GeneratedDiagram diagram = generator.generate(model, new GeneratorConfig(true, null));

        assertThat(diagram.content()).isEqualTo("""
            ```mermaid
            ---
            title: Animal
            config:
              class:
                hideEmptyMembersBox: true
            ---
            classDiagram
                class Status {
                    + enum Active
                }
                namespace Zoo-Animals {
                    class Animal {
                        + String Name
                        # Void Eat(Food food)
                    }
                    class Dog {
                        + async Task FetchAsync()
                    }
                }

                <<abstract>> Animal
                <<Class>> Dog
                <<Enum>> Status

                Dog --|> Animal : inherits
                Toy --o Dog : aggregates
            ```
            """);
    }

    @Test
    void generate_groupedLayout_sortsNamespaceKeys() {
        DiagramEntity keeper = new DiagramEntity("Keeper", EntityKind.CLASS, false, Visibility.PUBLIC,
            "Zoo.Staff", null, null, null);
        DiagramEntity ticket = new DiagramEntity("Ticket", EntityKind.CLASS, false, Visibility.PUBLIC,
            "Admissions", null, null, null);
        ClassDiagramModel model = new ClassDiagramModel("Zoo", List.of(keeper, dog, ticket));

        String content = generator.generate(model, new GeneratorConfig(true, null)).content();

        int admissions = content.indexOf("namespace Admissions {");
        int animals = content.indexOf("namespace Zoo-Animals {");
        int staff = content.indexOf("namespace Zoo-Staff {");
        assertThat(admissions).isPositive().isLessThan(animals);
        assertThat(animals).isLessThan(staff);
    }

    @Test
    void generate_withExplicitTitle_usesIt() {
        ClassDiagramModel model = new ClassDiagramModel("Zoo", List.of(animal));

        GeneratedDiagram diagram = generator.generate(model, new GeneratorConfig(false, "Zoo Model"));

        assertThat(diagram.title()).isEqualTo("Zoo Model");
        assertThat(diagram.content()).contains("title: Zoo Model\n");
    }

    @Test
    void generate_emptyModel_usesDefaultTitleAndEmptyBody() {
        GeneratedDiagram diagram = generator.generate(new ClassDiagramModel("Zoo", List.of()), GeneratorConfig.defaults());

        assertThat(diagram.title()).isEqualTo("UML Diagram");
        assertThat(diagram.content()).endsWith("classDiagram\n```\n");
    }

    @Test
    void generate_danglingEdge_isStillEmitted() {
        DiagramEntity owner = new DiagramEntity("Owner", EntityKind.CLASS, false, Visibility.PUBLIC, null, null, null,
            List.of(new DiagramRelationship("Owner", "Status", RelationshipKind.DEPENDENCY, LinkStyle.SOLID)));

        String content = generator.generate(new ClassDiagramModel("Zoo", List.of(owner)), GeneratorConfig.defaults())
            .content();

        assertThat(content).contains("    Owner ..> Status : depends on\n");
        assertThat(content).doesNotContain("class Status");
    }

    @Test
    void generate_interfaceInBothLayouts_hasInterfaceStereotype() {
        DiagramEntity pet = new DiagramEntity("IPet", EntityKind.INTERFACE, true, Visibility.PUBLIC, null,
            null, null, null);
        ClassDiagramModel model = new ClassDiagramModel("Zoo", List.of(pet));

        assertThat(generator.generate(model, GeneratorConfig.defaults()).content()).contains("    <<Interface>> IPet\n");
        assertThat(generator.generate(model, new GeneratorConfig(true, null)).content())
            .contains("    <<Interface>> IPet\n");
    }

    @Test
    void generate_isDeterministic() {
        ClassDiagramModel model = new ClassDiagramModel("Zoo", List.of(animal, dog, status));
        GeneratorConfig config = new GeneratorConfig(true, null);

        assertThat(generator.generate(model, config).content())
            .isEqualTo(new MermaidClassDiagramGenerator().generate(model, config).content());
    }

    @Test
    void generate_withNullModel_throwsException() {
        assertThatThrownBy(() -> generator.generate(null, GeneratorConfig.defaults()))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("model must not be null");
    }
}
