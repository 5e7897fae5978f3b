package com.mermaiduml.core.builder;

import com.mermaiduml.core.model.DiagramEntity;
import com.mermaiduml.core.model.DiagramRelationship;
import com.mermaiduml.core.model.LinkStyle;
import com.mermaiduml.core.model.RelationshipKind;
import com.mermaiduml.core.source.TypeDescriptor;
import com.mermaiduml.core.source.TypeReference;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mermaiduml.core.testutil.TestTypes.classRef;
import static com.mermaiduml.core.testutil.TestTypes.declare;
import static com.mermaiduml.core.testutil.TestTypes.dictionaryOf;
import static com.mermaiduml.core.testutil.TestTypes.enumRef;
import static com.mermaiduml.core.testutil.TestTypes.interfaceRef;
import static com.mermaiduml.core.testutil.TestTypes.listOf;
import static com.mermaiduml.core.testutil.TestTypes.stringRef;
import static com.mermaiduml.core.testutil.TestTypes.systemRef;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RelationshipInferencer}.
 */
class RelationshipInferencerTest {

    private static final String ZOO = "Zoo.Animals";
    private static final TypeReference ANIMAL = classRef("Animal", ZOO);
    private static final TypeReference LIVING_THING = classRef("LivingThing", ZOO);
    private static final TypeReference OBJECT = classRef("Object", "System");
    private static final TypeReference TOY = classRef("Toy", "Zoo.Items");

    private final TypeModelBuilder modelBuilder = new TypeModelBuilder();
    private final RelationshipInferencer direct = new RelationshipInferencer(false, List.of("System"));
    private final RelationshipInferencer nested = new RelationshipInferencer(true, List.of("System"));

    private List<DiagramRelationship> infer(RelationshipInferencer inferencer, TypeDescriptor type) {
        DiagramEntity entity = modelBuilder.build(type).orElseThrow();
        return inferencer.infer(entity, type);
    }

    @Test
    void infer_directInheritance_pointsAtBaseTypeOnly() {
        TypeDescriptor dog = declare("Dog")
            .inNamespace(ZOO)
            .extending(ANIMAL)
            .withAncestors(ANIMAL, LIVING_THING, OBJECT)
            .build();

        assertThat(infer(direct, dog)).containsExactly(
            new DiagramRelationship("Dog", "Animal", RelationshipKind.INHERITANCE, LinkStyle.SOLID));
    }

    @Test
    void infer_nestedInheritance_pointsAtEveryAncestorExceptObject() {
        TypeDescriptor dog = declare("Dog")
            .inNamespace(ZOO)
            .extending(ANIMAL)
            .withAncestors(ANIMAL, LIVING_THING, OBJECT)
            .build();

        assertThat(infer(nested, dog)).containsExactly(
            new DiagramRelationship("Dog", "Animal", RelationshipKind.INHERITANCE, LinkStyle.SOLID),
            new DiagramRelationship("Dog", "LivingThing", RelationshipKind.INHERITANCE, LinkStyle.SOLID));
    }

    @Test
    void infer_baseTypeObject_producesNoInheritance() {
        TypeDescriptor animal = declare("Animal").extending(OBJECT).withAncestors(OBJECT).build();

        assertThat(infer(direct, animal)).isEmpty();
        assertThat(infer(nested, animal)).isEmpty();
    }

    @Test
    void infer_rootObjectCheckIgnoresCase() {
        TypeDescriptor animal = declare("Animal").extending(classRef("object", "System")).build();

        assertThat(infer(direct, animal)).isEmpty();
    }

    @Test
    void infer_implementedInterface_producesDashedRealization() {
        TypeDescriptor dog = declare("Dog").implementing(interfaceRef("IPet", ZOO)).build();

        assertThat(infer(direct, dog)).containsExactly(
            new DiagramRelationship("Dog", "IPet", RelationshipKind.REALIZATION, LinkStyle.DASHED));
    }

    @Test
    void infer_interfaceExtendingInterface_producesDashedInheritance() {
        TypeDescriptor pet = declare("IPet").asInterface().implementing(interfaceRef("IAnimal", ZOO)).build();

        assertThat(infer(direct, pet)).containsExactly(
            new DiagramRelationship("IPet", "IAnimal", RelationshipKind.INHERITANCE, LinkStyle.DASHED));
    }

    @Test
    void infer_collectionProperty_producesReversedAggregationOnly() {
        TypeDescriptor dog = declare("Dog").property("Toys", listOf(TOY)).build();

        assertThat(infer(direct, dog)).containsExactly(
            new DiagramRelationship("Toy", "Dog", RelationshipKind.AGGREGATION, LinkStyle.SOLID));
    }

    @Test
    void infer_arrayProperty_producesReversedAggregationFromElementType() {
        TypeDescriptor dog = declare("Dog").property("Bones", TypeReference.arrayOf(TOY)).build();

        assertThat(infer(direct, dog)).containsExactly(
            new DiagramRelationship("Toy", "Dog", RelationshipKind.AGGREGATION, LinkStyle.SOLID));
    }

    @Test
    void infer_enumProperty_producesDependency() {
        TypeDescriptor owner = declare("Owner").property("State", enumRef("Status", "Zoo")).build();

        assertThat(infer(direct, owner)).containsExactly(
            new DiagramRelationship("Owner", "Status", RelationshipKind.DEPENDENCY, LinkStyle.SOLID));
    }

    @Test
    void infer_listOfEnums_producesDependencyRatherThanAggregation() {
        TypeDescriptor owner = declare("Owner").property("History", listOf(enumRef("Status", "Zoo"))).build();

        assertThat(infer(direct, owner)).containsExactly(
            new DiagramRelationship("Owner", "Status", RelationshipKind.DEPENDENCY, LinkStyle.SOLID));
    }

    @Test
    void infer_plainProperty_producesAssociation() {
        TypeDescriptor dog = declare("Dog").property("Favorite", TOY).build();

        assertThat(infer(direct, dog)).containsExactly(
            new DiagramRelationship("Dog", "Toy", RelationshipKind.ASSOCIATION, LinkStyle.SOLID));
    }

    @Test
    void infer_systemTypedProperties_produceNoEdges() {
        TypeDescriptor dog = declare("Dog")
            .property("Name", stringRef())
            .property("Born", systemRef("DateTime"))
            .property("Tags", listOf(stringRef()))
            .build();

        assertThat(infer(direct, dog)).isEmpty();
    }

    @Test
    void infer_unresolvedPropertyType_producesAssociation() {
        TypeDescriptor dog = declare("Dog").property("Mystery", TypeReference.of("Unknown", null, null)).build();

        assertThat(infer(direct, dog)).containsExactly(
            new DiagramRelationship("Dog", "Unknown", RelationshipKind.ASSOCIATION, LinkStyle.SOLID));
    }

    @Test
    void infer_multiArgumentGeneric_targetsTheGenericItself() {
        TypeReference pair = classRef("Pair", "Zoo.Util").withTypeArguments(List.of(TOY, ANIMAL));
        TypeDescriptor dog = declare("Dog").property("Match", pair).build();

        assertThat(infer(direct, dog)).containsExactly(
            new DiagramRelationship("Dog", "Pair", RelationshipKind.ASSOCIATION, LinkStyle.SOLID));
    }

    @Test
    void infer_dictionaryProperty_isSkippedAsSystemType() {
        TypeDescriptor dog = declare("Dog").property("Lookup", dictionaryOf(systemRef("String"), TOY)).build();

        assertThat(infer(direct, dog)).isEmpty();
    }

    @Test
    void infer_customNamespacePrefixes_areHonored() {
        RelationshipInferencer custom = new RelationshipInferencer(false, List.of("System", "Zoo.Items"));
        TypeDescriptor dog = declare("Dog").property("Favorite", TOY).build();

        assertThat(infer(custom, dog)).isEmpty();
    }

    @Test
    void infer_duplicateEdges_areCollapsed() {
        TypeDescriptor dog = declare("Dog")
            .property("Favorite", TOY)
            .property("Spare", TOY)
            .property("Toys", listOf(TOY))
            .property("MoreToys", listOf(TOY))
            .build();

        assertThat(infer(direct, dog)).containsExactly(
            new DiagramRelationship("Dog", "Toy", RelationshipKind.ASSOCIATION, LinkStyle.SOLID),
            new DiagramRelationship("Toy", "Dog", RelationshipKind.AGGREGATION, LinkStyle.SOLID));
    }

    @Test
    void infer_keepsInheritanceThenInterfacesThenMembers() {
        TypeDescriptor dog = declare("Dog")
            .extending(ANIMAL)
            .implementing(interfaceRef("IPet", ZOO))
            .property("Favorite", TOY)
            .build();

        assertThat(infer(direct, dog))
            .extracting(DiagramRelationship::kind)
            .containsExactly(RelationshipKind.INHERITANCE, RelationshipKind.REALIZATION, RelationshipKind.ASSOCIATION);
    }

    @Test
    void infer_returnsFrozenList() {
        List<DiagramRelationship> edges = infer(direct, declare("Dog").extending(ANIMAL).build());

        assertThatThrownBy(() -> edges.add(
            new DiagramRelationship("Dog", "Cat", RelationshipKind.LINK, LinkStyle.SOLID)))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void classify_ordersEnumBeforeCollectionCheck() {
        TypeReference status = enumRef("Status", "Zoo");

        assertThat(RelationshipInferencer.classify(listOf(status), status)).isEqualTo(RelationshipKind.DEPENDENCY);
        assertThat(RelationshipInferencer.classify(listOf(TOY), TOY)).isEqualTo(RelationshipKind.AGGREGATION);
        assertThat(RelationshipInferencer.classify(TOY, TOY)).isEqualTo(RelationshipKind.ASSOCIATION);
    }
}
