package com.mermaiduml.core.builder;

import com.mermaiduml.core.model.DiagramEntity;
import com.mermaiduml.core.model.DiagramRelationship;
import com.mermaiduml.core.model.EntityKind;
import com.mermaiduml.core.model.LinkStyle;
import com.mermaiduml.core.model.RelationshipKind;
import com.mermaiduml.core.source.PropertyDescriptor;
import com.mermaiduml.core.source.TypeDescriptor;
import com.mermaiduml.core.source.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Infers the structural relationships owned by one entity.
 *
 * <p>Three independent rules feed one deduplicating {@link RelationshipSetBuilder}:
 * <ol>
 *   <li><b>Inheritance</b> to the direct base type, or to every ancestor when nested
 *       inheritance is enabled. The root object type is never a target.</li>
 *   <li><b>Realization</b> to each directly implemented interface. An interface
 *       extending another interface yields inheritance instead.</li>
 *   <li><b>Member edges</b> for each property whose resolved target type lies outside
 *       the system namespaces: dependency for enums, aggregation for array or
 *       collection-shaped properties, association otherwise.</li>
 * </ol>
 *
 * <p>Aggregation edges point from the element type to the owning type; every other edge
 * points from the owning type outwards.
 */
public class RelationshipInferencer {

    private static final Logger log = LoggerFactory.getLogger(RelationshipInferencer.class);

    /** Simple name of the universal root type. */
    public static final String ROOT_OBJECT_TYPE = "Object";

    private final boolean nestedInheritance;
    private final List<String> systemNamespacePrefixes;

    /**
     * Creates an inferencer.
     *
     * @param nestedInheritance draw inheritance edges to every ancestor
     * @param systemNamespacePrefixes namespace prefixes whose types never produce member edges
     */
    public RelationshipInferencer(boolean nestedInheritance, List<String> systemNamespacePrefixes) {
        this.nestedInheritance = nestedInheritance;
        this.systemNamespacePrefixes = List.copyOf(
            Objects.requireNonNull(systemNamespacePrefixes, "systemNamespacePrefixes must not be null"));
    }

    /**
     * Infers the relationships of an entity from its declaration.
     *
     * @param entity entity built from {@code type}
     * @param type declaration the entity was built from
     * @return frozen, duplicate-free relationship list
     */
    public List<DiagramRelationship> infer(DiagramEntity entity, TypeDescriptor type) {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(type, "type must not be null");

        RelationshipSetBuilder edges = new RelationshipSetBuilder();
        if (entity.kind() == EntityKind.ENUM) {
            return edges.freeze();
        }

        addInheritance(entity, type, edges);
        addInterfaces(entity, type, edges);
        for (PropertyDescriptor property : type.properties()) {
            addMemberEdge(entity, property, edges);
        }

        log.debug("Inferred {} relationships for {}", edges.size(), entity.name());
        return edges.freeze();
    }

    private void addInheritance(DiagramEntity entity, TypeDescriptor type, RelationshipSetBuilder edges) {
        if (nestedInheritance) {
            for (TypeReference ancestor : type.ancestors()) {
                if (!isRootObject(ancestor)) {
                    edges.add(entity.name(), ancestor.name(), RelationshipKind.INHERITANCE, LinkStyle.SOLID);
                }
            }
        } else if (type.baseType() != null && !isRootObject(type.baseType())) {
            edges.add(entity.name(), type.baseType().name(), RelationshipKind.INHERITANCE, LinkStyle.SOLID);
        }
    }

    private void addInterfaces(DiagramEntity entity, TypeDescriptor type, RelationshipSetBuilder edges) {
        RelationshipKind kind = entity.kind() == EntityKind.INTERFACE
            ? RelationshipKind.INHERITANCE
            : RelationshipKind.REALIZATION;
        for (TypeReference iface : type.interfaces()) {
            edges.add(entity.name(), iface.name(), kind, LinkStyle.DASHED);
        }
    }

    private void addMemberEdge(DiagramEntity entity, PropertyDescriptor property, RelationshipSetBuilder edges) {
        TypeReference target = TypeShapes.resolveTarget(property.type());
        if (isSystemType(target)) {
            return;
        }

        RelationshipKind kind = classify(property.type(), target);
        if (kind == RelationshipKind.AGGREGATION) {
            edges.add(target.name(), entity.name(), kind, LinkStyle.SOLID);
        } else {
            edges.add(entity.name(), target.name(), kind, LinkStyle.SOLID);
        }
    }

    /**
     * Classifies a member edge.
     *
     * @param declared declared property type
     * @param target resolved target type
     * @return dependency, aggregation or association
     */
    static RelationshipKind classify(TypeReference declared, TypeReference target) {
        if (target.isEnum()) {
            return RelationshipKind.DEPENDENCY;
        }
        return TypeShapes.isCollectionShape(declared) ? RelationshipKind.AGGREGATION : RelationshipKind.ASSOCIATION;
    }

    private boolean isSystemType(TypeReference type) {
        String namespace = type.namespace();
        return namespace != null && systemNamespacePrefixes.stream().anyMatch(namespace::startsWith);
    }

    private static boolean isRootObject(TypeReference type) {
        return ROOT_OBJECT_TYPE.equalsIgnoreCase(type.name());
    }
}
