package com.mermaiduml.core.builder;

import com.mermaiduml.core.model.DiagramEntity;
import com.mermaiduml.core.model.DiagramMember;
import com.mermaiduml.core.model.DiagramMethod;
import com.mermaiduml.core.model.EntityKind;
import com.mermaiduml.core.model.Visibility;
import com.mermaiduml.core.source.EnumDescriptor;
import com.mermaiduml.core.source.MethodDescriptor;
import com.mermaiduml.core.source.ParameterDescriptor;
import com.mermaiduml.core.source.PropertyDescriptor;
import com.mermaiduml.core.source.TypeDescriptor;
import com.mermaiduml.core.source.TypeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Converts declared types and enums into {@link DiagramEntity} values without relationships.
 *
 * <p>Relationships are added afterwards by {@link RelationshipInferencer}.
 */
public class TypeModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(TypeModelBuilder.class);

    /** Declared type shown for enum members. */
    public static final String ENUM_MEMBER_TYPE = "enum";

    /**
     * Builds the entity for a declared class or interface.
     *
     * @param type type descriptor
     * @return the entity, or empty when the descriptor has no resolvable symbol or is an enum
     */
    public Optional<DiagramEntity> build(TypeDescriptor type) {
        if (!type.isResolved()) {
            log.debug("Skipping declaration without resolvable symbol");
            return Optional.empty();
        }
        if (type.kind() == TypeKind.ENUM) {
            log.warn("Skipping enum '{}' declared as a type; enums belong in the enums section", type.name());
            return Optional.empty();
        }

        EntityKind kind = type.isInterface() ? EntityKind.INTERFACE : EntityKind.CLASS;
        List<DiagramMember> properties = type.properties().stream()
            .map(this::toMember)
            .toList();
        List<DiagramMethod> methods = type.methods().stream()
            .map(this::toMethod)
            .toList();

        return Optional.of(new DiagramEntity(
            type.name(),
            kind,
            type.isAbstract(),
            VisibilityMapper.toVisibility(type.accessibility()),
            type.namespace(),
            properties,
            methods,
            List.of()
        ));
    }

    /**
     * Builds the entity for a declared enum. Members become public properties of type {@code enum}.
     *
     * @param enumeration enum descriptor
     * @return the entity, or empty when the enum has no name
     */
    public Optional<DiagramEntity> build(EnumDescriptor enumeration) {
        if (enumeration.name() == null || enumeration.name().isBlank()) {
            log.debug("Skipping enum declaration without a name");
            return Optional.empty();
        }

        List<DiagramMember> members = enumeration.members().stream()
            .map(member -> new DiagramMember(member, ENUM_MEMBER_TYPE, Visibility.PUBLIC, false))
            .toList();

        return Optional.of(new DiagramEntity(
            enumeration.name(),
            EntityKind.ENUM,
            false,
            Visibility.PUBLIC,
            enumeration.namespace(),
            members,
            List.of(),
            List.of()
        ));
    }

    private DiagramMember toMember(PropertyDescriptor property) {
        return new DiagramMember(
            property.name(),
            TypeShapes.displayName(property.type()),
            VisibilityMapper.toVisibility(property.accessibility()),
            TypeShapes.isCollectionShape(property.type())
        );
    }

    private DiagramMethod toMethod(MethodDescriptor method) {
        List<String> parameters = method.parameters().stream()
            .map(TypeModelBuilder::formatParameter)
            .toList();
        return new DiagramMethod(
            method.name(),
            method.returnType().name(),
            VisibilityMapper.toVisibility(method.accessibility()),
            parameters,
            method.async()
        );
    }

    private static String formatParameter(ParameterDescriptor parameter) {
        return parameter.type().name() + " " + parameter.name();
    }
}
