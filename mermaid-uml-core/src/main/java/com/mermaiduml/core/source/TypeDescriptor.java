package com.mermaiduml.core.source;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A declared class or interface as reported by the analysis front end.
 *
 * <p>A descriptor with a blank {@code name} stands for a declaration whose symbol
 * could not be resolved. Such descriptors are skipped by the pipeline.
 *
 * @param name simple type name
 * @param kind declared kind
 * @param isAbstract whether the type is abstract
 * @param accessibility declared accessibility
 * @param namespace containing namespace, or null
 * @param baseType direct base type, or null
 * @param ancestors full ancestor chain, nearest first
 * @param interfaces directly implemented interfaces
 * @param properties declared properties
 * @param methods declared ordinary methods
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TypeDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("kind") TypeKind kind,
    @JsonProperty("abstract") boolean isAbstract,
    @JsonProperty("accessibility") Accessibility accessibility,
    @JsonProperty("namespace") String namespace,
    @JsonProperty("baseType") TypeReference baseType,
    @JsonProperty("ancestors") List<TypeReference> ancestors,
    @JsonProperty("interfaces") List<TypeReference> interfaces,
    @JsonProperty("properties") List<PropertyDescriptor> properties,
    @JsonProperty("methods") List<MethodDescriptor> methods
) {
    public TypeDescriptor {
        if (kind == null) {
            kind = TypeKind.CLASS;
        }
        if (accessibility == null) {
            accessibility = Accessibility.NOT_APPLICABLE;
        }
        ancestors = ancestors == null ? List.of() : List.copyOf(ancestors);
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
        properties = properties == null ? List.of() : List.copyOf(properties);
        methods = methods == null ? List.of() : List.copyOf(methods);
    }

    @JsonIgnore
    public boolean isResolved() {
        return name != null && !name.isBlank();
    }

    @JsonIgnore
    public boolean isInterface() {
        return kind == TypeKind.INTERFACE;
    }
}
