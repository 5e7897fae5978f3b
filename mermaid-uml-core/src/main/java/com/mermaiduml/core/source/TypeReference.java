package com.mermaiduml.core.source;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a type used by a property, method, base type or interface list.
 *
 * <p>An array is described by its {@code elementType}; a generic by its ordered
 * {@code typeArguments}. {@code kind} and {@code namespace} are null when the
 * front end could not resolve the symbol.
 *
 * @param name simple type name (for generics the unparameterized name, e.g. "List")
 * @param namespace containing namespace, or null
 * @param kind resolved kind, or null when unknown
 * @param elementType element type when this reference is an array, otherwise null
 * @param typeArguments ordered generic type arguments
 * @param interfaces simple names of all interfaces the type implements
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TypeReference(
    @JsonProperty("name") String name,
    @JsonProperty("namespace") String namespace,
    @JsonProperty("kind") TypeKind kind,
    @JsonProperty("elementType") TypeReference elementType,
    @JsonProperty("typeArguments") List<TypeReference> typeArguments,
    @JsonProperty("interfaces") List<String> interfaces
) {
    /**
     * Compact constructor with validation.
     */
    public TypeReference {
        Objects.requireNonNull(name, "name must not be null");
        typeArguments = typeArguments == null ? List.of() : List.copyOf(typeArguments);
        interfaces = interfaces == null ? List.of() : List.copyOf(interfaces);
    }

    /**
     * Creates a plain, non-generic reference.
     *
     * @param name simple name
     * @param namespace namespace or null
     * @param kind kind or null
     * @return type reference
     */
    public static TypeReference of(String name, String namespace, TypeKind kind) {
        return new TypeReference(name, namespace, kind, null, List.of(), List.of());
    }

    /**
     * Creates an array reference.
     *
     * @param elementType array element type
     * @return array type reference
     */
    public static TypeReference arrayOf(TypeReference elementType) {
        Objects.requireNonNull(elementType, "elementType must not be null");
        return new TypeReference(elementType.name() + "[]", null, null, elementType, List.of(), List.of());
    }

    @JsonIgnore
    public boolean isArray() {
        return elementType != null;
    }

    @JsonIgnore
    public boolean isGeneric() {
        return !typeArguments.isEmpty();
    }

    @JsonIgnore
    public boolean isEnum() {
        return kind == TypeKind.ENUM;
    }

    /**
     * Returns a copy of this reference with the given interface names.
     *
     * @param implemented simple names of implemented interfaces
     * @return new reference
     */
    public TypeReference withInterfaces(List<String> implemented) {
        return new TypeReference(name, namespace, kind, elementType, typeArguments, implemented);
    }

    /**
     * Returns a copy of this reference with the given generic arguments.
     *
     * @param arguments ordered type arguments
     * @return new reference
     */
    public TypeReference withTypeArguments(List<TypeReference> arguments) {
        return new TypeReference(name, namespace, kind, elementType, arguments, interfaces);
    }
}
