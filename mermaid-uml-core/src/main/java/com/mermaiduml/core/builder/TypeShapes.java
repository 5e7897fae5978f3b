package com.mermaiduml.core.builder;

import com.mermaiduml.core.source.TypeReference;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shape queries on type references: collection detection, display names and
 * the representative target type of a member.
 */
public final class TypeShapes {

    /** Simple names that mark a type, or any interface it implements, as a collection. */
    public static final Set<String> COLLECTION_TYPE_NAMES = Set.of("IEnumerable", "ICollection", "List");

    private static final String STRING_TYPE_NAME = "string";

    private TypeShapes() {
    }

    /**
     * Returns whether a type is a collection shape.
     *
     * <p>Strings implement the enumerable interfaces but are never collections.
     * Arrays are not covered here; see {@link #isCollectionShape(TypeReference)}.
     *
     * @param type type reference
     * @return true for collection shapes
     */
    public static boolean isCollection(TypeReference type) {
        if (STRING_TYPE_NAME.equalsIgnoreCase(type.name())) {
            return false;
        }
        return COLLECTION_TYPE_NAMES.contains(type.name())
            || type.interfaces().stream().anyMatch(COLLECTION_TYPE_NAMES::contains);
    }

    /**
     * Returns whether a declared member type holds many elements: an array or a collection.
     *
     * @param type declared member type
     * @return true for arrays and collection shapes
     */
    public static boolean isCollectionShape(TypeReference type) {
        return type.isArray() || isCollection(type);
    }

    /**
     * Returns the string shown for a property type.
     *
     * @param type type reference
     * @return {@code Elem[]} for arrays, {@code Name<A, B>} for generics, the simple name otherwise
     */
    public static String displayName(TypeReference type) {
        if (type.isArray()) {
            return type.elementType().name() + "[]";
        }
        if (type.isGeneric()) {
            String args = type.typeArguments().stream()
                .map(TypeReference::name)
                .collect(Collectors.joining(", "));
            return type.name() + "<" + args + ">";
        }
        return type.name();
    }

    /**
     * Collapses a member type to the type an edge should point at.
     *
     * <p>Arrays collapse to their element type; a generic with exactly one type
     * argument then collapses to that argument. {@code Toy[]} and {@code List<Toy>}
     * both resolve to {@code Toy}; {@code Dictionary<K, V>} stays as is.
     *
     * @param type declared member type
     * @return representative target type
     */
    public static TypeReference resolveTarget(TypeReference type) {
        TypeReference target = type;
        if (target.isArray()) {
            target = target.elementType();
        }
        if (target.typeArguments().size() == 1) {
            target = target.typeArguments().get(0);
        }
        return target;
    }
}
