package com.mermaiduml.core.generator.impl;

import com.mermaiduml.core.model.DiagramEntity;
import com.mermaiduml.core.model.DiagramMember;
import com.mermaiduml.core.model.DiagramMethod;
import com.mermaiduml.core.model.DiagramRelationship;
import com.mermaiduml.core.model.RelationshipKind;
import com.mermaiduml.core.model.Visibility;

/**
 * Mermaid class diagram tokens and line formatting.
 *
 * <p>The lookup tables are exhaustive switches over closed enums, so a new
 * {@link RelationshipKind} or {@link Visibility} does not compile until every table handles it.
 */
final class MermaidSyntax {

    static final String NEWLINE = "\n";
    static final String INDENT = "    ";

    private MermaidSyntax() {
    }

    static String visibilityToken(Visibility visibility) {
        return switch (visibility) {
            case PUBLIC -> "+";
            case PRIVATE -> "-";
            case PROTECTED -> "#";
            case INTERNAL, PROTECTED_OR_INTERNAL -> "~";
            case UNKNOWN -> "?";
        };
    }

    static String relationToken(RelationshipKind kind) {
        return switch (kind) {
            case INHERITANCE, REALIZATION -> "|>";
            case COMPOSITION -> "*";
            case AGGREGATION -> "o";
            case ASSOCIATION, DEPENDENCY -> ">";
            case LINK -> "";
        };
    }

    static String linkToken(RelationshipKind kind) {
        return switch (kind) {
            case REALIZATION, DEPENDENCY, LINK -> "..";
            case INHERITANCE, COMPOSITION, AGGREGATION, ASSOCIATION -> "--";
        };
    }

    static String contextWord(RelationshipKind kind) {
        return switch (kind) {
            case INHERITANCE -> "inherits";
            case COMPOSITION -> "composes";
            case AGGREGATION -> "aggregates";
            case ASSOCIATION -> "associates";
            case REALIZATION -> "realizes";
            case DEPENDENCY -> "depends on";
            case LINK -> "links";
        };
    }

    static String property(DiagramMember member) {
        return visibilityToken(member.visibility()) + " " + member.type() + " " + member.name();
    }

    static String method(DiagramMethod method) {
        String asyncPrefix = method.async() ? "async " : "";
        return visibilityToken(method.visibility()) + " " + asyncPrefix + method.returnType() + " "
            + method.name() + "(" + String.join(", ", method.parameters()) + ")";
    }

    static String relationship(DiagramRelationship relationship) {
        return INDENT + relationship.from() + " " + linkToken(relationship.kind()) + relationToken(relationship.kind())
            + " " + relationship.to() + " : " + contextWord(relationship.kind());
    }

    static String stereotype(DiagramEntity entity) {
        String label = entity.isAbstractClass() ? "abstract" : entity.kind().stereotype();
        return INDENT + "<<" + label + ">> " + entity.name();
    }

    /**
     * Appends a class body block at the given indentation.
     *
     * @param sb target buffer
     * @param entity entity to render
     * @param indent indentation of the {@code class} line; members get one level more
     */
    static void appendBody(StringBuilder sb, DiagramEntity entity, String indent) {
        String memberIndent = indent + INDENT;
        sb.append(indent).append("class ").append(entity.name()).append(" {").append(NEWLINE);
        for (DiagramMember member : entity.properties()) {
            sb.append(memberIndent).append(property(member)).append(NEWLINE);
        }
        for (DiagramMethod method : entity.methods()) {
            sb.append(memberIndent).append(method(method)).append(NEWLINE);
        }
        sb.append(indent).append("}").append(NEWLINE);
    }

    static void appendStereotype(StringBuilder sb, DiagramEntity entity) {
        sb.append(stereotype(entity)).append(NEWLINE);
    }

    static void appendRelationships(StringBuilder sb, DiagramEntity entity) {
        for (DiagramRelationship relationship : entity.relationships()) {
            sb.append(relationship(relationship)).append(NEWLINE);
        }
    }
}
