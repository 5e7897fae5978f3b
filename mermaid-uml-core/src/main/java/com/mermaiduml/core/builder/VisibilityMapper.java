package com.mermaiduml.core.builder;

import com.mermaiduml.core.model.Visibility;
import com.mermaiduml.core.source.Accessibility;

/**
 * Maps declared accessibility onto diagram visibility.
 */
public final class VisibilityMapper {

    private VisibilityMapper() {
    }

    /**
     * Returns the diagram visibility for a declared accessibility.
     *
     * @param accessibility declared accessibility, may be null
     * @return visibility, {@link Visibility#UNKNOWN} for anything without a diagram token
     */
    public static Visibility toVisibility(Accessibility accessibility) {
        if (accessibility == null) {
            return Visibility.UNKNOWN;
        }
        return switch (accessibility) {
            case PUBLIC -> Visibility.PUBLIC;
            case PRIVATE -> Visibility.PRIVATE;
            case PROTECTED -> Visibility.PROTECTED;
            case INTERNAL -> Visibility.INTERNAL;
            case PROTECTED_OR_INTERNAL -> Visibility.PROTECTED_OR_INTERNAL;
            case PROTECTED_AND_INTERNAL, NOT_APPLICABLE -> Visibility.UNKNOWN;
        };
    }
}
