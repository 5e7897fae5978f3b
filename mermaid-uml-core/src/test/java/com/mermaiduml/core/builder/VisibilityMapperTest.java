package com.mermaiduml.core.builder;

import com.mermaiduml.core.model.Visibility;
import com.mermaiduml.core.source.Accessibility;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link VisibilityMapper}.
 */
class VisibilityMapperTest {

    @ParameterizedTest
    @CsvSource({
        "PUBLIC, PUBLIC",
        "PRIVATE, PRIVATE",
        "PROTECTED, PROTECTED",
        "INTERNAL, INTERNAL",
        "PROTECTED_OR_INTERNAL, PROTECTED_OR_INTERNAL",
        "PROTECTED_AND_INTERNAL, UNKNOWN",
        "NOT_APPLICABLE, UNKNOWN"
    })
    void toVisibility_mapsEveryAccessibility(Accessibility accessibility, Visibility expected) {
        assertThat(VisibilityMapper.toVisibility(accessibility)).isEqualTo(expected);
    }

    @Test
    void toVisibility_withNull_returnsUnknown() {
        assertThat(VisibilityMapper.toVisibility(null)).isEqualTo(Visibility.UNKNOWN);
    }
}
