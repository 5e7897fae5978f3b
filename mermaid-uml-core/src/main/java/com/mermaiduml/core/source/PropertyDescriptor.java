package com.mermaiduml.core.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A declared property of a type.
 *
 * @param name property name
 * @param type declared property type
 * @param accessibility declared accessibility
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PropertyDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("type") TypeReference type,
    @JsonProperty("accessibility") Accessibility accessibility
) {
    public PropertyDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (accessibility == null) {
            accessibility = Accessibility.NOT_APPLICABLE;
        }
    }
}
