package com.mermaiduml.core.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A method parameter.
 *
 * @param name parameter name
 * @param type parameter type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParameterDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("type") TypeReference type
) {
    public ParameterDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
