package com.mermaiduml.core.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * An ordinary declared method (no constructors, accessors or operators).
 *
 * @param name method name
 * @param returnType declared return type
 * @param accessibility declared accessibility
 * @param parameters ordered parameters
 * @param async whether the method is declared async
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MethodDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("returnType") TypeReference returnType,
    @JsonProperty("accessibility") Accessibility accessibility,
    @JsonProperty("parameters") List<ParameterDescriptor> parameters,
    @JsonProperty("async") boolean async
) {
    public MethodDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(returnType, "returnType must not be null");
        if (accessibility == null) {
            accessibility = Accessibility.NOT_APPLICABLE;
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
