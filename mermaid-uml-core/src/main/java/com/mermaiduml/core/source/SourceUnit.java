package com.mermaiduml.core.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Declarations found in one source file, in declaration order.
 *
 * @param path source file path, informational only
 * @param types declared classes and interfaces
 * @param enums declared enums
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceUnit(
    @JsonProperty("path") String path,
    @JsonProperty("types") List<TypeDescriptor> types,
    @JsonProperty("enums") List<EnumDescriptor> enums
) {
    public SourceUnit {
        types = types == null ? List.of() : List.copyOf(types);
        enums = enums == null ? List.of() : List.copyOf(enums);
    }
}
