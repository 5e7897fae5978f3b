package com.mermaiduml.core.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A declared enum and its member identifiers.
 *
 * @param name enum name
 * @param namespace containing namespace, or null
 * @param members member identifiers in declaration order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnumDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("namespace") String namespace,
    @JsonProperty("members") List<String> members
) {
    public EnumDescriptor {
        members = members == null ? List.of() : List.copyOf(members);
    }
}
