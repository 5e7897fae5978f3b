package com.mermaiduml.core.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Snapshot of the declared types of one analyzed project.
 *
 * <p>This is the single contract between the analysis front end and the diagram
 * pipeline. Units are processed in order, which fixes the order of entities in
 * the generated diagram.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project: Zoo
 * units:
 *   - path: src/Dog.cs
 *     types:
 *       - name: Dog
 *         kind: class
 *         accessibility: public
 *         namespace: Zoo.Animals
 *         baseType: { name: Animal, namespace: Zoo.Animals, kind: class }
 *     enums:
 *       - name: Status
 *         members: [ Active, Retired ]
 * }</pre>
 *
 * @param project project name, used for the diagram file name
 * @param units source units in first-seen order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TypeSnapshot(
    @JsonProperty("project") String project,
    @JsonProperty("units") List<SourceUnit> units
) {
    public TypeSnapshot {
        if (project == null || project.isBlank()) {
            project = "project";
        }
        units = units == null ? List.of() : List.copyOf(units);
    }

    /**
     * Returns the number of class and interface declarations across all units.
     *
     * @return declared type count
     */
    public int typeCount() {
        return units.stream().mapToInt(u -> u.types().size()).sum();
    }

    /**
     * Returns the number of enum declarations across all units.
     *
     * @return declared enum count
     */
    public int enumCount() {
        return units.stream().mapToInt(u -> u.enums().size()).sum();
    }
}
