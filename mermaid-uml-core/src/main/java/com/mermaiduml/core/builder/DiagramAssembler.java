package com.mermaiduml.core.builder;

import com.mermaiduml.core.config.DiagramOptions;
import com.mermaiduml.core.model.DiagramEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Applies the class, interface and enum exclusion switches to the built entities.
 */
public class DiagramAssembler {

    private static final Logger log = LoggerFactory.getLogger(DiagramAssembler.class);

    /**
     * Filters entities by kind, preserving their order.
     *
     * <p>Relationships that point at removed entities are left in place.
     *
     * @param entities built entities in first-seen order
     * @param options exclusion switches
     * @return retained entities in original order
     */
    public List<DiagramEntity> assemble(List<DiagramEntity> entities, DiagramOptions options) {
        Objects.requireNonNull(entities, "entities must not be null");
        Objects.requireNonNull(options, "options must not be null");

        List<DiagramEntity> retained = entities.stream()
            .filter(entity -> !options.excludes(entity.kind()))
            .toList();

        if (retained.size() != entities.size()) {
            log.debug("Excluded {} of {} entities by kind", entities.size() - retained.size(), entities.size());
        }
        return retained;
    }
}
