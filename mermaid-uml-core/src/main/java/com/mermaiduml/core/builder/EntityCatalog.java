package com.mermaiduml.core.builder;

import com.mermaiduml.core.model.DiagramEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only collection of entities in first-seen order across all source units.
 *
 * <p>Once {@link #seal()} has been called the catalog rejects further appends.
 */
public class EntityCatalog {

    private final List<DiagramEntity> entities = new ArrayList<>();
    private boolean sealed;

    /**
     * Appends an entity.
     *
     * @param entity entity to append
     * @throws IllegalStateException if the catalog has been sealed
     */
    public void append(DiagramEntity entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        if (sealed) {
            throw new IllegalStateException("Entity catalog is sealed");
        }
        entities.add(entity);
    }

    public int size() {
        return entities.size();
    }

    /**
     * Seals the catalog and returns its contents.
     *
     * @return immutable entity list in append order
     */
    public List<DiagramEntity> seal() {
        sealed = true;
        return List.copyOf(entities);
    }
}
