package com.mermaiduml.core.pipeline;

import com.mermaiduml.core.model.DiagramEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Finds simple names shared by entities from different namespaces.
 */
public final class NameCollisionDetector {

    private NameCollisionDetector() {
    }

    /**
     * Detects name collisions.
     *
     * @param entities entities in first-seen order
     * @return collisions in order of first appearance of the name
     */
    public static List<NameCollision> detect(List<DiagramEntity> entities) {
        Map<String, List<String>> namespacesByName = new LinkedHashMap<>();
        for (DiagramEntity entity : entities) {
            List<String> namespaces = namespacesByName.computeIfAbsent(entity.name(), k -> new ArrayList<>());
            if (namespaces.stream().noneMatch(ns -> Objects.equals(ns, entity.namespace()))) {
                namespaces.add(entity.namespace());
            }
        }

        List<NameCollision> collisions = new ArrayList<>();
        namespacesByName.forEach((name, namespaces) -> {
            if (namespaces.size() > 1) {
                collisions.add(new NameCollision(name, namespaces));
            }
        });
        return collisions;
    }
}
