package com.textdiagram.core.layout.er;

import java.util.List;
import java.util.Objects;

/**
 * Computed geometry of an entity-relationship diagram.
 *
 * @param entities positioned entities
 * @param relationships routed relationship lines
 * @param width total width
 * @param height total height
 */
public record ErLayout(List<EntityLayout> entities, List<RelationshipLayout> relationships, int width, int height) {

    public ErLayout {
        entities = List.copyOf(Objects.requireNonNull(entities, "entities must not be null"));
        relationships = List.copyOf(Objects.requireNonNull(relationships, "relationships must not be null"));
    }

    /**
     * Looks up an entity by name.
     *
     * @param name entity name
     * @return the entity
     * @throws IllegalArgumentException if no entity has this name
     */
    public EntityLayout entity(String name) {
        return entities.stream()
            .filter(e -> e.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown entity: " + name));
    }
}
