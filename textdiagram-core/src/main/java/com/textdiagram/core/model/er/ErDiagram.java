package com.textdiagram.core.model.er;

import java.util.List;
import java.util.Objects;

/**
 * Parsed entity-relationship diagram.
 *
 * @param entities entities, deduplicated by name, in first-reference order
 * @param relationships relationships in source order
 */
public record ErDiagram(List<Entity> entities, List<Relationship> relationships) {

    public ErDiagram {
        entities = List.copyOf(Objects.requireNonNull(entities, "entities must not be null"));
        relationships = List.copyOf(Objects.requireNonNull(relationships, "relationships must not be null"));
    }
}
