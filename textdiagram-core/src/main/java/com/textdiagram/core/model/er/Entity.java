package com.textdiagram.core.model.er;

import java.util.List;
import java.util.Objects;

/**
 * ER entity.
 *
 * @param name entity name
 * @param attributes attribute lines, possibly empty
 */
public record Entity(String name, List<EntityAttribute> attributes) {

    public Entity {
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }
}
