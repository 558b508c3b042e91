package com.textdiagram.core.model.er;

import java.util.Objects;

/**
 * Relationship between two entities.
 *
 * @param from left entity
 * @param to right entity
 * @param leftCardinality cardinality at the left entity
 * @param rightCardinality cardinality at the right entity
 * @param label relationship label
 */
public record Relationship(
    String from,
    String to,
    Cardinality leftCardinality,
    Cardinality rightCardinality,
    String label
) {

    public Relationship {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(leftCardinality, "leftCardinality must not be null");
        Objects.requireNonNull(rightCardinality, "rightCardinality must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }
}
