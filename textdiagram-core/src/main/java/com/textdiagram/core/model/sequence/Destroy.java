package com.textdiagram.core.model.sequence;

import java.util.Objects;

/**
 * {@code destroy ID}: ends the participant's lifeline.
 *
 * @param id participant id
 */
public record Destroy(String id) implements Statement {

    public Destroy {
        Objects.requireNonNull(id, "id must not be null");
    }
}
