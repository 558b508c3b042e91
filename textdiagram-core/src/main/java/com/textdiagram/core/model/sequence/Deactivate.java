package com.textdiagram.core.model.sequence;

import java.util.Objects;

/**
 * {@code deactivate ID}.
 *
 * @param id participant id
 */
public record Deactivate(String id) implements Statement {

    public Deactivate {
        Objects.requireNonNull(id, "id must not be null");
    }
}
