package com.textdiagram.core.model.sequence;

import java.util.Objects;

/**
 * {@code activate ID}.
 *
 * @param id participant id
 */
public record Activate(String id) implements Statement {

    public Activate {
        Objects.requireNonNull(id, "id must not be null");
    }
}
