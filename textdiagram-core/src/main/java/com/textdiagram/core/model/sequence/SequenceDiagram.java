package com.textdiagram.core.model.sequence;

import java.util.List;
import java.util.Objects;

/**
 * Parsed sequence diagram: statements in source order, blocks nested as a tree.
 *
 * @param statements top-level statements
 */
public record SequenceDiagram(List<Statement> statements) {

    public SequenceDiagram {
        Objects.requireNonNull(statements, "statements must not be null");
        statements = List.copyOf(statements);
    }
}
