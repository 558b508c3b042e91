package com.textdiagram.core.model.graph;

import java.util.Objects;

/**
 * Flowchart node.
 *
 * @param id identifier used by edges
 * @param label display text, may contain line breaks
 * @param shape outline
 */
public record NodeDecl(String id, String label, NodeShape shape) {

    public NodeDecl {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
    }
}
