package com.textdiagram.core.model.graph;

import java.util.Objects;

/**
 * Directed flowchart edge.
 *
 * @param from source node id
 * @param to target node id
 * @param type line kind
 * @param label optional label, null if absent
 */
public record Edge(String from, String to, EdgeType type, String label) {

    public Edge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public boolean hasLabel() {
        return label != null && !label.isEmpty();
    }
}
