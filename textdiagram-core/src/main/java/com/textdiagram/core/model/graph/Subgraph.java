package com.textdiagram.core.model.graph;

import java.util.List;
import java.util.Objects;

/**
 * Titled group of nodes.
 *
 * @param id identifier derived from the title
 * @param label title drawn in the border
 * @param nodeIds member node ids in first-reference order
 */
public record Subgraph(String id, String label, List<String> nodeIds) {

    public Subgraph {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(nodeIds, "nodeIds must not be null");
        nodeIds = List.copyOf(nodeIds);
    }
}
