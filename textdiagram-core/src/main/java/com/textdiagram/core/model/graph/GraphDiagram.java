package com.textdiagram.core.model.graph;

import java.util.List;
import java.util.Objects;

/**
 * Parsed flowchart.
 *
 * @param direction layout direction
 * @param nodes nodes, deduplicated by id, in first-reference order
 * @param edges edges in source order
 * @param subgraphs subgraphs in source order
 */
public record GraphDiagram(Direction direction, List<NodeDecl> nodes, List<Edge> edges, List<Subgraph> subgraphs) {

    public GraphDiagram {
        Objects.requireNonNull(direction, "direction must not be null");
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes must not be null"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges must not be null"));
        subgraphs = subgraphs == null ? List.of() : List.copyOf(subgraphs);
    }
}
