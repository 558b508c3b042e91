package com.textdiagram.core.layout.graph;

import com.textdiagram.core.model.graph.Direction;

import java.util.List;
import java.util.Objects;

/**
 * Computed geometry of a flowchart.
 *
 * <p>Nodes of one rank share their top row in top-down layouts and their left column in
 * left-to-right layouts. The rank helpers below rely on that.
 *
 * @param direction layout direction
 * @param nodes positioned nodes
 * @param edges edges to route between the nodes, self edges excluded
 * @param subgraphs subgraph borders
 * @param labels placed edge labels
 * @param width total width
 * @param height total height
 */
public record GraphLayout(
    Direction direction,
    List<NodeLayout> nodes,
    List<EdgeLayout> edges,
    List<SubgraphLayout> subgraphs,
    List<LabelLayout> labels,
    int width,
    int height
) {

    public GraphLayout {
        Objects.requireNonNull(direction, "direction must not be null");
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes must not be null"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges must not be null"));
        subgraphs = List.copyOf(Objects.requireNonNull(subgraphs, "subgraphs must not be null"));
        labels = List.copyOf(Objects.requireNonNull(labels, "labels must not be null"));
    }

    /**
     * Looks up a node by id.
     *
     * @param id node id
     * @return the node
     * @throws IllegalArgumentException if no node has this id
     */
    public NodeLayout node(String id) {
        return nodes.stream()
            .filter(n -> n.id().equals(id))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown node: " + id));
    }

    /**
     * Checks whether an edge runs along the layout direction, into a later rank.
     *
     * @param edge edge between two nodes of this layout
     * @return true for edges going down (top-down) or right (left-to-right)
     */
    public boolean isForward(EdgeLayout edge) {
        NodeLayout from = node(edge.from());
        NodeLayout to = node(edge.to());
        return direction == Direction.TOP_DOWN ? to.y() > from.bottom() : to.x() > from.right();
    }

    /**
     * Checks whether an edge runs against the layout direction, into an earlier rank.
     *
     * @param edge edge between two nodes of this layout
     * @return true for edges going up (top-down) or left (left-to-right)
     */
    public boolean isBackward(EdgeLayout edge) {
        NodeLayout from = node(edge.from());
        NodeLayout to = node(edge.to());
        return direction == Direction.TOP_DOWN ? to.bottom() < from.y() : to.right() < from.x();
    }

    /**
     * Counts the forward edges leaving a node.
     *
     * @param id node id
     * @return number of forward edges with this source
     */
    public int forwardDegree(String id) {
        return (int) edges.stream().filter(e -> e.from().equals(id) && isForward(e)).count();
    }

    /**
     * Returns the first row below a node's rank in a top-down layout, where its edges
     * start to branch.
     *
     * @param node positioned node
     * @return row after the bottom of the tallest node in the same rank
     */
    public int exitRow(NodeLayout node) {
        int bottom = node.bottom();
        for (NodeLayout other : nodes) {
            if (other.y() == node.y()) {
                bottom = Math.max(bottom, other.bottom());
            }
        }
        return bottom + 1;
    }

    /**
     * Returns the column in which left-to-right edges leaving a node's rank turn. All
     * edges leaving one rank share it, so their vertical runs join into one bar.
     *
     * @param node positioned node
     * @return the middle column of the gap right of the node's rank
     */
    public int turnColumn(NodeLayout node) {
        int right = rankRight(node);
        return right + 1 + (nextRankColumn(node) - right - 1) / 2;
    }

    /**
     * Returns the first column right of a node's rank that belongs to the next rank.
     *
     * @param node positioned node
     * @return left column of the next rank, or the layout width if there is none
     */
    public int nextRankColumn(NodeLayout node) {
        int right = rankRight(node);
        int next = width;
        for (NodeLayout other : nodes) {
            if (other.x() > right) {
                next = Math.min(next, other.x());
            }
        }
        return next;
    }

    private int rankRight(NodeLayout node) {
        int right = node.right();
        for (NodeLayout other : nodes) {
            if (other.x() == node.x()) {
                right = Math.max(right, other.right());
            }
        }
        return right;
    }
}
