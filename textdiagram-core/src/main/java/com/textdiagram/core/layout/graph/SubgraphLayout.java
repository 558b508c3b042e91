package com.textdiagram.core.layout.graph;

import java.util.List;
import java.util.Objects;

/**
 * Positioned subgraph border.
 *
 * @param id subgraph id
 * @param label title drawn into the top border
 * @param nodeIds member nodes laid out inside the border
 * @param x left border column
 * @param y top border row
 * @param width total width including borders
 * @param height total height including borders
 */
public record SubgraphLayout(String id, String label, List<String> nodeIds, int x, int y, int width, int height) {

    public SubgraphLayout {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        nodeIds = List.copyOf(Objects.requireNonNull(nodeIds, "nodeIds must not be null"));
    }

    public int right() {
        return x + width - 1;
    }

    public int bottom() {
        return y + height - 1;
    }

    /**
     * Checks whether a node lies strictly inside the border.
     *
     * @param node positioned node
     * @return true if no node cell touches or crosses the border
     */
    public boolean contains(NodeLayout node) {
        return node.x() > x && node.right() < right() && node.y() > y && node.bottom() < bottom();
    }
}
