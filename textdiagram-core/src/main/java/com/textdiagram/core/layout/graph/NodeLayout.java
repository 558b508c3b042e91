package com.textdiagram.core.layout.graph;

import com.textdiagram.core.model.graph.NodeShape;

import java.util.Objects;

/**
 * Positioned flowchart node.
 *
 * @param id node id
 * @param label display label, may contain line breaks
 * @param shape outline shape
 * @param x left column
 * @param y top row
 * @param width total width including borders
 * @param height total height including borders
 */
public record NodeLayout(String id, String label, NodeShape shape, int x, int y, int width, int height) {

    public NodeLayout {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
    }

    public int right() {
        return x + width - 1;
    }

    public int bottom() {
        return y + height - 1;
    }

    /** Column edges attach to on the top and bottom borders. */
    public int centerX() {
        return x + width / 2;
    }

    /** Row edges attach to on the left and right borders. */
    public int centerY() {
        return y + height / 2;
    }

    NodeLayout moved(int dx, int dy) {
        return new NodeLayout(id, label, shape, x + dx, y + dy, width, height);
    }
}
