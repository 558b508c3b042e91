package com.textdiagram.core.layout.graph;

import com.textdiagram.core.model.graph.Edge;
import com.textdiagram.core.model.graph.EdgeType;

import java.util.Objects;

/**
 * Edge to route between two positioned nodes.
 *
 * <p>An edge pointing back against the layout direction runs around the diagram through a
 * lane of its own: a column right of the content in top-down layouts, a row below it in
 * left-to-right layouts.
 *
 * @param edge parsed edge
 * @param lane lane column or row of a back edge, {@link #NO_LANE} for other edges
 */
public record EdgeLayout(Edge edge, int lane) {

    public static final int NO_LANE = -1;

    public EdgeLayout {
        Objects.requireNonNull(edge, "edge must not be null");
    }

    public String from() {
        return edge.from();
    }

    public String to() {
        return edge.to();
    }

    public EdgeType type() {
        return edge.type();
    }

    public boolean hasLane() {
        return lane != NO_LANE;
    }
}
