package com.textdiagram.core.model.graph;

/**
 * Flowchart edge kinds: line weight and whether the target end carries an arrow head.
 */
public enum EdgeType {
    ARROW(LineWeight.NORMAL, true),
    OPEN_LINK(LineWeight.NORMAL, false),
    DOTTED_ARROW(LineWeight.DOTTED, true),
    DOTTED_LINK(LineWeight.DOTTED, false),
    THICK_ARROW(LineWeight.THICK, true),
    THICK_LINK(LineWeight.THICK, false);

    /** Line weight of an edge. */
    public enum LineWeight {
        NORMAL,
        DOTTED,
        THICK
    }

    private final LineWeight weight;
    private final boolean arrowHead;

    EdgeType(LineWeight weight, boolean arrowHead) {
        this.weight = weight;
        this.arrowHead = arrowHead;
    }

    public LineWeight weight() {
        return weight;
    }

    public boolean hasArrowHead() {
        return arrowHead;
    }
}
