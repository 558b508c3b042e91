package com.textdiagram.core.model.graph;

/** Outline of a flowchart node. */
public enum NodeShape {
    /** {@code A[label]} */
    BOX,
    /** {@code A(label)} */
    ROUND,
    /** {@code A((label))} */
    CIRCLE,
    /** {@code A{label}} */
    DIAMOND
}
