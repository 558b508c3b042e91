package com.textdiagram.core.model.graph;

/** Primary layout axis of a flowchart. */
public enum Direction {
    /** {@code TD} / {@code TB}: ranks stack downwards. */
    TOP_DOWN,
    /** {@code LR}: ranks stack to the right. */
    LEFT_RIGHT
}
