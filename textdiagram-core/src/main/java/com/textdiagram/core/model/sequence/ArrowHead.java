package com.textdiagram.core.model.sequence;

/** End decoration of a message arrow. */
public enum ArrowHead {
    /** {@code ->}: plain line. */
    NONE,
    /** {@code ->>}: arrowhead. */
    ARROWHEAD,
    /** {@code -x}: cross. */
    CROSS,
    /** {@code -)}: open (asynchronous) head. */
    OPEN
}
