package com.textdiagram.core.model.sequence;

/** Where a note sits relative to its participant(s). */
public enum NotePlacement {
    RIGHT_OF,
    LEFT_OF,
    /** Centered over one participant, or spanning two. */
    OVER
}
