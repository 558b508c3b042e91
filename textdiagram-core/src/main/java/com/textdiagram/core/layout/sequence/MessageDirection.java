package com.textdiagram.core.layout.sequence;

/** Horizontal direction of a message, by participant order. */
public enum MessageDirection {
    LEFT_TO_RIGHT,
    RIGHT_TO_LEFT
}
