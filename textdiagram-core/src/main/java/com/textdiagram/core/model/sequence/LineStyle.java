package com.textdiagram.core.model.sequence;

/** Line style of a message arrow. */
public enum LineStyle {
    /** {@code ->} family, drawn as a continuous line. */
    SOLID,
    /** {@code -->} family, drawn with alternating gaps. */
    DOTTED
}
