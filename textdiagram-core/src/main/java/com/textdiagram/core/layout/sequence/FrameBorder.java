package com.textdiagram.core.layout.sequence;

/** Which border of a block frame a {@link FrameRow} draws. */
public enum FrameBorder {
    START,
    DIVIDER,
    END
}
