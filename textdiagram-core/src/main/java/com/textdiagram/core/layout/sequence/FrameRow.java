package com.textdiagram.core.layout.sequence;

import java.util.Objects;

/**
 * One border row of a block frame.
 *
 * @param frameId identifies the block; all borders of one block share it
 * @param border which border this row draws
 * @param frameLeft left frame column
 * @param frameRight right frame column
 * @param label title written into the border, empty for the end border
 */
public record FrameRow(int frameId, FrameBorder border, int frameLeft, int frameRight, String label)
    implements SequenceRow {

    public FrameRow {
        Objects.requireNonNull(border, "border must not be null");
        Objects.requireNonNull(label, "label must not be null");
        if (frameRight <= frameLeft) {
            throw new IllegalArgumentException("Frame too narrow: " + frameLeft + ".." + frameRight);
        }
    }

    @Override
    public int height() {
        return 1;
    }

    @Override
    public int rightExtent() {
        return frameRight;
    }

    @Override
    public FrameRow shifted(int offset) {
        return new FrameRow(frameId, border, frameLeft + offset, frameRight + offset, label);
    }
}
