package com.textdiagram.core.layout.sequence;

import com.textdiagram.core.model.sequence.Arrow;
import com.textdiagram.core.util.TextMetrics;

import java.util.Objects;

/**
 * Message band: text lines, then the arrow row, then one spacer row.
 *
 * <p>A self message has {@code fromIndex == toIndex} and is drawn as a loop to the right
 * of the lifeline instead.
 *
 * @param fromIndex sender participant index
 * @param toIndex receiver participant index
 * @param fromCol sender lifeline column
 * @param toCol receiver lifeline column
 * @param text displayed text including any autonumber prefix
 * @param arrow arrow decoration
 * @param direction direction by participant order
 */
public record MessageRow(
    int fromIndex,
    int toIndex,
    int fromCol,
    int toCol,
    String text,
    Arrow arrow,
    MessageDirection direction
) implements SequenceRow {

    /** Columns a self-message loop extends to the right of its lifeline. */
    public static final int SELF_LOOP_ARM = 4;

    public MessageRow {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(arrow, "arrow must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
    }

    public boolean isSelf() {
        return fromIndex == toIndex;
    }

    public int leftCol() {
        return Math.min(fromCol, toCol);
    }

    public int rightCol() {
        return Math.max(fromCol, toCol);
    }

    @Override
    public int height() {
        return 2 + TextMetrics.lineCount(text);
    }

    @Override
    public int rightExtent() {
        if (isSelf()) {
            return Math.max(fromCol + SELF_LOOP_ARM, fromCol + 1 + TextMetrics.multilineWidth(text));
        }
        return Math.max(rightCol(), leftCol() + 1 + TextMetrics.multilineWidth(text));
    }

    @Override
    public MessageRow shifted(int offset) {
        return new MessageRow(fromIndex, toIndex, fromCol + offset, toCol + offset, text, arrow, direction);
    }
}
