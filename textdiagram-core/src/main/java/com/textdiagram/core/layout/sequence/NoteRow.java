package com.textdiagram.core.layout.sequence;

import com.textdiagram.core.util.TextMetrics;

import java.util.Objects;

/**
 * Note band: a bordered box with the note text inside.
 *
 * @param boxLeft left border column
 * @param boxRight right border column
 * @param text note text, may contain line breaks
 */
public record NoteRow(int boxLeft, int boxRight, String text) implements SequenceRow {

    public NoteRow {
        Objects.requireNonNull(text, "text must not be null");
        if (boxRight <= boxLeft) {
            throw new IllegalArgumentException("Note box too narrow: " + boxLeft + ".." + boxRight);
        }
    }

    @Override
    public int height() {
        return 2 + TextMetrics.lineCount(text);
    }

    @Override
    public int rightExtent() {
        return boxRight;
    }

    @Override
    public NoteRow shifted(int offset) {
        return new NoteRow(boxLeft + offset, boxRight + offset, text);
    }
}
