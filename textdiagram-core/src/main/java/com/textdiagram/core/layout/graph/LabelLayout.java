package com.textdiagram.core.layout.graph;

import com.textdiagram.core.util.TextMetrics;

import java.util.Objects;

/**
 * Edge label text at its position.
 *
 * @param text single line of text
 * @param row row of the text
 * @param col column of the first character
 */
public record LabelLayout(String text, int row, int col) {

    public LabelLayout {
        Objects.requireNonNull(text, "text must not be null");
    }

    /** Last column the text covers. */
    public int right() {
        return col + TextMetrics.displayWidth(text) - 1;
    }
}
