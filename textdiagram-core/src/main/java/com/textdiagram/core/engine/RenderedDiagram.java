package com.textdiagram.core.engine;

import com.textdiagram.core.util.TextMetrics;

import java.util.List;
import java.util.Objects;

/**
 * Result of rendering one diagram.
 *
 * @param type diagram type that was drawn
 * @param content rendered text, rows joined by {@code \n} without a trailing newline
 * @param width widest row in display columns
 * @param height number of rows
 */
public record RenderedDiagram(DiagramType type, String content, int width, int height) {

    public RenderedDiagram {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Measures rendered text and wraps it.
     *
     * @param type diagram type
     * @param content rendered text
     * @return rendered diagram with measured dimensions
     */
    public static RenderedDiagram of(DiagramType type, String content) {
        List<String> rows = rows(content);
        int width = 0;
        for (String row : rows) {
            width = Math.max(width, TextMetrics.displayWidth(row));
        }
        return new RenderedDiagram(type, content, width, rows.size());
    }

    public List<String> lines() {
        return rows(content);
    }

    private static List<String> rows(String content) {
        return content.isEmpty() ? List.of() : List.of(content.split("\n", -1));
    }
}
