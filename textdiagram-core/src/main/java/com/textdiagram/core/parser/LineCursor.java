package com.textdiagram.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Forward-only cursor over the meaningful lines of a diagram source.
 *
 * <p>Blank lines and {@code %%} comment lines are dropped up front, so parsers only see
 * statements. Line numbers still refer to the original source.
 */
public class LineCursor {

    private final List<SourceLine> lines;
    private int position;

    public LineCursor(String source) {
        Objects.requireNonNull(source, "source must not be null");
        this.lines = new ArrayList<>();
        String[] raw = source.split("\\R", -1);
        for (int i = 0; i < raw.length; i++) {
            String text = raw[i].strip();
            if (!text.isEmpty() && !text.startsWith("%%")) {
                lines.add(new SourceLine(i + 1, text));
            }
        }
    }

    public boolean hasNext() {
        return position < lines.size();
    }

    /**
     * Returns the next line without consuming it.
     *
     * @return next line, or null at the end
     */
    public SourceLine peek() {
        return hasNext() ? lines.get(position) : null;
    }

    /**
     * Consumes the next line.
     *
     * @return the consumed line
     * @throws IllegalStateException at the end of input
     */
    public SourceLine next() {
        if (!hasNext()) {
            throw new IllegalStateException("No more lines");
        }
        return lines.get(position++);
    }

    /**
     * Returns the number of the last source line, used for end-of-input errors.
     *
     * @return line number, 1 for empty input
     */
    public int lastLineNumber() {
        return lines.isEmpty() ? 1 : lines.get(lines.size() - 1).number();
    }
}
