package com.textdiagram.core.canvas;

import com.textdiagram.core.util.TextMetrics;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-size character grid that renderers draw into.
 *
 * <p>Cells are addressed by (row, column) and the grid is never resized. Writes outside the
 * grid are ignored, so renderers can draw clipped geometry without bounds checks.
 *
 * <p>Wide glyphs occupy their own cell plus {@link Cell#CONTINUATION} cells to the right.
 * {@link #set} keeps that invariant: overwriting a continuation cell also blanks the
 * glyph it belonged to.
 */
public class Canvas {

    private final Cell[][] cells;
    private final int width;
    private final int height;

    /**
     * Creates a blank canvas.
     *
     * @param width number of columns
     * @param height number of rows
     */
    public Canvas(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Canvas size must not be negative: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.cells = new Cell[height][width];
        for (Cell[] row : cells) {
            Arrays.fill(row, Cell.BLANK);
        }
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * Returns the cell at a position.
     *
     * @param row row index
     * @param col column index
     * @return the cell, or {@link Cell#BLANK} outside the grid
     */
    public Cell cell(int row, int col) {
        return inBounds(row, col) ? cells[row][col] : Cell.BLANK;
    }

    /**
     * Writes one glyph into one cell.
     *
     * @param row row index
     * @param col column index
     * @param codePoint glyph; a space clears the cell
     */
    public void set(int row, int col, int codePoint) {
        put(row, col, Cell.glyph(codePoint));
    }

    /**
     * Writes a string left to right, honoring each character's display width.
     *
     * @param row row index
     * @param col column of the first character
     * @param text single line of text
     */
    public void write(int row, int col, String text) {
        Objects.requireNonNull(text, "text must not be null");
        int offset = 0;
        int index = 0;
        while (index < text.length()) {
            int cp = text.codePointAt(index);
            index += Character.charCount(cp);
            int w = TextMetrics.charWidth(cp);
            if (w == 0) {
                continue;
            }
            set(row, col + offset, cp);
            for (int j = 1; j < w; j++) {
                put(row, col + offset + j, Cell.CONTINUATION);
            }
            offset += w;
        }
    }

    /**
     * Draws a box-drawing glyph, joining it with a box-drawing glyph already in the cell.
     *
     * @param row row index
     * @param col column index
     * @param codePoint incoming line, corner or junction glyph
     */
    public void merge(int row, int col, int codePoint) {
        if (!inBounds(row, col)) {
            return;
        }
        Cell existing = cells[row][col];
        int current = existing.kind() == Cell.Kind.GLYPH ? existing.codePoint() : ' ';
        set(row, col, BoxGlyphs.merge(current, codePoint));
    }

    /**
     * ORs a raw direction mask into a cell.
     *
     * <p>Used where a route turns or branches and no single incoming glyph describes the
     * connection, e.g. the end of a fan-out bar.
     *
     * @param row row index
     * @param col column index
     * @param mask union of {@link BoxGlyphs} direction bits
     */
    public void connect(int row, int col, int mask) {
        connect(row, col, mask, BoxGlyphs.Style.LIGHT);
    }

    /**
     * ORs a raw direction mask into a cell, drawing in {@code style} unless the cell already
     * holds a glyph of another style.
     *
     * @param row row index
     * @param col column index
     * @param mask union of {@link BoxGlyphs} direction bits
     * @param style line family of the route being drawn
     */
    public void connect(int row, int col, int mask, BoxGlyphs.Style style) {
        if (!inBounds(row, col)) {
            return;
        }
        Cell existing = cells[row][col];
        int current = existing.kind() == Cell.Kind.GLYPH ? BoxGlyphs.mask(existing.codePoint()) : 0;
        BoxGlyphs.Style drawn = current == 0 || BoxGlyphs.style(existing.codePoint()) == style
            ? style : BoxGlyphs.Style.LIGHT;
        char glyph = BoxGlyphs.glyphFor(current | mask, drawn);
        if (glyph != 0) {
            set(row, col, glyph);
        }
    }

    /**
     * Converts the grid to text.
     *
     * @return rows joined by {@code \n}, each right-trimmed, continuation cells omitted
     */
    public String render() {
        StringBuilder out = new StringBuilder();
        for (int r = 0; r < height; r++) {
            if (r > 0) {
                out.append('\n');
            }
            StringBuilder line = new StringBuilder();
            for (Cell cell : cells[r]) {
                switch (cell.kind()) {
                    case BLANK -> line.append(' ');
                    case GLYPH -> line.appendCodePoint(cell.codePoint());
                    case CONTINUATION -> {
                    }
                }
            }
            out.append(line.toString().stripTrailing());
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    private void put(int row, int col, Cell cell) {
        if (!inBounds(row, col)) {
            return;
        }
        if (cells[row][col].isContinuation() && col > 0 && !cells[row][col - 1].isContinuation()) {
            cells[row][col - 1] = Cell.BLANK;
        }
        // a replaced wide glyph must not leave its continuations behind
        for (int c = col + 1; c < width && cells[row][c].isContinuation(); c++) {
            cells[row][c] = Cell.BLANK;
        }
        cells[row][col] = cell;
    }

    private boolean inBounds(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }
}
