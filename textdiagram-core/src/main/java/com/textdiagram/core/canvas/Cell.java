package com.textdiagram.core.canvas;

/**
 * One character cell of a {@link Canvas}.
 *
 * @param kind what occupies the cell
 * @param codePoint the glyph, meaningful only for {@link Kind#GLYPH}
 */
public record Cell(Kind kind, int codePoint) {

    /** Cell state. */
    public enum Kind {
        /** Nothing drawn; renders as a space. */
        BLANK,
        /** A visible glyph. */
        GLYPH,
        /** Second column of a wide glyph to its left; never rendered. */
        CONTINUATION
    }

    public static final Cell BLANK = new Cell(Kind.BLANK, ' ');
    public static final Cell CONTINUATION = new Cell(Kind.CONTINUATION, 0);

    /**
     * Creates a glyph cell. A space becomes {@link #BLANK}.
     *
     * @param codePoint glyph code point
     * @return the cell
     */
    public static Cell glyph(int codePoint) {
        return codePoint == ' ' ? BLANK : new Cell(Kind.GLYPH, codePoint);
    }

    public boolean isContinuation() {
        return kind == Kind.CONTINUATION;
    }
}
