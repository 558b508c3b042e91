package com.textdiagram.core.renderer;

import com.textdiagram.core.canvas.BoxGlyphs;
import com.textdiagram.core.canvas.Canvas;
import com.textdiagram.core.util.TextMetrics;

import java.util.List;

/**
 * Box outlines shared by all renderers.
 */
public final class Boxes {

    /** Corner glyphs of one box style, clockwise from top left. */
    public record Corners(char topLeft, char topRight, char bottomRight, char bottomLeft) {
    }

    public static final Corners SQUARE = new Corners(
        BoxGlyphs.TOP_LEFT, BoxGlyphs.TOP_RIGHT, BoxGlyphs.BOTTOM_RIGHT, BoxGlyphs.BOTTOM_LEFT);

    public static final Corners ROUND = new Corners(
        BoxGlyphs.ROUND_TOP_LEFT, BoxGlyphs.ROUND_TOP_RIGHT, BoxGlyphs.ROUND_BOTTOM_RIGHT, BoxGlyphs.ROUND_BOTTOM_LEFT);

    public static final Corners DIAMOND = new Corners(
        BoxGlyphs.DIAGONAL_UP, BoxGlyphs.DIAGONAL_DOWN, BoxGlyphs.DIAGONAL_UP, BoxGlyphs.DIAGONAL_DOWN);

    private Boxes() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Draws a box outline and clears its interior.
     *
     * @param canvas target canvas
     * @param left left column
     * @param top top row
     * @param width total width including borders
     * @param height total height including borders
     * @param corners corner style
     */
    public static void outline(Canvas canvas, int left, int top, int width, int height, Corners corners) {
        for (int r = top + 1; r < top + height - 1; r++) {
            for (int c = left + 1; c < left + width - 1; c++) {
                canvas.set(r, c, ' ');
            }
        }
        border(canvas, left, top, width, height, corners);
    }

    /**
     * Draws only the border of a box, leaving the interior as it is.
     */
    public static void border(Canvas canvas, int left, int top, int width, int height, Corners corners) {
        int right = left + width - 1;
        int bottom = top + height - 1;
        for (int c = left + 1; c < right; c++) {
            canvas.set(top, c, BoxGlyphs.HORIZONTAL);
            canvas.set(bottom, c, BoxGlyphs.HORIZONTAL);
        }
        for (int r = top + 1; r < bottom; r++) {
            canvas.set(r, left, BoxGlyphs.VERTICAL);
            canvas.set(r, right, BoxGlyphs.VERTICAL);
        }
        canvas.set(top, left, corners.topLeft());
        canvas.set(top, right, corners.topRight());
        canvas.set(bottom, right, corners.bottomRight());
        canvas.set(bottom, left, corners.bottomLeft());
    }

    /**
     * Draws a box with its label left-aligned two columns in and vertically centered.
     */
    public static void labeled(Canvas canvas, int left, int top, int width, int height, String label, Corners corners) {
        outline(canvas, left, top, width, height, corners);
        List<String> lines = TextMetrics.splitLines(label);
        int first = top + 1 + Math.max(0, (height - 2 - lines.size()) / 2);
        for (int i = 0; i < lines.size(); i++) {
            canvas.write(first + i, left + 2, lines.get(i));
        }
    }

    /**
     * Draws a box with every label line centered horizontally.
     */
    public static void centered(Canvas canvas, int left, int top, int width, int height, String label, Corners corners) {
        outline(canvas, left, top, width, height, corners);
        List<String> lines = TextMetrics.splitLines(label);
        int first = top + 1 + Math.max(0, (height - 2 - lines.size()) / 2);
        for (int i = 0; i < lines.size(); i++) {
            int pad = Math.max(0, (width - 2 - TextMetrics.displayWidth(lines.get(i))) / 2);
            canvas.write(first + i, left + 1 + pad, lines.get(i));
        }
    }
}
