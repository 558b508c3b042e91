package com.textdiagram.core.canvas;

import java.util.Map;

/**
 * Box-drawing glyphs and their connection masks.
 *
 * <p>Each line, corner and junction glyph connects to a subset of its four neighbours.
 * The subset is a 4-bit mask ({@link #LEFT}, {@link #RIGHT}, {@link #UP}, {@link #DOWN});
 * merging two glyphs ORs their masks and maps the union back to a single glyph.
 *
 * <p>Glyphs also carry a {@link Style}. Two glyphs of the same style merge into a glyph of
 * that style when one exists; anything else falls back to light. Dashed lines have no
 * corners or junctions, so only dashed on dashed along one axis stays dashed.
 */
public final class BoxGlyphs {

    public static final int LEFT = 1;
    public static final int RIGHT = 2;
    public static final int UP = 4;
    public static final int DOWN = 8;

    public static final char HORIZONTAL = '─';
    public static final char VERTICAL = '│';
    public static final char TOP_LEFT = '┌';
    public static final char TOP_RIGHT = '┐';
    public static final char BOTTOM_LEFT = '└';
    public static final char BOTTOM_RIGHT = '┘';
    public static final char TEE_DOWN = '┬';
    public static final char TEE_UP = '┴';
    public static final char TEE_RIGHT = '├';
    public static final char TEE_LEFT = '┤';
    public static final char CROSS = '┼';

    public static final char ROUND_TOP_LEFT = '╭';
    public static final char ROUND_TOP_RIGHT = '╮';
    public static final char ROUND_BOTTOM_LEFT = '╰';
    public static final char ROUND_BOTTOM_RIGHT = '╯';
    public static final char DIAGONAL_UP = '╱';
    public static final char DIAGONAL_DOWN = '╲';

    public static final char HEAVY_VERTICAL = '┃';
    public static final char DOUBLE_HORIZONTAL = '═';
    public static final char DOUBLE_VERTICAL = '║';
    public static final char DASHED_HORIZONTAL = '╌';
    public static final char DASHED_VERTICAL = '┊';

    public static final char DOUBLE_TOP_LEFT = '╔';
    public static final char DOUBLE_TOP_RIGHT = '╗';
    public static final char DOUBLE_BOTTOM_LEFT = '╚';
    public static final char DOUBLE_BOTTOM_RIGHT = '╝';
    public static final char DOUBLE_TEE_DOWN = '╦';
    public static final char DOUBLE_TEE_UP = '╩';
    public static final char DOUBLE_TEE_RIGHT = '╠';
    public static final char DOUBLE_TEE_LEFT = '╣';
    public static final char DOUBLE_CROSS = '╬';

    /** Line family of a box-drawing glyph. */
    public enum Style {
        LIGHT,
        DOUBLE,
        DASHED
    }

    private static final Map<Character, Integer> MASKS = Map.ofEntries(
        Map.entry(HORIZONTAL, LEFT | RIGHT),
        Map.entry(DOUBLE_HORIZONTAL, LEFT | RIGHT),
        Map.entry(DASHED_HORIZONTAL, LEFT | RIGHT),
        Map.entry(VERTICAL, UP | DOWN),
        Map.entry(DOUBLE_VERTICAL, UP | DOWN),
        Map.entry(DASHED_VERTICAL, UP | DOWN),
        Map.entry(TOP_LEFT, RIGHT | DOWN),
        Map.entry(TOP_RIGHT, LEFT | DOWN),
        Map.entry(BOTTOM_LEFT, RIGHT | UP),
        Map.entry(BOTTOM_RIGHT, LEFT | UP),
        Map.entry(TEE_DOWN, LEFT | RIGHT | DOWN),
        Map.entry(TEE_UP, LEFT | RIGHT | UP),
        Map.entry(TEE_RIGHT, UP | DOWN | RIGHT),
        Map.entry(TEE_LEFT, UP | DOWN | LEFT),
        Map.entry(CROSS, LEFT | RIGHT | UP | DOWN),
        Map.entry(DOUBLE_TOP_LEFT, RIGHT | DOWN),
        Map.entry(DOUBLE_TOP_RIGHT, LEFT | DOWN),
        Map.entry(DOUBLE_BOTTOM_LEFT, RIGHT | UP),
        Map.entry(DOUBLE_BOTTOM_RIGHT, LEFT | UP),
        Map.entry(DOUBLE_TEE_DOWN, LEFT | RIGHT | DOWN),
        Map.entry(DOUBLE_TEE_UP, LEFT | RIGHT | UP),
        Map.entry(DOUBLE_TEE_RIGHT, UP | DOWN | RIGHT),
        Map.entry(DOUBLE_TEE_LEFT, UP | DOWN | LEFT),
        Map.entry(DOUBLE_CROSS, LEFT | RIGHT | UP | DOWN)
    );

    // Indexed by mask; 0 where no single glyph represents the set.
    private static final char[] BY_MASK = new char[16];
    private static final char[] DOUBLE_BY_MASK = new char[16];
    private static final char[] DASHED_BY_MASK = new char[16];

    static {
        BY_MASK[LEFT | RIGHT] = HORIZONTAL;
        BY_MASK[UP | DOWN] = VERTICAL;
        BY_MASK[RIGHT | DOWN] = TOP_LEFT;
        BY_MASK[LEFT | DOWN] = TOP_RIGHT;
        BY_MASK[RIGHT | UP] = BOTTOM_LEFT;
        BY_MASK[LEFT | UP] = BOTTOM_RIGHT;
        BY_MASK[LEFT | RIGHT | DOWN] = TEE_DOWN;
        BY_MASK[LEFT | RIGHT | UP] = TEE_UP;
        BY_MASK[UP | DOWN | RIGHT] = TEE_RIGHT;
        BY_MASK[UP | DOWN | LEFT] = TEE_LEFT;
        BY_MASK[LEFT | RIGHT | UP | DOWN] = CROSS;

        DOUBLE_BY_MASK[LEFT | RIGHT] = DOUBLE_HORIZONTAL;
        DOUBLE_BY_MASK[UP | DOWN] = DOUBLE_VERTICAL;
        DOUBLE_BY_MASK[RIGHT | DOWN] = DOUBLE_TOP_LEFT;
        DOUBLE_BY_MASK[LEFT | DOWN] = DOUBLE_TOP_RIGHT;
        DOUBLE_BY_MASK[RIGHT | UP] = DOUBLE_BOTTOM_LEFT;
        DOUBLE_BY_MASK[LEFT | UP] = DOUBLE_BOTTOM_RIGHT;
        DOUBLE_BY_MASK[LEFT | RIGHT | DOWN] = DOUBLE_TEE_DOWN;
        DOUBLE_BY_MASK[LEFT | RIGHT | UP] = DOUBLE_TEE_UP;
        DOUBLE_BY_MASK[UP | DOWN | RIGHT] = DOUBLE_TEE_RIGHT;
        DOUBLE_BY_MASK[UP | DOWN | LEFT] = DOUBLE_TEE_LEFT;
        DOUBLE_BY_MASK[LEFT | RIGHT | UP | DOWN] = DOUBLE_CROSS;

        DASHED_BY_MASK[LEFT | RIGHT] = DASHED_HORIZONTAL;
        DASHED_BY_MASK[UP | DOWN] = DASHED_VERTICAL;
    }

    private BoxGlyphs() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns the connection mask of a glyph.
     *
     * @param codePoint glyph
     * @return mask, or 0 if the glyph is not a mergeable box-drawing glyph
     */
    public static int mask(int codePoint) {
        if (codePoint > Character.MAX_VALUE) {
            return 0;
        }
        return MASKS.getOrDefault((char) codePoint, 0);
    }

    /**
     * Returns the line family of a glyph.
     *
     * @param codePoint glyph
     * @return its style; {@link Style#LIGHT} for light and non box-drawing glyphs
     */
    public static Style style(int codePoint) {
        return switch (codePoint) {
            case DOUBLE_HORIZONTAL, DOUBLE_VERTICAL, DOUBLE_TOP_LEFT, DOUBLE_TOP_RIGHT,
                DOUBLE_BOTTOM_LEFT, DOUBLE_BOTTOM_RIGHT, DOUBLE_TEE_DOWN, DOUBLE_TEE_UP,
                DOUBLE_TEE_RIGHT, DOUBLE_TEE_LEFT, DOUBLE_CROSS -> Style.DOUBLE;
            case DASHED_HORIZONTAL, DASHED_VERTICAL -> Style.DASHED;
            default -> Style.LIGHT;
        };
    }

    /**
     * Returns the light glyph for a connection mask.
     *
     * @param mask union of direction bits
     * @return the glyph, or 0 if no single glyph has exactly these connections
     */
    public static char glyphFor(int mask) {
        return mask >= 0 && mask < BY_MASK.length ? BY_MASK[mask] : 0;
    }

    /**
     * Returns the glyph for a connection mask in a given style, falling back to light.
     *
     * @param mask union of direction bits
     * @param style preferred line family
     * @return the glyph, or 0 if no single glyph has exactly these connections
     */
    public static char glyphFor(int mask, Style style) {
        if (mask < 0 || mask >= BY_MASK.length) {
            return 0;
        }
        char styled = switch (style) {
            case LIGHT -> 0;
            case DOUBLE -> DOUBLE_BY_MASK[mask];
            case DASHED -> DASHED_BY_MASK[mask];
        };
        return styled != 0 ? styled : BY_MASK[mask];
    }

    /**
     * Merges an incoming glyph into an existing one.
     *
     * @param existing glyph already in the cell
     * @param incoming glyph being drawn
     * @return joined glyph; {@code incoming} if {@code existing} is not a box-drawing glyph
     *         or the union has no single-glyph form
     */
    public static int merge(int existing, int incoming) {
        int existingMask = mask(existing);
        if (existingMask == 0) {
            return incoming;
        }
        Style shared = style(existing) == style(incoming) ? style(existing) : Style.LIGHT;
        char joined = glyphFor(existingMask | mask(incoming), shared);
        return joined != 0 ? joined : incoming;
    }
}
