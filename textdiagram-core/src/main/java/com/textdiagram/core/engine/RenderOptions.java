package com.textdiagram.core.engine;

import java.util.OptionalInt;

/**
 * Options for a single render call.
 *
 * @param maxWidth maximum output width in columns, or null for the natural width
 */
public record RenderOptions(Integer maxWidth) {

    public RenderOptions {
        if (maxWidth != null && maxWidth < 1) {
            throw new IllegalArgumentException("maxWidth must be positive, got " + maxWidth);
        }
    }

    /**
     * Options that keep every diagram at its natural width.
     *
     * @return default options
     */
    public static RenderOptions defaults() {
        return new RenderOptions(null);
    }

    /**
     * Options that shrink diagrams to at most {@code maxWidth} columns.
     *
     * @param maxWidth column budget
     * @return options with a width budget
     */
    public static RenderOptions withMaxWidth(int maxWidth) {
        return new RenderOptions(maxWidth);
    }

    public OptionalInt maxWidthLimit() {
        return maxWidth == null ? OptionalInt.empty() : OptionalInt.of(maxWidth);
    }
}
