package com.textdiagram.core.renderer;

/**
 * Draws a computed layout onto a fresh canvas and returns the text.
 *
 * <p>Rendering is total: every layout produced by a layout engine renders without error.
 *
 * @param <L> layout type
 */
public interface DiagramRenderer<L> {

    /**
     * Renders a layout.
     *
     * @param layout computed layout
     * @return rendered lines joined by {@code \n}, without trailing whitespace
     */
    String render(L layout);
}
