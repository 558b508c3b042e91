package com.textdiagram.core.util;

import org.jline.utils.WCWidth;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Terminal column measurement and multi-line label handling.
 *
 * <p>Every sizing computation in the layout engines goes through this class. Labels may
 * carry explicit line breaks written as {@code <br/>}, {@code <br>} or {@code <br />}
 * (any letter case); each spelling splits the label into separate rendered lines.
 *
 * <p>Column widths follow the East Asian Width rules implemented by JLine's
 * {@link WCWidth}: wide and fullwidth characters take two columns, combining marks and
 * control characters take none, everything else takes one.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * int w = TextMetrics.displayWidth("テスト");            // 6
 * List<String> lines = TextMetrics.splitLines("a<br/>b"); // [a, b]
 * int max = TextMetrics.multilineWidth("abc<BR>de");      // 3
 * }</pre>
 */
public final class TextMetrics {

    /** Marker appended to a label that had to be shortened. */
    public static final String ELLIPSIS = "…";

    private static final Pattern LINE_BREAK = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);

    private TextMetrics() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns the number of terminal columns one code point occupies.
     *
     * @param codePoint Unicode code point
     * @return 0, 1 or 2
     */
    public static int charWidth(int codePoint) {
        int width = WCWidth.wcwidth(codePoint);
        return Math.max(width, 0);
    }

    /**
     * Returns the number of terminal columns a single line of text occupies.
     *
     * @param text text without line-break markers
     * @return non-negative column count
     */
    public static int displayWidth(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return text.codePoints().map(TextMetrics::charWidth).sum();
    }

    /**
     * Splits a label on its line-break markers.
     *
     * @param text label, possibly containing {@code <br/>} markers
     * @return lines in order; a label without markers yields a single element
     */
    public static List<String> splitLines(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return Arrays.asList(LINE_BREAK.split(text, -1));
    }

    /**
     * Returns the width of the widest line of a label.
     *
     * @param text label, possibly multi-line
     * @return maximum display width over all lines
     */
    public static int multilineWidth(String text) {
        return splitLines(text).stream().mapToInt(TextMetrics::displayWidth).max().orElse(0);
    }

    /**
     * Returns the number of lines a label renders to.
     *
     * @param text label, possibly multi-line
     * @return at least 1
     */
    public static int lineCount(String text) {
        return splitLines(text).size();
    }

    /**
     * Shortens a single line so that it fits into {@code maxWidth} columns, ending it with
     * {@link #ELLIPSIS} when anything was cut.
     *
     * @param text single line of text
     * @param maxWidth column budget, at least 1
     * @return the text itself if it fits, otherwise a shortened copy
     */
    public static String truncate(String text, int maxWidth) {
        Objects.requireNonNull(text, "text must not be null");
        if (maxWidth < 1) {
            throw new IllegalArgumentException("maxWidth must be positive: " + maxWidth);
        }
        if (displayWidth(text) <= maxWidth) {
            return text;
        }
        int budget = maxWidth - displayWidth(ELLIPSIS);
        StringBuilder kept = new StringBuilder();
        int used = 0;
        int index = 0;
        while (index < text.length()) {
            int cp = text.codePointAt(index);
            int w = charWidth(cp);
            if (used + w > budget) {
                break;
            }
            kept.appendCodePoint(cp);
            used += w;
            index += Character.charCount(cp);
        }
        return kept.append(ELLIPSIS).toString();
    }

    /**
     * Shortens the widest line of a possibly multi-line label by one column.
     *
     * <p>Lines are rejoined with {@code <br/>}, so the result measures exactly like the
     * input apart from the shortened line.
     *
     * @param text label to shorten
     * @return the shortened label
     */
    public static String truncateByOne(String text) {
        List<String> lines = splitLines(text);
        int widest = 0;
        for (int i = 1; i < lines.size(); i++) {
            if (displayWidth(lines.get(i)) > displayWidth(lines.get(widest))) {
                widest = i;
            }
        }
        String line = lines.get(widest);
        int width = displayWidth(line);
        if (width <= 1) {
            return text;
        }
        String[] result = lines.toArray(new String[0]);
        result[widest] = truncate(line, width - 1);
        return String.join("<br/>", result);
    }
}
