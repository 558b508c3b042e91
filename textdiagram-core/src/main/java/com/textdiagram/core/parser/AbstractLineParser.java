package com.textdiagram.core.parser;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for the line-oriented diagram grammars.
 *
 * <p>Subclasses provide the header pattern that the first meaningful line must match and
 * consume the remaining lines through a {@link LineCursor}. Every statement is matched
 * against precompiled patterns; the helpers here keep that matching uniform.
 *
 * @param <T> AST type produced
 */
public abstract class AbstractLineParser<T> implements DiagramParser<T> {

    /** Identifier characters shared by all grammars: letters, digits and underscore. */
    protected static final String ID = "[\\p{L}\\p{N}_]+";

    @Override
    public final T parse(String source) throws DiagramParseException {
        Objects.requireNonNull(source, "source must not be null");
        LineCursor cursor = new LineCursor(source);
        if (!cursor.hasNext()) {
            throw new DiagramParseException(1, "", "missing diagram header");
        }
        SourceLine header = cursor.next();
        Matcher matcher = headerPattern().matcher(header.text());
        if (!matcher.matches()) {
            throw new DiagramParseException(header.number(), header.text());
        }
        return parseBody(matcher, cursor);
    }

    /**
     * Returns the pattern the first meaningful line must match completely.
     *
     * @return header pattern
     */
    protected abstract Pattern headerPattern();

    /**
     * Parses everything after the header.
     *
     * @param header successful match of {@link #headerPattern()}
     * @param cursor cursor positioned after the header
     * @return parsed diagram
     * @throws DiagramParseException on the first line that does not parse
     */
    protected abstract T parseBody(Matcher header, LineCursor cursor) throws DiagramParseException;

    /**
     * Matches a whole line against a pattern.
     *
     * @param pattern compiled pattern
     * @param line source line
     * @return the successful matcher, or null
     */
    protected Matcher matchLine(Pattern pattern, SourceLine line) {
        Matcher matcher = pattern.matcher(line.text());
        return matcher.matches() ? matcher : null;
    }

    /**
     * Trims text and removes one pair of surrounding double quotes.
     *
     * @param text raw text, may be null
     * @return cleaned text, empty for null
     */
    protected String unquote(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
