package com.textdiagram.core.parser;

import com.textdiagram.core.DiagramException;

/**
 * Thrown when diagram source does not follow the expected grammar.
 */
public class DiagramParseException extends DiagramException {

    private static final int MAX_CONTEXT = 40;

    private final int lineNumber;

    /**
     * Creates an exception pointing at the offending source line.
     *
     * @param lineNumber 1-based line number
     * @param line offending line, shortened to 40 characters in the message
     */
    public DiagramParseException(int lineNumber, String line) {
        super("syntax error at line " + lineNumber + ": unexpected `" + shorten(line.trim()) + "`");
        this.lineNumber = lineNumber;
    }

    /**
     * Creates an exception with a custom message.
     *
     * @param lineNumber 1-based line number
     * @param line offending line
     * @param reason what was expected
     */
    public DiagramParseException(int lineNumber, String line, String reason) {
        super("syntax error at line " + lineNumber + ": " + reason + " near `" + shorten(line.trim()) + "`");
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    private static String shorten(String context) {
        return context.length() > MAX_CONTEXT ? context.substring(0, MAX_CONTEXT) + "..." : context;
    }
}
