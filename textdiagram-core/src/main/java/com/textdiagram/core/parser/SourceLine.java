package com.textdiagram.core.parser;

/**
 * One meaningful line of diagram source.
 *
 * @param number 1-based line number in the original source
 * @param text line content with surrounding whitespace removed
 */
public record SourceLine(int number, String text) {
}
