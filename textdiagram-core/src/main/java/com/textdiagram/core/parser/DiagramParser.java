package com.textdiagram.core.parser;

/**
 * Turns diagram source text into an immutable AST.
 *
 * <p>Parsers are stateless and may be shared.
 *
 * @param <T> AST type produced
 */
public interface DiagramParser<T> {

    /**
     * Parses a complete diagram.
     *
     * @param source diagram source, starting with the diagram keyword
     * @return parsed diagram
     * @throws DiagramParseException if the source does not follow the grammar
     */
    T parse(String source) throws DiagramParseException;
}
