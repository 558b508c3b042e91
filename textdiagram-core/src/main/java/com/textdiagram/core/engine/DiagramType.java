package com.textdiagram.core.engine;

import java.util.Locale;
import java.util.Objects;

/**
 * Kinds of diagram source this library can draw.
 */
public enum DiagramType {
    /** Participants exchanging messages along vertical lifelines */
    SEQUENCE("sequenceDiagram"),

    /** Nodes and directed edges, laid out top-down or left-right */
    FLOWCHART("flowchart"),

    /** Entities with attributes and cardinality-annotated relationships */
    ER("erDiagram");

    private final String keyword;

    DiagramType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the header keyword that introduces this kind of diagram.
     *
     * @return header keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Detects the diagram type from the first meaningful line of the source.
     *
     * <p>Blank lines and {@code %%} comments are skipped. {@code graph} and {@code flowchart}
     * select {@link #FLOWCHART}, {@code erDiagram} selects {@link #ER}; anything else is
     * treated as a sequence diagram.
     *
     * @param source diagram source
     * @return detected type, never null
     */
    public static DiagramType detect(String source) {
        Objects.requireNonNull(source, "source must not be null");
        String keyword = firstKeyword(source);
        return switch (keyword.toLowerCase(Locale.ROOT)) {
            case "graph", "flowchart" -> FLOWCHART;
            case "erdiagram" -> ER;
            default -> SEQUENCE;
        };
    }

    private static String firstKeyword(String source) {
        for (String line : source.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("%%")) {
                continue;
            }
            String[] tokens = trimmed.split("\\s+", 2);
            return tokens[0];
        }
        return "";
    }
}
