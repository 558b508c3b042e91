package com.textdiagram.core.model.er;

/**
 * Relationship end cardinality, with the crow's-foot notation for each side.
 */
public enum Cardinality {
    EXACTLY_ONE("||", "||"),
    ZERO_OR_ONE("o|", "|o"),
    ONE_OR_MANY("}|", "|{"),
    ZERO_OR_MANY("}o", "o{");

    private final String leftSymbol;
    private final String rightSymbol;

    Cardinality(String leftSymbol, String rightSymbol) {
        this.leftSymbol = leftSymbol;
        this.rightSymbol = rightSymbol;
    }

    /** Notation when written left of {@code --}. */
    public String leftSymbol() {
        return leftSymbol;
    }

    /** Notation when written right of {@code --}. */
    public String rightSymbol() {
        return rightSymbol;
    }

    /**
     * Resolves the notation left of {@code --}.
     *
     * @param symbol two-character notation
     * @return matching cardinality, or null if unknown
     */
    public static Cardinality fromLeft(String symbol) {
        for (Cardinality c : values()) {
            if (c.leftSymbol.equals(symbol)) {
                return c;
            }
        }
        return null;
    }

    /**
     * Resolves the notation right of {@code --}.
     *
     * @param symbol two-character notation
     * @return matching cardinality, or null if unknown
     */
    public static Cardinality fromRight(String symbol) {
        for (Cardinality c : values()) {
            if (c.rightSymbol.equals(symbol)) {
                return c;
            }
        }
        return null;
    }
}
