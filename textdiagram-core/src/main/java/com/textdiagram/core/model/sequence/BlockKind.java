package com.textdiagram.core.model.sequence;

/**
 * Kinds of framed blocks.
 */
public enum BlockKind {
    LOOP("loop", null),
    OPT("opt", null),
    BREAK("break", null),
    RECT("rect", null),
    ALT("alt", "else"),
    PAR("par", "and"),
    CRITICAL("critical", "option");

    private final String keyword;
    private final String dividerKeyword;

    BlockKind(String keyword, String dividerKeyword) {
        this.keyword = keyword;
        this.dividerKeyword = dividerKeyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Returns the keyword that starts a new branch, e.g. {@code else} for {@code alt}.
     *
     * @return divider keyword, or null if the block has no branches
     */
    public String dividerKeyword() {
        return dividerKeyword;
    }

    public boolean hasBranches() {
        return dividerKeyword != null;
    }
}
