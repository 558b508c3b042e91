package com.textdiagram.core.model.sequence;

import java.util.List;
import java.util.Objects;

/**
 * Framed block with a body and, for branching kinds, divider branches.
 *
 * @param kind block kind
 * @param label text after the keyword, may be empty
 * @param body statements before the first divider
 * @param branches divider branches in source order
 */
public record Block(BlockKind kind, String label, List<Statement> body, List<Branch> branches) implements Statement {

    public Block {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(body, "body must not be null");
        branches = branches == null ? List.of() : List.copyOf(branches);
        body = List.copyOf(body);
        if (!kind.hasBranches() && !branches.isEmpty()) {
            throw new IllegalArgumentException(kind.keyword() + " blocks cannot have branches");
        }
    }

    /**
     * Returns the text drawn in the start border, e.g. {@code loop Check}.
     *
     * @return frame title
     */
    public String title() {
        return label.isEmpty() ? kind.keyword() : kind.keyword() + " " + label;
    }

    /**
     * Returns the text drawn in a divider border, e.g. {@code else Sad}.
     *
     * @param branch one of this block's branches
     * @return divider title
     */
    public String dividerTitle(Branch branch) {
        return branch.label().isEmpty() ? kind.dividerKeyword() : kind.dividerKeyword() + " " + branch.label();
    }
}
