package com.textdiagram.core.model.sequence;

import java.util.Objects;

/**
 * Message arrow decoration.
 *
 * @param lineStyle solid or dotted
 * @param head end decoration
 */
public record Arrow(LineStyle lineStyle, ArrowHead head) {

    public Arrow {
        Objects.requireNonNull(lineStyle, "lineStyle must not be null");
        Objects.requireNonNull(head, "head must not be null");
    }
}
