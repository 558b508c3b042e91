package com.textdiagram.core.model.sequence;

import java.util.List;
import java.util.Objects;

/**
 * Divider branch of an {@code alt}, {@code par} or {@code critical} block.
 *
 * @param label text after the divider keyword, may be empty
 * @param body statements of the branch
 */
public record Branch(String label, List<Statement> body) {

    public Branch {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(body, "body must not be null");
        body = List.copyOf(body);
    }
}
