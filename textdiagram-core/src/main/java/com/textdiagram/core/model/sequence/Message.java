package com.textdiagram.core.model.sequence;

import java.util.Objects;

/**
 * Message between two participants, or from a participant to itself.
 *
 * @param from sender id
 * @param to receiver id
 * @param arrow arrow decoration
 * @param text label, may contain line breaks
 * @param activateTarget {@code +} shorthand: activate the receiver before this message
 * @param deactivateSource {@code -} shorthand: deactivate the sender after this message
 */
public record Message(
    String from,
    String to,
    Arrow arrow,
    String text,
    boolean activateTarget,
    boolean deactivateSource
) implements Statement {

    public Message {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(arrow, "arrow must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public boolean isSelf() {
        return from.equals(to);
    }
}
