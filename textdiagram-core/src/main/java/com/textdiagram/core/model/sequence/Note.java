package com.textdiagram.core.model.sequence;

import java.util.List;
import java.util.Objects;

/**
 * Note attached to one or two participants.
 *
 * @param placement placement rule
 * @param participants anchor ids; two only for {@link NotePlacement#OVER}
 * @param text note text, may contain line breaks
 */
public record Note(NotePlacement placement, List<String> participants, String text) implements Statement {

    public Note {
        Objects.requireNonNull(placement, "placement must not be null");
        Objects.requireNonNull(participants, "participants must not be null");
        Objects.requireNonNull(text, "text must not be null");
        participants = List.copyOf(participants);
        if (participants.isEmpty() || participants.size() > 2) {
            throw new IllegalArgumentException("A note needs one or two participants: " + participants);
        }
        if (participants.size() == 2 && placement != NotePlacement.OVER) {
            throw new IllegalArgumentException("Only 'over' notes may span two participants");
        }
    }
}
