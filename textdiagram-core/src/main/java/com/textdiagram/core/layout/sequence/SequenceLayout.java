package com.textdiagram.core.layout.sequence;

import java.util.List;
import java.util.Objects;

/**
 * Computed geometry of a sequence diagram.
 *
 * <p>{@code activations} holds exactly one snapshot per row, in row order.
 *
 * @param participants participants in display order
 * @param rows body rows, top to bottom
 * @param activations activation snapshot for each row
 * @param destroyed per participant, whether a destroy row ends its lifeline
 * @param boxHeight height shared by all participant boxes
 * @param totalWidth columns needed by every element
 */
public record SequenceLayout(
    List<ParticipantLayout> participants,
    List<SequenceRow> rows,
    List<ActivationSnapshot> activations,
    List<Boolean> destroyed,
    int boxHeight,
    int totalWidth
) {

    public SequenceLayout {
        participants = List.copyOf(Objects.requireNonNull(participants, "participants must not be null"));
        rows = List.copyOf(Objects.requireNonNull(rows, "rows must not be null"));
        activations = List.copyOf(Objects.requireNonNull(activations, "activations must not be null"));
        destroyed = List.copyOf(Objects.requireNonNull(destroyed, "destroyed must not be null"));
        if (activations.size() != rows.size()) {
            throw new IllegalArgumentException("One activation snapshot per row required: "
                + activations.size() + " snapshots for " + rows.size() + " rows");
        }
    }

    public int bodyHeight() {
        return rows.stream().mapToInt(SequenceRow::height).sum();
    }

    public int totalHeight() {
        return 2 * boxHeight + bodyHeight();
    }
}
