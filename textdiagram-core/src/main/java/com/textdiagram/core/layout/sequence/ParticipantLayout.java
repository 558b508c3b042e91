package com.textdiagram.core.layout.sequence;

import java.util.Objects;

/**
 * Horizontal placement of one participant.
 *
 * @param id participant id
 * @param name display name, possibly shortened to fit a width budget
 * @param centerCol lifeline column
 * @param boxLeft leftmost box column
 * @param boxRight rightmost box column
 */
public record ParticipantLayout(String id, String name, int centerCol, int boxLeft, int boxRight) {

    public ParticipantLayout {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (centerCol < boxLeft || centerCol > boxRight) {
            throw new IllegalArgumentException("Center " + centerCol + " outside box " + boxLeft + ".." + boxRight);
        }
    }

    public int width() {
        return boxRight - boxLeft + 1;
    }

    ParticipantLayout shifted(int offset) {
        return new ParticipantLayout(id, name, centerCol + offset, boxLeft + offset, boxRight + offset);
    }
}
