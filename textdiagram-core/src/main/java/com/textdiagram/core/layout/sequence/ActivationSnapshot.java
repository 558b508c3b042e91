package com.textdiagram.core.layout.sequence;

import java.util.List;
import java.util.Objects;

/**
 * Which participants are active while one row is drawn.
 *
 * @param active one flag per participant, in participant order
 */
public record ActivationSnapshot(List<Boolean> active) {

    public ActivationSnapshot {
        active = List.copyOf(Objects.requireNonNull(active, "active must not be null"));
    }

    public boolean isActive(int participantIndex) {
        return participantIndex >= 0 && participantIndex < active.size() && active.get(participantIndex);
    }
}
