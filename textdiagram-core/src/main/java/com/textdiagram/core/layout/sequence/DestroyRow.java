package com.textdiagram.core.layout.sequence;

/**
 * Destroy marker on a participant's lifeline; the lifeline ends here.
 *
 * @param participantIndex destroyed participant
 * @param col lifeline column
 */
public record DestroyRow(int participantIndex, int col) implements SequenceRow {

    @Override
    public int height() {
        return 1;
    }

    @Override
    public int rightExtent() {
        return -1;
    }

    @Override
    public DestroyRow shifted(int offset) {
        return new DestroyRow(participantIndex, col + offset);
    }
}
