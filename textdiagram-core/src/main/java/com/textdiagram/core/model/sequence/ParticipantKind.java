package com.textdiagram.core.model.sequence;

/**
 * Declaration keyword of a participant. Both kinds render as a labelled box.
 */
public enum ParticipantKind {
    PARTICIPANT,
    ACTOR
}
