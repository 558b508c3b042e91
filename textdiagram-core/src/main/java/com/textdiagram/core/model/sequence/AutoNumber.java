package com.textdiagram.core.model.sequence;

/**
 * {@code autonumber}: number every message of the diagram.
 */
public record AutoNumber() implements Statement {
}
