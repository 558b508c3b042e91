package com.textdiagram.core.model.sequence;

/**
 * One statement of a sequence diagram.
 *
 * <p>Implemented by the statement records of this package; layout code switches over the
 * concrete type.
 */
public interface Statement {
}
