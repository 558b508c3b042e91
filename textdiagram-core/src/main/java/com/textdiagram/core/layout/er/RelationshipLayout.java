package com.textdiagram.core.layout.er;

import com.textdiagram.core.model.er.Relationship;

import java.util.Objects;

/**
 * Routed relationship line with its label position.
 *
 * <p>A line between entities of different ranks leaves the right border of the left entity on
 * {@code leftRow} and enters the left border of the right entity on {@code rightRow}. When the
 * rows differ it turns in {@code turnColumn}. Every relationship touching one side of an
 * entity has a row of its own there.
 *
 * <p>Entities of one rank are joined by a vertical line in {@code turnColumn}, from the bottom
 * border of the upper entity ({@code left}) to the top border of the lower one ({@code right}).
 *
 * @param relationship parsed relationship
 * @param route shape of the line
 * @param left left entity, or the upper one of a stacked pair
 * @param right right entity, or the lower one of a stacked pair
 * @param leftRow row the line leaves the left entity on
 * @param rightRow row the line enters the right entity on
 * @param turnColumn column of the vertical run, {@link #NO_TURN} for straight lines
 * @param labelRow row of the label
 * @param labelColumn first column of the label
 */
public record RelationshipLayout(
    Relationship relationship,
    Route route,
    String left,
    String right,
    int leftRow,
    int rightRow,
    int turnColumn,
    int labelRow,
    int labelColumn
) {

    public static final int NO_TURN = -1;

    /** Shape of a relationship line. */
    public enum Route {
        STRAIGHT,
        ELBOW,
        STACKED
    }

    public RelationshipLayout {
        Objects.requireNonNull(relationship, "relationship must not be null");
        Objects.requireNonNull(route, "route must not be null");
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }

    /**
     * Checks whether the relationship was declared from the left entity to the right one.
     *
     * @return false when the line is drawn against the declaration order
     */
    public boolean declaredLeftToRight() {
        return relationship.from().equals(left);
    }

    /** Cardinality symbol written next to the left entity. */
    public String leftSymbol() {
        return declaredLeftToRight()
            ? relationship.leftCardinality().leftSymbol()
            : relationship.rightCardinality().leftSymbol();
    }

    /** Cardinality symbol written next to the right entity. */
    public String rightSymbol() {
        return declaredLeftToRight()
            ? relationship.rightCardinality().rightSymbol()
            : relationship.leftCardinality().rightSymbol();
    }
}
