package com.textdiagram.core.layout;

import com.textdiagram.core.DiagramException;

import java.util.OptionalInt;

/**
 * Thrown when no layout can be produced for a parsed diagram.
 */
public class LayoutException extends DiagramException {

    /** Why the layout failed. */
    public enum Reason {
        /** The diagram has no participants, nodes or entities. */
        EMPTY_DIAGRAM,
        /** The requested maximum width cannot be met. */
        INFEASIBLE_WIDTH,
        /** The diagram contains structure that width fitting does not handle. */
        UNSUPPORTED_SHAPE
    }

    private final Reason reason;
    private final int minimumWidth;

    public LayoutException(Reason reason, String message) {
        this(reason, message, -1);
    }

    /**
     * @param reason failure category
     * @param message human readable description
     * @param minimumWidth smallest width known to work, or -1 if unknown
     */
    public LayoutException(Reason reason, String message, int minimumWidth) {
        super(message);
        this.reason = reason;
        this.minimumWidth = minimumWidth;
    }

    public static LayoutException empty(String what) {
        return new LayoutException(Reason.EMPTY_DIAGRAM, "no " + what + " found");
    }

    public static LayoutException tooWide(int minimumWidth, int maxWidth) {
        return new LayoutException(Reason.INFEASIBLE_WIDTH,
            "diagram too wide: needs at least " + minimumWidth + " columns, max is " + maxWidth, minimumWidth);
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the smallest width the diagram was seen to need, when known.
     *
     * @return minimum width, or empty
     */
    public OptionalInt getMinimumWidth() {
        return minimumWidth >= 0 ? OptionalInt.of(minimumWidth) : OptionalInt.empty();
    }
}
