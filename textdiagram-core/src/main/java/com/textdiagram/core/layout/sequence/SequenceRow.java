package com.textdiagram.core.layout.sequence;

/**
 * One horizontal band of a sequence diagram body, stacked top to bottom.
 */
public interface SequenceRow {

    /**
     * Returns the number of text rows this band occupies.
     *
     * @return row count, at least 1
     */
    int height();

    /**
     * Returns the rightmost column this band draws into.
     *
     * @return rightmost column, or -1 if the band draws only on lifelines
     */
    int rightExtent();

    /**
     * Returns a copy moved right by {@code offset} columns.
     *
     * @param offset column offset
     * @return shifted row
     */
    SequenceRow shifted(int offset);
}
