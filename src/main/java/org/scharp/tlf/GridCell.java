///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.List;
import java.util.Objects;

/**
 * The finalized text of a cell in a {@link Grid}, with the marks of the footnotes attached to it.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class GridCell {

    private final String text;
    private final List<String> marks;

    GridCell(String text, List<String> marks) {
        this.text = text;
        this.marks = List.copyOf(marks);
    }

    /**
     * Gets the text of this cell.
     *
     * @return The text. This may be blank but never {@code null}.
     */
    public String text() {
        return text;
    }

    /**
     * Gets the footnote marks attached to this cell, in declaration order.
     *
     * @return An unmodifiable list of marks.
     */
    public List<String> marks() {
        return marks;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, marks);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof GridCell otherCell)) {
            return false;
        }
        return text.equals(otherCell.text) && marks.equals(otherCell.marks);
    }

    /**
     * Gets this cell as plain text, with its marks in superscript-style brackets.
     *
     * @return The text followed by the marks, for example "Age^a,b".
     */
    @Override
    public String toString() {
        if (marks.isEmpty()) {
            return text;
        }
        return text + "^" + String.join(",", marks);
    }
}
