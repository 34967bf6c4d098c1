///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.List;
import java.util.Objects;

/**
 * A cell in a header row of a {@link Grid}, which may span several adjacent columns.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class HeaderCell {

    private final GridCell cell;
    private final int span;

    HeaderCell(String text, int span, List<String> marks) {
        this.cell = new GridCell(text, marks);
        this.span = span;
    }

    /**
     * Gets the text of this header cell.
     *
     * @return The text. This is blank over columns that have no spanner.
     */
    public String text() {
        return cell.text();
    }

    /**
     * Gets the number of columns that this header cell spans.
     *
     * @return The span, which is at least 1.
     */
    public int span() {
        return span;
    }

    /**
     * Gets the footnote marks attached to this header cell.
     *
     * @return An unmodifiable list of marks.
     */
    public List<String> marks() {
        return cell.marks();
    }

    @Override
    public int hashCode() {
        return Objects.hash(cell, span);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof HeaderCell otherCell)) {
            return false;
        }
        return cell.equals(otherCell.cell) && span == otherCell.span;
    }

    @Override
    public String toString() {
        return span == 1 ? cell.toString() : cell + "(" + span + ")";
    }
}
