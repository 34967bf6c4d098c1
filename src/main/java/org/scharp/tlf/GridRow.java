///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A row in the body of a {@link Grid}: either a row group's header or a data row.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class GridRow {

    /**
     * The kinds of body rows.
     */
    public enum Kind {
        /** The label of a row group, which precedes the group's data rows. */
        GROUP_HEADER,

        /** A row of data. */
        DATA,
    }

    private final Kind kind;
    private final String rowId;
    private final GridCell stub;
    private final int indent;
    private final List<GridCell> cells;

    GridRow(Kind kind, String rowId, GridCell stub, int indent, List<GridCell> cells) {
        this.kind = kind;
        this.rowId = rowId;
        this.stub = stub;
        this.indent = indent;
        this.cells = List.copyOf(cells);
    }

    /**
     * Gets the kind of this row.
     *
     * @return The kind
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Gets the identifier of the model row.
     *
     * @return The identifier, or {@code null} for a group header.
     */
    public String rowId() {
        return rowId;
    }

    /**
     * Gets the stub cell, which holds the row's label (or the group's label for a group header).
     *
     * @return The stub cell
     */
    public GridCell stub() {
        return stub;
    }

    /**
     * Gets the indentation level of the stub.
     *
     * @return The indentation level; 0 means not indented.
     */
    public int indent() {
        return indent;
    }

    /**
     * Gets the cells of this row, one per visible column.
     *
     * @return An unmodifiable list of cells. This is empty for a group header.
     */
    public List<GridCell> cells() {
        return cells;
    }

    /**
     * Gets the texts of this row's cells.
     *
     * @return A new list with the text of each cell, without footnote marks.
     */
    public List<String> texts() {
        List<String> texts = new ArrayList<>(cells.size());
        for (GridCell cell : cells) {
            texts.add(cell.text());
        }
        return texts;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, rowId, stub, indent, cells);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof GridRow otherRow)) {
            return false;
        }
        return kind == otherRow.kind &&
            Objects.equals(rowId, otherRow.rowId) &&
            stub.equals(otherRow.stub) &&
            indent == otherRow.indent &&
            cells.equals(otherRow.cells);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("  ".repeat(indent)).append(stub);
        for (GridCell cell : cells) {
            builder.append(" | ").append(cell);
        }
        return builder.toString();
    }
}
