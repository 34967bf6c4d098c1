///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.List;
import java.util.Objects;

/**
 * Where a footnote's mark is placed in a rendered table.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class FootnoteLocation {

    /**
     * The parts of a table that can carry a footnote mark.
     */
    public enum Kind {
        /** The labels of one or more columns. */
        COLUMN_HEADER,

        /** The stub label of a row. */
        STUB,

        /** A single body cell. */
        CELL,
    }

    private final Kind kind;
    private final String rowId;
    private final List<String> columnIds;

    private FootnoteLocation(Kind kind, String rowId, List<String> columnIds) {
        this.kind = kind;
        this.rowId = rowId;
        this.columnIds = List.copyOf(columnIds);
    }

    /**
     * Creates a location on the labels of some columns.
     *
     * @param columnIds
     *     The identifiers of the columns
     *
     * @return A new location
     *
     * @throws NullPointerException
     *     if {@code columnIds} is {@code null} or contains {@code null}.
     * @throws IllegalArgumentException
     *     if {@code columnIds} is empty.
     */
    public static FootnoteLocation columnHeaders(String... columnIds) {
        ArgumentUtil.checkNotNull(columnIds, "columnIds");
        ArgumentUtil.checkNoNullElements(List.of(columnIds), "columnIds");
        if (columnIds.length == 0) {
            throw new IllegalArgumentException("columnIds must not be empty");
        }
        return new FootnoteLocation(Kind.COLUMN_HEADER, null, List.of(columnIds));
    }

    /**
     * Creates a location on the stub label of a row.
     *
     * @param rowId
     *     The identifier of the row
     *
     * @return A new location
     *
     * @throws NullPointerException
     *     if {@code rowId} is {@code null}.
     */
    public static FootnoteLocation stub(String rowId) {
        ArgumentUtil.checkNotNull(rowId, "rowId");
        return new FootnoteLocation(Kind.STUB, rowId, List.of());
    }

    /**
     * Creates a location on a body cell.
     *
     * @param rowId
     *     The identifier of the cell's row
     * @param columnId
     *     The identifier of the cell's column
     *
     * @return A new location
     *
     * @throws NullPointerException
     *     if {@code rowId} or {@code columnId} is {@code null}.
     */
    public static FootnoteLocation cell(String rowId, String columnId) {
        ArgumentUtil.checkNotNull(rowId, "rowId");
        ArgumentUtil.checkNotNull(columnId, "columnId");
        return new FootnoteLocation(Kind.CELL, rowId, List.of(columnId));
    }

    /**
     * Gets the kind of this location.
     *
     * @return The kind
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Gets the row of this location.
     *
     * @return The row's identifier, or {@code null} for a {@link Kind#COLUMN_HEADER} location.
     */
    public String rowId() {
        return rowId;
    }

    /**
     * Gets the columns of this location.
     *
     * @return An unmodifiable list of column identifiers. This is empty for a {@link Kind#STUB} location.
     */
    public List<String> columnIds() {
        return columnIds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, rowId, columnIds);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FootnoteLocation otherLocation)) {
            return false;
        }
        return kind == otherLocation.kind &&
            Objects.equals(rowId, otherLocation.rowId) &&
            columnIds.equals(otherLocation.columnIds);
    }

    @Override
    public String toString() {
        return kind + (rowId == null ? "" : " " + rowId) + " " + columnIds;
    }
}
