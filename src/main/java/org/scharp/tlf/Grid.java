///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A rendered table: the finalized text of every header and body cell, with layout metadata and footnotes.
 * <p>
 * This is what a writer for a display format (HTML, RTF, PDF, plain text) consumes. Writers must present the header
 * rows, body rows, and footnotes in the order given here.
 * </p>
 * <p>
 * Instances of this class are immutable.  They are created by {@link Renderer#render(TableModel)}.
 * </p>
 */
public final class Grid {

    private final String title;
    private final String subtitle;
    private final String stubHeader;
    private final List<List<HeaderCell>> headerRows;
    private final List<GridColumn> columns;
    private final List<GridRow> body;
    private final Map<String, String> footnotes;

    Grid(String title, String subtitle, String stubHeader, List<List<HeaderCell>> headerRows,
        List<GridColumn> columns, List<GridRow> body, Map<String, String> footnotes) {
        this.title = title;
        this.subtitle = subtitle;
        this.stubHeader = stubHeader;
        List<List<HeaderCell>> headerRowsCopy = new ArrayList<>(headerRows.size());
        for (List<HeaderCell> headerRow : headerRows) {
            headerRowsCopy.add(List.copyOf(headerRow));
        }
        this.headerRows = Collections.unmodifiableList(headerRowsCopy);
        this.columns = List.copyOf(columns);
        this.body = List.copyOf(body);
        this.footnotes = Collections.unmodifiableMap(new LinkedHashMap<>(footnotes));
    }

    /**
     * Gets the table's title.
     *
     * @return The title. This is blank if the table has no title.
     */
    public String title() {
        return title;
    }

    /**
     * Gets the table's subtitle.
     *
     * @return The subtitle. This is blank if the table has no subtitle.
     */
    public String subtitle() {
        return subtitle;
    }

    /**
     * Gets the label above the stub column.
     *
     * @return The label. This may be blank.
     */
    public String stubHeader() {
        return stubHeader;
    }

    /**
     * Gets the header rows, from top to bottom.  There is one row per spanner level, with the highest level first,
     * followed by the row of column labels.  The cells in each row span all visible columns (not the stub).
     *
     * @return An unmodifiable list of header rows.
     */
    public List<List<HeaderCell>> headerRows() {
        return headerRows;
    }

    /**
     * Gets the visible columns, in display order.
     *
     * @return An unmodifiable list of column layouts.
     */
    public List<GridColumn> columns() {
        return columns;
    }

    /**
     * Gets the body rows, from top to bottom, including row group headers.
     *
     * @return An unmodifiable list of body rows.
     */
    public List<GridRow> body() {
        return body;
    }

    /**
     * Gets the footnotes, keyed by mark, in declaration order.
     *
     * @return An unmodifiable map of mark to footnote text.
     */
    public Map<String, String> footnotes() {
        return footnotes;
    }

    /**
     * Gets the data row that was rendered from a model row.
     *
     * @param rowId
     *     The identifier of the model row
     *
     * @return The row, or {@code null} if there's no data row for {@code rowId}.
     */
    public GridRow row(String rowId) {
        for (GridRow row : body) {
            if (row.kind() == GridRow.Kind.DATA && row.rowId().equals(rowId)) {
                return row;
            }
        }
        return null;
    }

    /**
     * Gets the text of a body cell.
     *
     * @param rowId
     *     The identifier of the model row
     * @param columnId
     *     The identifier of a visible column
     *
     * @return The cell's text
     *
     * @throws UnknownReferenceException
     *     if there's no data row for {@code rowId} or no visible column for {@code columnId}.
     */
    public String text(String rowId, String columnId) {
        GridRow row = row(rowId);
        if (row == null) {
            throw new UnknownReferenceException("row", rowId);
        }
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).id().equals(columnId)) {
                return row.cells().get(i).text();
            }
        }
        throw new UnknownReferenceException("column", columnId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, subtitle, stubHeader, headerRows, columns, body, footnotes);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Grid otherGrid)) {
            return false;
        }
        return title.equals(otherGrid.title) &&
            subtitle.equals(otherGrid.subtitle) &&
            stubHeader.equals(otherGrid.stubHeader) &&
            headerRows.equals(otherGrid.headerRows) &&
            columns.equals(otherGrid.columns) &&
            body.equals(otherGrid.body) &&
            footnotes.equals(otherGrid.footnotes);
    }

    /**
     * Gets a plain-text dump of this grid, one line per title, header row, body row, and footnote.
     * <p>
     * This is meant for debugging and tests. The same grid always produces the same text.
     * </p>
     *
     * @return This grid as text
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (!title.isEmpty()) {
            builder.append(title).append('\n');
        }
        if (!subtitle.isEmpty()) {
            builder.append(subtitle).append('\n');
        }
        for (int i = 0; i < headerRows.size(); i++) {
            // The stub header is only written next to the column labels.
            builder.append(i == headerRows.size() - 1 ? stubHeader : "");
            for (HeaderCell cell : headerRows.get(i)) {
                builder.append(" | ").append(cell);
            }
            builder.append('\n');
        }
        for (GridRow row : body) {
            builder.append(row).append('\n');
        }
        for (Map.Entry<String, String> footnote : footnotes.entrySet()) {
            builder.append(footnote.getKey()).append(' ').append(footnote.getValue()).append('\n');
        }
        return builder.toString();
    }
}
