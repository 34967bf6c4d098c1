///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.Objects;

/**
 * A column of a {@link TableModel}.
 * <p>
 * Instances of this class are immutable.  A transformation that changes a column replaces it in the model.
 * </p>
 */
public final class Column {

    private final String id;
    private final String label;
    private final int width;
    private final Alignment alignment;
    private final boolean merged;
    private final boolean hidden;

    Column(String id, String label, int width, Alignment alignment, boolean merged, boolean hidden) {
        this.id = id;
        this.label = label;
        this.width = width;
        this.alignment = alignment;
        this.merged = merged;
        this.hidden = hidden;
    }

    /**
     * Gets this column's identifier, which is unique within its model.
     *
     * @return The identifier. This is never {@code null}.
     */
    public String id() {
        return id;
    }

    /**
     * Gets the text in this column's header.
     *
     * @return The label. This may be blank but never {@code null}.
     */
    public String label() {
        return label;
    }

    /**
     * Gets this column's width in characters.
     *
     * @return The width, or 0 if no width was set.
     */
    public int width() {
        return width;
    }

    /**
     * Gets this column's alignment.
     *
     * @return The alignment. This is never {@code null}.
     */
    public Alignment alignment() {
        return alignment;
    }

    /**
     * Gets whether this is a synthetic column whose values are produced by merging other columns.
     *
     * @return {@code true}, if this column was created by {@link TableModel#mergeColumns}.
     */
    public boolean isMerged() {
        return merged;
    }

    /**
     * Gets whether this column was explicitly hidden with {@link TableModel#hideColumns}.  Columns that are consumed by
     * a merge are also left out of a rendered grid, even though they aren't explicitly hidden.
     *
     * @return {@code true}, if this column was explicitly hidden.
     */
    public boolean isHidden() {
        return hidden;
    }

    Column withLabel(String newLabel) {
        return new Column(id, newLabel, width, alignment, merged, hidden);
    }

    Column withWidth(int newWidth) {
        return new Column(id, label, newWidth, alignment, merged, hidden);
    }

    Column withAlignment(Alignment newAlignment) {
        return new Column(id, label, width, newAlignment, merged, hidden);
    }

    Column withHidden(boolean newHidden) {
        return new Column(id, label, width, alignment, merged, newHidden);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, width, alignment, merged, hidden);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Column otherColumn)) {
            return false;
        }
        return id.equals(otherColumn.id) &&
            label.equals(otherColumn.label) &&
            width == otherColumn.width &&
            alignment == otherColumn.alignment &&
            merged == otherColumn.merged &&
            hidden == otherColumn.hidden;
    }

    @Override
    public String toString() {
        return id;
    }
}
