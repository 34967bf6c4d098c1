///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.Objects;

/**
 * The layout of a visible column in a {@link Grid}.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class GridColumn {

    private final String id;
    private final int width;
    private final Alignment alignment;

    GridColumn(String id, int width, Alignment alignment) {
        this.id = id;
        this.width = width;
        this.alignment = alignment;
    }

    /**
     * Gets the identifier of the model column.
     *
     * @return The identifier
     */
    public String id() {
        return id;
    }

    /**
     * Gets the column's width in characters.
     *
     * @return The width, or 0 if no width was set.
     */
    public int width() {
        return width;
    }

    /**
     * Gets the column's alignment.
     *
     * @return The alignment
     */
    public Alignment alignment() {
        return alignment;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, width, alignment);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof GridColumn otherColumn)) {
            return false;
        }
        return id.equals(otherColumn.id) && width == otherColumn.width && alignment == otherColumn.alignment;
    }

    @Override
    public String toString() {
        return id + " " + alignment + (width == 0 ? "" : " " + width);
    }
}
