///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.List;
import java.util.Objects;

/**
 * A label in the table header that spans a set of columns.
 * <p>
 * Level 1 spanners sit directly above the column labels; spanners at higher levels sit above those.
 * </p>
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class Spanner {

    private final String label;
    private final int level;
    private final List<String> columnIds;

    Spanner(String label, int level, List<String> columnIds) {
        this.label = label;
        this.level = level;
        this.columnIds = List.copyOf(columnIds);
    }

    /**
     * Gets the text of this spanner.
     *
     * @return The label
     */
    public String label() {
        return label;
    }

    /**
     * Gets the header level of this spanner.
     *
     * @return The level, which is at least 1.
     */
    public int level() {
        return level;
    }

    /**
     * Gets the columns under this spanner.
     *
     * @return An unmodifiable list of column identifiers.
     */
    public List<String> columnIds() {
        return columnIds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, level, columnIds);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Spanner otherSpanner)) {
            return false;
        }
        return label.equals(otherSpanner.label) &&
            level == otherSpanner.level &&
            columnIds.equals(otherSpanner.columnIds);
    }

    @Override
    public String toString() {
        return label + columnIds;
    }
}
