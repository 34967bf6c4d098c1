///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A predicate that selects the columns of a {@link TableModel} to which a transformation applies.
 * <p>
 * A selector is evaluated once, when the transformation is applied.  Columns added afterwards are not affected.
 * </p>
 */
@FunctionalInterface
public interface ColumnSelector {

    /**
     * Determines whether a column is selected.
     *
     * @param column
     *     The column
     *
     * @return {@code true}, if the column is selected.
     */
    boolean matches(Column column);

    /**
     * Gets the column identifiers that this selector names explicitly. Each one must exist in the model to which the
     * selector is applied.
     *
     * @return The identifiers. This is empty for selectors that don't name columns.
     */
    default Set<String> requiredIds() {
        return Set.of();
    }

    /**
     * Creates a selector that selects every column.
     *
     * @return A new selector
     */
    static ColumnSelector all() {
        return column -> true;
    }

    /**
     * Creates a selector for specific columns.
     *
     * @param columnIds
     *     The columns' identifiers. Applying the selector to a model without one of them fails with an
     *     {@link UnknownReferenceException}.
     *
     * @return A new selector
     */
    static ColumnSelector ids(String... columnIds) {
        return ids(List.of(columnIds));
    }

    /**
     * Creates a selector for specific columns.
     *
     * @param columnIds
     *     The columns' identifiers. Applying the selector to a model without one of them fails with an
     *     {@link UnknownReferenceException}.
     *
     * @return A new selector
     */
    static ColumnSelector ids(Collection<String> columnIds) {
        ArgumentUtil.checkNoNullElements(columnIds, "columnIds");
        final Set<String> ids = Collections.unmodifiableSet(new LinkedHashSet<>(columnIds));
        return new ColumnSelector() {
            @Override
            public boolean matches(Column column) {
                return ids.contains(column.id());
            }

            @Override
            public Set<String> requiredIds() {
                return ids;
            }
        };
    }

    /**
     * Creates a selector for the columns whose identifiers start with a prefix, for example "pct_" to select the
     * percentage of every group.
     *
     * @param prefix
     *     The prefix
     *
     * @return A new selector
     */
    static ColumnSelector prefix(String prefix) {
        ArgumentUtil.checkNotNull(prefix, "prefix");
        return column -> column.id().startsWith(prefix);
    }

    /**
     * Creates a selector for the columns whose current labels are any of the given labels.  This selects the columns
     * under a label after {@link TableModel#relabelColumns} has been applied, for example every "n" column.
     *
     * @param labels
     *     The labels
     *
     * @return A new selector
     */
    static ColumnSelector labelled(String... labels) {
        ArgumentUtil.checkNotNull(labels, "labels");
        ArgumentUtil.checkNoNullElements(Arrays.asList(labels), "labels");
        final Set<String> labelSet = new HashSet<>(Arrays.asList(labels));
        return column -> labelSet.contains(column.label());
    }

    /**
     * Creates a selector that selects the columns that either this or another selector selects.
     *
     * @param other
     *     The other selector
     *
     * @return A new selector
     */
    default ColumnSelector or(ColumnSelector other) {
        ArgumentUtil.checkNotNull(other, "other");
        final ColumnSelector self = this;
        return new ColumnSelector() {
            @Override
            public boolean matches(Column column) {
                return self.matches(column) || other.matches(column);
            }

            @Override
            public Set<String> requiredIds() {
                Set<String> ids = new LinkedHashSet<>(self.requiredIds());
                ids.addAll(other.requiredIds());
                return ids;
            }
        };
    }
}
