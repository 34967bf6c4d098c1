///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A predicate that selects the rows of a {@link TableModel} to which a transformation applies.
 * <p>
 * A selector is evaluated once, when the transformation is applied.
 * </p>
 */
@FunctionalInterface
public interface RowSelector {

    /**
     * Determines whether a row is selected.
     *
     * @param row
     *     The row
     *
     * @return {@code true}, if the row is selected.
     */
    boolean matches(Row row);

    /**
     * Gets the row identifiers that this selector names explicitly. Each one must exist in the model to which the
     * selector is applied.
     *
     * @return The identifiers. This is empty for selectors that don't name rows.
     */
    default Set<String> requiredIds() {
        return Set.of();
    }

    /**
     * Creates a selector that selects every row.
     *
     * @return A new selector
     */
    static RowSelector all() {
        return row -> true;
    }

    /**
     * Creates a selector for specific rows.
     *
     * @param rowIds
     *     The rows' identifiers. Applying the selector to a model without one of them fails with an
     *     {@link UnknownReferenceException}.
     *
     * @return A new selector
     */
    static RowSelector ids(String... rowIds) {
        return ids(List.of(rowIds));
    }

    /**
     * Creates a selector for specific rows.
     *
     * @param rowIds
     *     The rows' identifiers. Applying the selector to a model without one of them fails with an
     *     {@link UnknownReferenceException}.
     *
     * @return A new selector
     */
    static RowSelector ids(Collection<String> rowIds) {
        ArgumentUtil.checkNoNullElements(rowIds, "rowIds");
        final Set<String> ids = Collections.unmodifiableSet(new LinkedHashSet<>(rowIds));
        return new RowSelector() {
            @Override
            public boolean matches(Row row) {
                return ids.contains(row.id());
            }

            @Override
            public Set<String> requiredIds() {
                return ids;
            }
        };
    }

    /**
     * Creates a selector for the rows of a row group.
     *
     * @param groupLabel
     *     The row group's label
     *
     * @return A new selector
     */
    static RowSelector inGroup(String groupLabel) {
        ArgumentUtil.checkNotNull(groupLabel, "groupLabel");
        return row -> groupLabel.equals(row.group());
    }

    /**
     * Creates a selector for the rows with any of the given stub labels.
     *
     * @param stubs
     *     The stub labels
     *
     * @return A new selector
     */
    static RowSelector stub(String... stubs) {
        final Set<String> labels = Set.copyOf(List.of(stubs));
        return row -> labels.contains(row.stub());
    }

    /**
     * Creates a selector that selects the rows which this selector doesn't.
     *
     * @return A new selector
     */
    default RowSelector negate() {
        final RowSelector self = this;
        return new RowSelector() {
            @Override
            public boolean matches(Row row) {
                return !self.matches(row);
            }

            @Override
            public Set<String> requiredIds() {
                return self.requiredIds();
            }
        };
    }
}
