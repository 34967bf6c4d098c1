///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.Map;
import java.util.Objects;

/**
 * A row of a {@link TableModel}, with the values that were bound to it.
 * <p>
 * Instances of this class are immutable.  A transformation that changes a row replaces it in the model.
 * </p>
 */
public final class Row {

    private final String id;
    private final String stub;
    private final int indent;
    private final String group;
    private final Map<String, Object> values;

    Row(String id, String stub, int indent, String group, Map<String, Object> values) {
        this.id = id;
        this.stub = stub;
        this.indent = indent;
        this.group = group;
        this.values = values;
    }

    /**
     * Gets this row's identifier, which is unique within its model.
     *
     * @return The identifier, for example "row1".
     */
    public String id() {
        return id;
    }

    /**
     * Gets the text that identifies this row in the stub.
     *
     * @return The stub label. This is never {@code null}.
     */
    public String stub() {
        return stub;
    }

    /**
     * Gets the number of levels by which this row's stub is indented.
     *
     * @return The indentation level; 0 means not indented.
     */
    public int indent() {
        return indent;
    }

    /**
     * Gets the label of the row group to which this row belongs.
     *
     * @return The group's label, or {@code null} if the row isn't in a group.
     */
    public String group() {
        return group;
    }

    /**
     * Gets the underlying value of a data column in this row.
     *
     * @param columnId
     *     The column's identifier
     *
     * @return The value, or {@link MissingValue#NOT_APPLICABLE} if this row has no value for the column.
     */
    public Object value(String columnId) {
        Object value = values.get(columnId);
        return value == null ? MissingValue.NOT_APPLICABLE : value;
    }

    /**
     * Gets all underlying values of this row.
     *
     * @return An unmodifiable map of column identifier to value.
     */
    public Map<String, Object> values() {
        return values;
    }

    Row withIndent(int newIndent) {
        return new Row(id, stub, newIndent, group, values);
    }

    Row withGroup(String newGroup) {
        return new Row(id, stub, indent, newGroup, values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, stub, indent, group, values);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Row otherRow)) {
            return false;
        }
        return id.equals(otherRow.id) &&
            stub.equals(otherRow.stub) &&
            indent == otherRow.indent &&
            Objects.equals(group, otherRow.group) &&
            values.equals(otherRow.values);
    }

    @Override
    public String toString() {
        return id + " " + stub;
    }
}
