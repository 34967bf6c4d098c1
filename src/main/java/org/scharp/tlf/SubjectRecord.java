///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The data collected for one trial subject: the group (treatment arm) to which the subject was assigned and the
 * subject's value for each variable.
 * <p>
 * Instances of this class are immutable.
 * </p>
 * <p>
 * Values are keyed by {@link Variable#name()}.  A value for a categorical variable may be any object; its category is
 * its {@code toString()}. A value for a continuous variable must be a {@link Number}.  A value that is absent,
 * {@code null}, a {@link MissingValue}, or NaN is missing.
 * </p>
 */
public final class SubjectRecord {

    private final String group;
    private final Map<String, Object> values;

    /**
     * Creates a new subject record.
     *
     * @param group
     *     The group to which the subject belongs, for example "Placebo".
     * @param values
     *     The subject's values, keyed by variable name. This map is copied, so subsequent changes to it do not change
     *     the record. It may contain {@code null} values.
     *
     * @throws NullPointerException
     *     if {@code group} or {@code values} is {@code null}, or if {@code values} has a {@code null} key.
     */
    public SubjectRecord(String group, Map<String, ?> values) {
        ArgumentUtil.checkNotNull(group, "group");
        ArgumentUtil.checkNotNull(values, "values");
        ArgumentUtil.checkNoNullElements(values.keySet(), "values keys");

        this.group = group;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Gets the group to which this subject belongs.
     *
     * @return The group. This is never {@code null}.
     */
    public String group() {
        return group;
    }

    /**
     * Gets this subject's value for a variable.
     *
     * @param variableName
     *     The variable's name.
     *
     * @return The value, or {@code null} if this subject has no value for the variable.
     */
    public Object value(String variableName) {
        return values.get(variableName);
    }

    /**
     * Gets all values in this record.
     *
     * @return An unmodifiable map of variable name to value.
     */
    public Map<String, Object> values() {
        return values;
    }

    @Override
    public int hashCode() {
        return Objects.hash(group, values);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SubjectRecord otherRecord)) {
            return false;
        }
        return group.equals(otherRecord.group) && values.equals(otherRecord.values);
    }

    @Override
    public String toString() {
        return group + values;
    }
}
