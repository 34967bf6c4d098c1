///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

/**
 * A representation of a value that is absent from a subject record, a summary, or a table cell.
 * <p>
 * Missing values are data, not errors. They flow through the summaries and the table model unchanged and are only
 * replaced by text when a {@link Grid} is rendered (see {@link TableModel#substituteMissing(String)}).
 * </p>
 */
public enum MissingValue {
    /**
     * The value was not collected for a subject. {@code null} values in a {@link SubjectRecord} are treated the same
     * way.
     */
    STANDARD("."),

    /**
     * The statistic does not apply to the row, such as a mean on a categorical row or a median of an empty group.
     */
    NOT_APPLICABLE("NA"),

    /**
     * The statistic is mathematically undefined for the data, such as an odds ratio whose reference odds are zero or
     * the standard deviation of a single observation.
     */
    UNDEFINED("NE");

    private final String code;

    MissingValue(String code) {
        this.code = code;
    }

    /**
     * Determines whether a value should be treated as missing.
     *
     * @param value
     *     The value to check. This may be {@code null}.
     *
     * @return {@code true}, if {@code value} is {@code null}, a {@code MissingValue}, or a floating point NaN;
     *     {@code false}, otherwise.
     */
    static boolean isMissing(Object value) {
        if (value == null || value instanceof MissingValue) {
            return true;
        }
        if (value instanceof Double doubleValue) {
            return doubleValue.isNaN();
        }
        if (value instanceof Float floatValue) {
            return floatValue.isNaN();
        }
        return false;
    }

    /**
     * Gets a short code for this missing value.
     *
     * @return The code, such as "NA" or "NE".
     */
    public String toString() {
        return code;
    }
}
