///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

/**
 * A per-group statistic held by a summary row.
 * <p>
 * Each statistic has a short key which, combined with a group, names the field that holds it in the long-form
 * summary data (for example {@code n_Placebo} or {@code pct_Drug 1}).
 * </p>
 */
public enum Statistic {
    /** The number of subjects (or non-missing observations). */
    N("n"),

    /** A proportion between 0 and 1. */
    PERCENT("pct"),

    /** The arithmetic mean. */
    MEAN("mean"),

    /** The sample standard deviation. */
    SD("sd"),

    /** The median. */
    MEDIAN("median"),

    /** The minimum. */
    MIN("min"),

    /** The maximum. */
    MAX("max"),

    /** The number of subjects who had an event. */
    EVENTS("events"),

    /** The number of subjects at risk of an event. */
    TOTAL("total"),

    /** The lower bound of a confidence interval, as a proportion. */
    LOWER("lower"),

    /** The upper bound of a confidence interval, as a proportion. */
    UPPER("upper");

    private final String key;

    Statistic(String key) {
        this.key = key;
    }

    /**
     * Gets this statistic's short key.
     *
     * @return The key, for example "n" or "pct".
     */
    public String key() {
        return key;
    }

    /**
     * Gets the name of the long-form field that holds this statistic for a group.
     *
     * @param group
     *     The group.
     *
     * @return The field name, which is the key and the group separated by an underscore.
     */
    public String fieldName(String group) {
        return key + "_" + group;
    }
}
