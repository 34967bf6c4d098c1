///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.Objects;

/**
 * A two-sided confidence interval for a proportion or a ratio.
 * <p>
 * An interval may be undefined, for example when there are no observations.  An undefined interval's bounds are NaN
 * and appear in tables as {@link MissingValue#UNDEFINED}.
 * </p>
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class ConfidenceInterval {

    /** An interval that cannot be computed from the data. */
    public static final ConfidenceInterval UNDEFINED = new ConfidenceInterval(Double.NaN, Double.NaN);

    private final double lower;
    private final double upper;

    /**
     * Creates a confidence interval.
     *
     * @param lower
     *     The lower bound.
     * @param upper
     *     The upper bound.
     *
     * @throws IllegalArgumentException
     *     if {@code lower} is greater than {@code upper}.
     */
    public ConfidenceInterval(double lower, double upper) {
        if (upper < lower) {
            throw new IllegalArgumentException("lower must not be greater than upper");
        }
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Gets the lower bound.
     *
     * @return The lower bound, or NaN if this interval is undefined.
     */
    public double lower() {
        return lower;
    }

    /**
     * Gets the upper bound.
     *
     * @return The upper bound, or NaN if this interval is undefined.
     */
    public double upper() {
        return upper;
    }

    /**
     * Gets the lower bound of a proportion's interval on the percentage scale.
     *
     * @return {@code lower() * 100}
     */
    public double lowerPercent() {
        return lower * 100;
    }

    /**
     * Gets the upper bound of a proportion's interval on the percentage scale.
     *
     * @return {@code upper() * 100}
     */
    public double upperPercent() {
        return upper * 100;
    }

    /**
     * Determines whether both bounds of this interval are defined.
     *
     * @return {@code true}, if neither bound is NaN; {@code false}, otherwise.
     */
    public boolean isDefined() {
        return !Double.isNaN(lower) && !Double.isNaN(upper);
    }

    /**
     * Gets the lower bound as a table value.
     *
     * @return The bound as a {@code Double}, or {@link MissingValue#UNDEFINED}.
     */
    Object lowerValue() {
        return isDefined() ? (Object) lower : MissingValue.UNDEFINED;
    }

    /**
     * Gets the upper bound as a table value.
     *
     * @return The bound as a {@code Double}, or {@link MissingValue#UNDEFINED}.
     */
    Object upperValue() {
        return isDefined() ? (Object) upper : MissingValue.UNDEFINED;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ConfidenceInterval otherInterval)) {
            return false;
        }
        // Double.compare() treats NaN as equal to itself, so UNDEFINED intervals are equal.
        return Double.compare(lower, otherInterval.lower) == 0 && Double.compare(upper, otherInterval.upper) == 0;
    }

    @Override
    public String toString() {
        return "(" + lower + ", " + upper + ")";
    }
}
