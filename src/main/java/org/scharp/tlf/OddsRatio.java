///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.Objects;

/**
 * An odds ratio between a treatment group and a reference group, with its confidence interval.
 * <p>
 * Either part may be undefined.  The estimate is undefined when the odds in either group cannot be formed (a
 * reference group with no events, or a group where every subject had an event).  The interval is undefined whenever
 * any of the four cells of the two-by-two table is zero.
 * </p>
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class OddsRatio {

    private final double estimate;
    private final ConfidenceInterval interval;

    OddsRatio(double estimate, ConfidenceInterval interval) {
        assert interval != null : "interval must not be null";
        this.estimate = estimate;
        this.interval = interval;
    }

    /**
     * Gets the estimated odds ratio.
     *
     * @return The odds ratio, or NaN if it is undefined.
     */
    public double estimate() {
        return estimate;
    }

    /**
     * Gets the confidence interval for the odds ratio.
     *
     * @return The interval. This is never {@code null} but it may be {@link ConfidenceInterval#UNDEFINED}.
     */
    public ConfidenceInterval interval() {
        return interval;
    }

    /**
     * Determines whether the estimate is defined.
     *
     * @return {@code true}, if the estimate is not NaN.
     */
    public boolean isEstimateDefined() {
        return !Double.isNaN(estimate);
    }

    /**
     * Determines whether both the estimate and its interval are defined.
     *
     * @return {@code true}, if the estimate and both bounds are not NaN.
     */
    public boolean isDefined() {
        return isEstimateDefined() && interval.isDefined();
    }

    /**
     * Gets the estimate as a table value.
     *
     * @return The estimate as a {@code Double}, or {@link MissingValue#UNDEFINED}.
     */
    Object estimateValue() {
        return isEstimateDefined() ? (Object) estimate : MissingValue.UNDEFINED;
    }

    @Override
    public int hashCode() {
        return Objects.hash(estimate, interval);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof OddsRatio otherRatio)) {
            return false;
        }
        return Double.compare(estimate, otherRatio.estimate) == 0 && interval.equals(otherRatio.interval);
    }

    @Override
    public String toString() {
        return estimate + " " + interval;
    }
}
