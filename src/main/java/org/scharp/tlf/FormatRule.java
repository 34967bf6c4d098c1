///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.HashMap;
import java.util.Locale;
import java.util.Objects;

/**
 * A directive for rendering the numbers in a table cell as text.
 *
 * <p>
 * Instances of this class are immutable.  They are created with the static factory methods:
 * </p>
 * <pre>
 * FormatRule counts = FormatRule.integer();
 * FormatRule means = FormatRule.fixedDecimal(1);
 * FormatRule rates = FormatRule.percent(1);
 * </pre>
 *
 * <p>
 * Numbers are rounded half up.
 * </p>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()} so that its instances suitable for use in a HashMap.
 * </p>
 */
public final class FormatRule {

    /**
     * The kinds of number formats.
     */
    public enum Kind {
        /** A whole number. */
        INTEGER,

        /** A number with a fixed number of digits to the right of the decimal point. */
        FIXED_DECIMAL,

        /** A proportion multiplied by 100 and followed by a percent sign. */
        PERCENT,
    }

    private final Kind kind;
    private final short numberOfDigits;
    private final boolean grouping;

    private FormatRule(Kind kind, int numberOfDigits, boolean grouping) {
        ArgumentUtil.checkNotNegative(numberOfDigits, "numberOfDigits");
        if (Short.MAX_VALUE < numberOfDigits) {
            throw new IllegalArgumentException("numberOfDigits must not be greater than 32767");
        }

        this.kind = kind;
        this.numberOfDigits = (short) numberOfDigits;
        this.grouping = grouping;
    }

    /**
     * Creates a rule for rendering whole numbers without digit grouping, for example "1234".
     *
     * @return A new format rule
     */
    public static FormatRule integer() {
        return new FormatRule(Kind.INTEGER, 0, false);
    }

    /**
     * Creates a rule for rendering whole numbers with comma digit grouping, for example "1,234".
     *
     * @return A new format rule
     */
    public static FormatRule groupedInteger() {
        return new FormatRule(Kind.INTEGER, 0, true);
    }

    /**
     * Creates a rule for rendering numbers with a fixed number of decimal places, for example "12.30".
     *
     * @param numberOfDigits
     *     The number of digits to the right of the decimal point.
     *
     * @return A new format rule
     *
     * @throws IllegalArgumentException
     *     if {@code numberOfDigits} is negative or greater than 32767.
     */
    public static FormatRule fixedDecimal(int numberOfDigits) {
        return new FormatRule(Kind.FIXED_DECIMAL, numberOfDigits, false);
    }

    /**
     * Creates a rule for rendering proportions as percentages, for example 0.125 as "12.5%".
     *
     * @param numberOfDigits
     *     The number of digits to the right of the decimal point.
     *
     * @return A new format rule
     *
     * @throws IllegalArgumentException
     *     if {@code numberOfDigits} is negative or greater than 32767.
     */
    public static FormatRule percent(int numberOfDigits) {
        return new FormatRule(Kind.PERCENT, numberOfDigits, false);
    }

    /**
     * Gets the kind of this format.
     *
     * @return This format's kind. This is never {@code null}.
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Gets this format's number of digits to the right of the decimal point.
     *
     * @return The number of digits.  This is always 0 for {@link Kind#INTEGER}.
     */
    public short numberOfDigits() {
        return numberOfDigits;
    }

    /**
     * Gets whether digits are grouped with commas.
     *
     * @return {@code true}, if digits are grouped; {@code false}, otherwise.
     */
    public boolean grouping() {
        return grouping;
    }

    /**
     * Renders a number with this format.
     *
     * @param value
     *     The number to render. It must be finite.
     *
     * @return The number as text.
     *
     * @throws NullPointerException
     *     if {@code value} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code value} is infinite or NaN.
     */
    public String format(Number value) {
        ArgumentUtil.checkNotNull(value, "value");

        BigDecimal decimal = toBigDecimal(value);
        if (kind == Kind.PERCENT) {
            decimal = decimal.movePointRight(2);
        }
        decimal = decimal.setScale(numberOfDigits, RoundingMode.HALF_UP);

        final String text;
        if (grouping) {
            DecimalFormat decimalFormat = new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(Locale.US));
            decimalFormat.setMinimumFractionDigits(numberOfDigits);
            decimalFormat.setMaximumFractionDigits(numberOfDigits);
            text = decimalFormat.format(decimal);
        } else {
            text = decimal.toPlainString();
        }

        return kind == Kind.PERCENT ? text + "%" : text;
    }

    /**
     * Converts a number to a {@code BigDecimal} without introducing binary floating point noise.
     *
     * @param value
     *     The number
     *
     * @return The number as a {@code BigDecimal}
     *
     * @throws IllegalArgumentException
     *     if {@code value} is infinite or NaN.
     */
    static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal bigDecimal) {
            return bigDecimal;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(value.longValue());
        }

        double doubleValue = value.doubleValue();
        if (Double.isNaN(doubleValue) || Double.isInfinite(doubleValue)) {
            throw new IllegalArgumentException("value must be finite");
        }
        // valueOf() uses the shortest decimal string that round-trips, so 0.1 stays 0.1.
        return BigDecimal.valueOf(doubleValue);
    }

    /**
     * Gets a hash code for this format rule.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return this format rule's hash code
     */
    @Override
    public int hashCode() {
        return Objects.hash(kind, numberOfDigits, grouping);
    }

    /**
     * Determines if this format rule is equal to another object.
     * <p>
     * Two format rules are equal if their kind, numberOfDigits, and grouping are all equal.
     * </p>
     *
     * @param other
     *     The object with which to compare this format rule
     *
     * @return {@code true}, if this format rule is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FormatRule otherRule)) {
            return false;
        }

        return kind == otherRule.kind &&
            numberOfDigits == otherRule.numberOfDigits &&
            grouping == otherRule.grouping;
    }

    /**
     * Gets this format rule as a string in the form {@code <kind>.<digits>}.
     *
     * <p>
     * For example "INTEGER.", "COMMA_INTEGER.", "FIXED_DECIMAL.2", or "PERCENT.1".
     * </p>
     *
     * @return A string representing this format rule.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (grouping) {
            builder.append("COMMA_");
        }
        builder.append(kind.name());
        builder.append('.');
        if (numberOfDigits != 0) {
            builder.append(numberOfDigits);
        }
        return builder.toString();
    }
}
