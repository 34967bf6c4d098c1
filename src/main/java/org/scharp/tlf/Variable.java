///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A description of a variable that is collected for each subject in a trial.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link Variable.Builder}:
 * </p>
 *
 * <pre>
 * Variable ageVariable = Variable.builder().
 *     name("AGE").
 *     type(VariableType.CONTINUOUS).
 *     label("Age").
 *     unit("years").
 *     build();
 * </pre>
 *
 * <p>
 * The type is metadata that the {@link Aggregator} uses to choose how the variable is summarized. A variable may be
 * built without a type, but it cannot be summarized.
 * </p>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()} so that its instances suitable for use in a
 * {@code HashMap}.
 * </p>
 */
public final class Variable {

    private final String name;
    private final VariableType type;
    private final String label;
    private final String unit;
    private final List<String> levels;

    /**
     * A builder class for {@link Variable}.
     */
    public final static class Builder {
        private String name;
        private VariableType type;
        private String label;
        private String unit;
        private List<String> levels;

        /**
         * Creates a {@code Variable} builder.
         */
        private Builder() {
            this.name = null; // required parameter

            this.type = null; // optional metadata, but required for summarizing
            this.label = null; // optional, so default to the name
            this.unit = ""; // optional, so default to blank
            this.levels = List.of(); // optional, so default to the order in which categories are observed
        }

        /**
         * Sets the variable's name, which is the key of its value in each {@link SubjectRecord}.
         *
         * @param name
         *     The variable's new name.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code name} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code name} is blank.
         */
        public Builder name(String name) {
            ArgumentUtil.checkNotBlank(name, "name");
            this.name = name;
            return this;
        }

        /**
         * Sets the variable's type (categorical or continuous).
         *
         * @param type
         *     The variable's new type.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code type} is {@code null}.
         */
        public Builder type(VariableType type) {
            ArgumentUtil.checkNotNull(type, "type");
            this.type = type;
            return this;
        }

        /**
         * Sets the variable's label. This is the text which appears in a table to describe the variable.
         *
         * @param label
         *     The variable's new label.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code label} is {@code null}.
         */
        public Builder label(String label) {
            ArgumentUtil.checkNotNull(label, "label");
            this.label = label;
            return this;
        }

        /**
         * Sets the unit in which a continuous variable is measured, for example "years" or "kg".
         *
         * @param unit
         *     The variable's new unit. This may be blank.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code unit} is {@code null}.
         */
        public Builder unit(String unit) {
            ArgumentUtil.checkNotNull(unit, "unit");
            this.unit = unit;
            return this;
        }

        /**
         * Sets the order in which the categories of a categorical variable are summarized.
         * <p>
         * Every level is summarized, even if no subject has it.  Categories that are observed but not listed here are
         * summarized after the listed levels, in the order in which they are first observed.
         * </p>
         *
         * @param levels
         *     The categories, in display order. This list is copied, so subsequent changes to the list do not impact
         *     this builder or the resulting {@code Variable}.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code levels} is {@code null} or contains a {@code null} element.
         * @throws IllegalArgumentException
         *     if {@code levels} contains a duplicate.
         */
        public Builder levels(List<String> levels) {
            ArgumentUtil.checkNoNullElements(levels, "levels");
            if (new LinkedHashSet<>(levels).size() != levels.size()) {
                throw new IllegalArgumentException("levels must not contain duplicates");
            }
            this.levels = List.copyOf(levels);
            return this;
        }

        /**
         * Builds an immutable {@code Variable} with the configured options.
         *
         * @return a {@code Variable}
         *
         * @throws IllegalStateException
         *     if the name hasn't been set or if levels were given to a continuous variable.
         */
        public Variable build() {
            // There is no meaningful default name; it's an error if the caller hasn't set it.
            if (name == null) {
                throw new IllegalStateException("name must be set");
            }
            if (type == VariableType.CONTINUOUS && !levels.isEmpty()) {
                throw new IllegalStateException("continuous variables must not have levels");
            }

            return new Variable(name, type, label == null ? name : label, unit, levels);
        }
    }

    /**
     * Creates a new Variable builder with no type, a label that is the same as the name, no unit, and no levels.
     * <p>
     * You must set the name before invoking {@link Builder#build() build()}.
     * </p>
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private Variable(String name, VariableType type, String label, String unit, List<String> levels) {
        this.name = name;
        this.type = type;
        this.label = label;
        this.unit = unit;
        this.levels = levels;
    }

    /**
     * Gets this variable's name.
     *
     * @return This variable's name. This is never {@code null}.
     */
    public String name() {
        return name;
    }

    /**
     * Gets this variable's type.
     *
     * @return This variable's type, or {@code null} if no type was given.
     */
    public VariableType type() {
        return type;
    }

    /**
     * Gets this variable's label.
     *
     * @return This variable's label. This may be the empty string but never {@code null}.
     */
    public String label() {
        return label;
    }

    /**
     * Gets the unit of this variable's values.
     *
     * @return This variable's unit. This may be the empty string but never {@code null}.
     */
    public String unit() {
        return unit;
    }

    /**
     * Gets the caller-supplied order of this variable's categories.
     *
     * @return An unmodifiable list of levels. This is empty when no order was given.
     */
    public List<String> levels() {
        return levels;
    }

    /**
     * Gets the text that groups this variable's summary rows in a table.
     * <p>
     * This is the label followed by the unit in parentheses, for example "Age (years)".  If there is no unit, it's
     * only the label.
     * </p>
     *
     * @return The category label for this variable's summary rows.
     */
    public String categoryLabel() {
        if (unit.isEmpty()) {
            return label;
        }
        return label + " (" + unit + ")";
    }

    /**
     * Gets a hash code for this variable.
     * <p>
     * This method is supported for the benefit of hash tables such as those provided by {@link HashMap}.
     * </p>
     *
     * @return This variable's hash code.
     */
    @Override
    public int hashCode() {
        return Objects.hash(name, type, label, unit, levels);
    }

    /**
     * Determines if this variable is equal to another object.
     * <p>
     * Two variables are equal if and only if their name, type, label, unit, and levels are all equal.
     * </p>
     *
     * @param other
     *     The object with which to compare this variable.
     *
     * @return {@code true}, if this variable is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Variable otherVariable)) {
            return false;
        }

        return name.equals(otherVariable.name) &&
            type == otherVariable.type &&
            label.equals(otherVariable.label) &&
            unit.equals(otherVariable.unit) &&
            levels.equals(otherVariable.levels);
    }

    @Override
    public String toString() {
        return name;
    }
}
