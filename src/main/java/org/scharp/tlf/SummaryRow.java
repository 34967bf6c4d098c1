///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The summary of one category of a categorical variable or one line of a continuous variable's summary, with the
 * statistics for each group.
 * <p>
 * Only the statistics that are relevant to the row are populated.  Asking for any other statistic yields
 * {@link MissingValue#NOT_APPLICABLE}.
 * </p>
 * <p>
 * Instances of this class are immutable.  They are created by {@link StatEngine} or with a {@link SummaryRow.Builder}.
 * </p>
 */
public final class SummaryRow implements LongFormRow {

    /** The name of the field that holds a row's label. */
    public static final String LABEL_FIELD = "label";

    /** The name of the field that holds a row's category. */
    public static final String CATEGORY_FIELD = "category";

    private final String label;
    private final String category;
    private final Map<String, Map<Statistic, Object>> statisticsByGroup;

    /**
     * A builder class for {@link SummaryRow}.
     */
    public final static class Builder {
        private final String label;
        private String category;
        private final Map<String, Map<Statistic, Object>> statisticsByGroup;

        private Builder(String label) {
            this.label = label;
            this.category = "";
            this.statisticsByGroup = new LinkedHashMap<>();
        }

        /**
         * Sets the category under which the row is grouped, typically the label of the summarized variable.
         *
         * @param category
         *     The row's category
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code category} is {@code null}.
         */
        public Builder category(String category) {
            ArgumentUtil.checkNotNull(category, "category");
            this.category = category;
            return this;
        }

        /**
         * Adds a group to this row without setting any statistics for it.  Groups are listed in the order in which
         * they are first added.
         *
         * @param group
         *     The group
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code group} is {@code null}.
         */
        public Builder group(String group) {
            ArgumentUtil.checkNotNull(group, "group");
            statisticsByGroup.computeIfAbsent(group, g -> new EnumMap<>(Statistic.class));
            return this;
        }

        /**
         * Sets a statistic for a group.
         *
         * @param group
         *     The group
         * @param statistic
         *     The statistic
         * @param value
         *     The statistic's value, as a {@link Number} or a {@link MissingValue}.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if any argument is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code value} is neither a {@code Number} nor a {@code MissingValue}.
         */
        public Builder statistic(String group, Statistic statistic, Object value) {
            ArgumentUtil.checkNotNull(group, "group");
            ArgumentUtil.checkNotNull(statistic, "statistic");
            ArgumentUtil.checkNotNull(value, "value");
            if (!(value instanceof Number) && !(value instanceof MissingValue)) {
                throw new IllegalArgumentException("value must be a Number or a MissingValue");
            }

            group(group);
            statisticsByGroup.get(group).put(statistic, value);
            return this;
        }

        /**
         * Builds an immutable {@code SummaryRow}.
         *
         * @return a {@code SummaryRow}
         */
        public SummaryRow build() {
            Map<String, Map<Statistic, Object>> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Map<Statistic, Object>> entry : statisticsByGroup.entrySet()) {
                copy.put(entry.getKey(), Collections.unmodifiableMap(new EnumMap<>(entry.getValue())));
            }
            return new SummaryRow(label, category, Collections.unmodifiableMap(copy));
        }
    }

    /**
     * Creates a new builder for a row with the given label, a blank category, and no groups.
     *
     * @param label
     *     The row's label.
     *
     * @return A new builder.
     *
     * @throws NullPointerException
     *     if {@code label} is {@code null}.
     */
    public static Builder builder(String label) {
        ArgumentUtil.checkNotNull(label, "label");
        return new Builder(label);
    }

    private SummaryRow(String label, String category, Map<String, Map<Statistic, Object>> statisticsByGroup) {
        this.label = label;
        this.category = category;
        this.statisticsByGroup = statisticsByGroup;
    }

    /**
     * Gets this row's label, for example "Female" or "Mean (SD)".
     *
     * @return The label. This is never {@code null}.
     */
    public String label() {
        return label;
    }

    /**
     * Gets this row's category, which is typically derived from the label of the summarized variable.
     *
     * @return The category. This may be blank but never {@code null}.
     */
    public String category() {
        return category;
    }

    /**
     * Gets the groups for which this row has statistics.
     *
     * @return An unmodifiable list of groups in display order.
     */
    public List<String> groups() {
        return List.copyOf(statisticsByGroup.keySet());
    }

    /**
     * Gets a statistic for a group.
     *
     * @param group
     *     The group
     * @param statistic
     *     The statistic
     *
     * @return The value, which is a {@link Number} or a {@link MissingValue}.  This is never {@code null}.
     */
    public Object value(String group, Statistic statistic) {
        Map<Statistic, Object> statistics = statisticsByGroup.get(group);
        if (statistics == null) {
            return MissingValue.NOT_APPLICABLE;
        }
        return statistics.getOrDefault(statistic, MissingValue.NOT_APPLICABLE);
    }

    /**
     * Gets the statistics that are populated for a group.
     *
     * @param group
     *     The group
     *
     * @return An unmodifiable map of the populated statistics.  This is empty if the group isn't in this row.
     */
    public Map<Statistic, Object> statistics(String group) {
        return statisticsByGroup.getOrDefault(group, Map.of());
    }

    /**
     * {@inheritDoc}
     * <p>
     * The fields are the label, the category, and then each populated statistic, group by group.
     * </p>
     */
    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(LABEL_FIELD, label);
        fields.put(CATEGORY_FIELD, category);
        for (Map.Entry<String, Map<Statistic, Object>> groupEntry : statisticsByGroup.entrySet()) {
            for (Map.Entry<Statistic, Object> entry : groupEntry.getValue().entrySet()) {
                fields.put(entry.getKey().fieldName(groupEntry.getKey()), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, category, statisticsByGroup);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SummaryRow otherRow)) {
            return false;
        }
        return label.equals(otherRow.label) &&
            category.equals(otherRow.category) &&
            statisticsByGroup.equals(otherRow.statisticsByGroup);
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, Map<Statistic, Object>> entry : statisticsByGroup.entrySet()) {
            parts.add(entry.getKey() + "=" + entry.getValue());
        }
        return category + " / " + label + " " + parts;
    }
}
