///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The event rates of one subgroup, per group, with the odds ratio of a treatment group against a reference group.
 * <p>
 * Instances of this class are immutable.  They are created by {@link StatEngine#summarizeResponses}.
 * </p>
 */
public final class ResponseSummary implements LongFormRow {

    /** The name of the field that holds the subgroup. */
    public static final String SUBGROUP_FIELD = "subgroup";

    /** The name of the field that holds the odds ratio. */
    public static final String ODDS_RATIO_FIELD = "or";

    /** The name of the field that holds the lower bound of the odds ratio's interval. */
    public static final String ODDS_RATIO_LOWER_FIELD = "or_lower";

    /** The name of the field that holds the upper bound of the odds ratio's interval. */
    public static final String ODDS_RATIO_UPPER_FIELD = "or_upper";

    /**
     * The events in one group of a subgroup.
     */
    public static final class GroupResponse {
        private final int events;
        private final int total;
        private final ConfidenceInterval interval;

        GroupResponse(int events, int total, ConfidenceInterval interval) {
            this.events = events;
            this.total = total;
            this.interval = interval;
        }

        /**
         * Gets the number of subjects who had the event.
         *
         * @return the number of events
         */
        public int events() {
            return events;
        }

        /**
         * Gets the number of subjects in the group.
         *
         * @return the number of subjects
         */
        public int total() {
            return total;
        }

        /**
         * Gets the proportion of subjects who had the event.
         *
         * @return The proportion, or NaN if the group has no subjects.
         */
        public double proportion() {
            return total == 0 ? Double.NaN : (double) events / total;
        }

        /**
         * Gets the exact (Clopper-Pearson) confidence interval of the proportion.
         *
         * @return The interval. This is never {@code null}.
         */
        public ConfidenceInterval interval() {
            return interval;
        }

        @Override
        public int hashCode() {
            return Objects.hash(events, total, interval);
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof GroupResponse otherResponse)) {
                return false;
            }
            return events == otherResponse.events &&
                total == otherResponse.total &&
                interval.equals(otherResponse.interval);
        }

        @Override
        public String toString() {
            return events + "/" + total + " " + interval;
        }
    }

    private final String subgroup;
    private final Map<String, GroupResponse> responses;
    private final OddsRatio oddsRatio;

    ResponseSummary(String subgroup, Map<String, GroupResponse> responses, OddsRatio oddsRatio) {
        this.subgroup = subgroup;
        this.responses = Collections.unmodifiableMap(new LinkedHashMap<>(responses));
        this.oddsRatio = oddsRatio;
    }

    /**
     * Gets the subgroup that this row summarizes.
     *
     * @return The subgroup, for example "Overall" or "Female".
     */
    public String subgroup() {
        return subgroup;
    }

    /**
     * Gets the groups in this summary.
     *
     * @return An unmodifiable list of groups in display order.
     */
    public List<String> groups() {
        return List.copyOf(responses.keySet());
    }

    /**
     * Gets the events of one group.
     *
     * @param group
     *     The group
     *
     * @return The group's events, or {@code null} if {@code group} isn't in this summary.
     */
    public GroupResponse response(String group) {
        return responses.get(group);
    }

    /**
     * Gets the odds ratio of the treatment group against the reference group.
     *
     * @return The odds ratio. This is never {@code null}, but it may be undefined.
     */
    public OddsRatio oddsRatio() {
        return oddsRatio;
    }

    /**
     * {@inheritDoc}
     * <p>
     * The fields are the subgroup, then the events, total, proportion, and interval bounds of each group, and finally
     * the odds ratio and its interval bounds.
     * </p>
     */
    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(SUBGROUP_FIELD, subgroup);
        for (Map.Entry<String, GroupResponse> entry : responses.entrySet()) {
            String group = entry.getKey();
            GroupResponse response = entry.getValue();
            fields.put(Statistic.EVENTS.fieldName(group), response.events());
            fields.put(Statistic.TOTAL.fieldName(group), response.total());
            fields.put(Statistic.PERCENT.fieldName(group),
                response.total() == 0 ? MissingValue.UNDEFINED : (Object) response.proportion());
            fields.put(Statistic.LOWER.fieldName(group), response.interval().lowerValue());
            fields.put(Statistic.UPPER.fieldName(group), response.interval().upperValue());
        }
        fields.put(ODDS_RATIO_FIELD, oddsRatio.estimateValue());
        fields.put(ODDS_RATIO_LOWER_FIELD, oddsRatio.interval().lowerValue());
        fields.put(ODDS_RATIO_UPPER_FIELD, oddsRatio.interval().upperValue());
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subgroup, responses, oddsRatio);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ResponseSummary otherSummary)) {
            return false;
        }
        return subgroup.equals(otherSummary.subgroup) &&
            responses.equals(otherSummary.responses) &&
            oddsRatio.equals(otherSummary.oddsRatio);
    }

    @Override
    public String toString() {
        return subgroup + " " + responses + " OR=" + oddsRatio;
    }
}
