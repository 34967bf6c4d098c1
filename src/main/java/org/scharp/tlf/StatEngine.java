///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Functions which compute per-group summary statistics.
 * <p>
 * All methods are pure: they don't modify their arguments and have no shared state, so they may be invoked
 * independently for each variable or subgroup.
 * </p>
 */
public abstract class StatEngine {

    /** The confidence level used when none is given. */
    public static final double DEFAULT_CONFIDENCE = 0.95;

    /** The label of the category that counts subjects whose value is missing. */
    public static final String MISSING_CATEGORY = "Missing";

    /** The label of the row holding the number of non-missing observations of a continuous variable. */
    public static final String N_LABEL = "n";

    /** The label of the row holding the mean and standard deviation of a continuous variable. */
    public static final String MEAN_SD_LABEL = "Mean (SD)";

    /** The label of the row holding the median of a continuous variable. */
    public static final String MEDIAN_LABEL = "Median";

    /** The label of the row holding the range of a continuous variable. */
    public static final String RANGE_LABEL = "Min - Max";

    /** The subgroup of a response summary that isn't stratified. */
    public static final String OVERALL_SUBGROUP = "Overall";

    // Stands in for a missing value in maps keyed by category so that it can't collide with a real "Missing" value.
    private static final Object MISSING_KEY = new Object();

    // private constructor to prevent anyone from instantiating the class.
    private StatEngine() {
    }

    /**
     * Gets the groups of some records in the order in which they first appear.
     *
     * @param records
     *     The records
     *
     * @return A new list of distinct groups.
     */
    static List<String> observedGroups(List<SubjectRecord> records) {
        Set<String> groups = new LinkedHashSet<>();
        for (SubjectRecord record : records) {
            groups.add(record.group());
        }
        return new ArrayList<>(groups);
    }

    private static String categoryLabel(Object key) {
        return key == MISSING_KEY ? MISSING_CATEGORY : (String) key;
    }

    private static void checkRecords(List<SubjectRecord> records, List<String> groups) {
        ArgumentUtil.checkNoNullElements(records, "records");
        ArgumentUtil.checkNoNullElements(groups, "groups");
        Set<String> knownGroups = new LinkedHashSet<>(groups);
        for (SubjectRecord record : records) {
            if (!knownGroups.contains(record.group())) {
                throw new IllegalArgumentException("record group \"" + record.group() + "\" is not one of " + groups);
            }
        }
    }

    private static Map<String, Integer> countByGroup(List<SubjectRecord> records, List<String> groups) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (String group : groups) {
            totals.put(group, 0);
        }
        for (SubjectRecord record : records) {
            totals.merge(record.group(), 1, Integer::sum);
        }
        return totals;
    }

    /**
     * Summarizes a categorical variable with the groups listed in the order in which they first appear.
     *
     * @param records
     *     The subject records
     * @param variable
     *     The variable to summarize
     *
     * @return One row per category, as described in {@link #summarizeCategorical(List, List, Variable)}.
     */
    public static List<SummaryRow> summarizeCategorical(List<SubjectRecord> records, Variable variable) {
        ArgumentUtil.checkNoNullElements(records, "records");
        return summarizeCategorical(records, observedGroups(records), variable);
    }

    /**
     * Summarizes a categorical variable by counting the subjects in each category of each group.
     * <p>
     * There is one row for each category.  The variable's levels come first, then any other observed category in the
     * order in which it first appears, then a {@value #MISSING_CATEGORY} row if any subject's value is missing. The
     * missing row is kept apart from an observed category that happens to be spelled {@value #MISSING_CATEGORY}.
     * </p>
     * <p>
     * Categories are compared by their string form, so the values {@code 1} and {@code "1"} are counted together.
     * </p>
     * <p>
     * Every row has the {@link Statistic#N} and {@link Statistic#PERCENT} of every group, including explicit zeros, so
     * that the counts of a group across all rows sum to the number of subjects in the group.  The percentage of a group
     * with no subjects is {@link MissingValue#UNDEFINED}.
     * </p>
     *
     * @param records
     *     The subject records
     * @param groups
     *     The groups in display order. Every record's group must be in this list.
     * @param variable
     *     The variable to summarize
     *
     * @return A new list of summary rows.
     *
     * @throws NullPointerException
     *     if any argument is {@code null} or contains {@code null}.
     * @throws IllegalArgumentException
     *     if a record's group is not in {@code groups}.
     */
    public static List<SummaryRow> summarizeCategorical(List<SubjectRecord> records, List<String> groups,
        Variable variable) {
        checkRecords(records, groups);
        ArgumentUtil.checkNotNull(variable, "variable");

        Map<String, Integer> totals = countByGroup(records, groups);

        // category -> group -> count, in display order
        Map<Object, Map<String, Integer>> counts = new LinkedHashMap<>();
        for (String level : variable.levels()) {
            counts.put(level, new LinkedHashMap<>());
        }
        Map<String, Integer> missingCounts = new LinkedHashMap<>();
        for (SubjectRecord record : records) {
            Object value = record.value(variable.name());
            Map<String, Integer> categoryCounts;
            if (MissingValue.isMissing(value)) {
                categoryCounts = missingCounts;
            } else {
                categoryCounts = counts.computeIfAbsent(value.toString(), category -> new LinkedHashMap<>());
            }
            categoryCounts.merge(record.group(), 1, Integer::sum);
        }
        if (!missingCounts.isEmpty()) {
            counts.put(MISSING_KEY, missingCounts);
        }

        List<SummaryRow> rows = new ArrayList<>(counts.size());
        for (Map.Entry<Object, Map<String, Integer>> entry : counts.entrySet()) {
            SummaryRow.Builder builder = SummaryRow.builder(categoryLabel(entry.getKey())).
                category(variable.categoryLabel());
            for (String group : groups) {
                int count = entry.getValue().getOrDefault(group, 0);
                int total = totals.get(group);
                builder.statistic(group, Statistic.N, count);
                builder.statistic(group, Statistic.PERCENT,
                    total == 0 ? MissingValue.UNDEFINED : (Object) ((double) count / total));
            }
            rows.add(builder.build());
        }
        return rows;
    }

    /**
     * Summarizes a continuous variable with the groups listed in the order in which they first appear.
     *
     * @param records
     *     The subject records
     * @param variable
     *     The variable to summarize
     *
     * @return The four summary rows described in {@link #summarizeContinuous(List, List, Variable)}.
     */
    public static List<SummaryRow> summarizeContinuous(List<SubjectRecord> records, Variable variable) {
        ArgumentUtil.checkNoNullElements(records, "records");
        return summarizeContinuous(records, observedGroups(records), variable);
    }

    /**
     * Summarizes a continuous variable.
     * <p>
     * This always returns exactly four rows, labeled {@value #N_LABEL}, {@value #MEAN_SD_LABEL},
     * {@value #MEDIAN_LABEL}, and {@value #RANGE_LABEL}.  Missing values are ignored by all statistics. If a group has
     * no non-missing values, its n is zero and its other statistics are {@link MissingValue#NOT_APPLICABLE}.  If a
     * group has a single value, its standard deviation is {@link MissingValue#UNDEFINED}.
     * </p>
     *
     * @param records
     *     The subject records
     * @param groups
     *     The groups in display order. Every record's group must be in this list.
     * @param variable
     *     The variable to summarize
     *
     * @return A new list of four summary rows.
     *
     * @throws NullPointerException
     *     if any argument is {@code null} or contains {@code null}.
     * @throws IllegalArgumentException
     *     if a record's group is not in {@code groups} or if a non-missing value is not a {@link Number}.
     */
    public static List<SummaryRow> summarizeContinuous(List<SubjectRecord> records, List<String> groups,
        Variable variable) {
        checkRecords(records, groups);
        ArgumentUtil.checkNotNull(variable, "variable");

        Map<String, DescriptiveStatistics> statisticsByGroup = new LinkedHashMap<>();
        for (String group : groups) {
            statisticsByGroup.put(group, new DescriptiveStatistics());
        }
        for (SubjectRecord record : records) {
            Object value = record.value(variable.name());
            if (MissingValue.isMissing(value)) {
                continue;
            }
            if (!(value instanceof Number number)) {
                throw new IllegalArgumentException(
                    "value of " + variable.name() + " must be a Number but was \"" + value + "\"");
            }
            statisticsByGroup.get(record.group()).addValue(number.doubleValue());
        }

        String category = variable.categoryLabel();
        SummaryRow.Builder nRow = SummaryRow.builder(N_LABEL).category(category);
        SummaryRow.Builder meanRow = SummaryRow.builder(MEAN_SD_LABEL).category(category);
        SummaryRow.Builder medianRow = SummaryRow.builder(MEDIAN_LABEL).category(category);
        SummaryRow.Builder rangeRow = SummaryRow.builder(RANGE_LABEL).category(category);

        for (Map.Entry<String, DescriptiveStatistics> entry : statisticsByGroup.entrySet()) {
            String group = entry.getKey();
            DescriptiveStatistics statistics = entry.getValue();
            int n = (int) statistics.getN();

            nRow.statistic(group, Statistic.N, n);
            if (n == 0) {
                meanRow.statistic(group, Statistic.MEAN, MissingValue.NOT_APPLICABLE);
                meanRow.statistic(group, Statistic.SD, MissingValue.NOT_APPLICABLE);
                medianRow.statistic(group, Statistic.MEDIAN, MissingValue.NOT_APPLICABLE);
                rangeRow.statistic(group, Statistic.MIN, MissingValue.NOT_APPLICABLE);
                rangeRow.statistic(group, Statistic.MAX, MissingValue.NOT_APPLICABLE);
            } else {
                meanRow.statistic(group, Statistic.MEAN, statistics.getMean());
                // DescriptiveStatistics reports 0 for a single value, but a sample SD needs two.
                meanRow.statistic(group, Statistic.SD,
                    n < 2 ? MissingValue.UNDEFINED : (Object) statistics.getStandardDeviation());
                medianRow.statistic(group, Statistic.MEDIAN, statistics.getPercentile(50));
                rangeRow.statistic(group, Statistic.MIN, statistics.getMin());
                rangeRow.statistic(group, Statistic.MAX, statistics.getMax());
            }
        }

        return List.of(nRow.build(), meanRow.build(), medianRow.build(), rangeRow.build());
    }

    /**
     * Computes an exact (Clopper-Pearson) confidence interval for a binomial proportion at the default confidence
     * level of 95%.
     *
     * @param successes
     *     The number of successes
     * @param total
     *     The number of trials
     *
     * @return The interval, as described in {@link #clopperPearson(int, int, double)}.
     */
    public static ConfidenceInterval clopperPearson(int successes, int total) {
        return clopperPearson(successes, total, DEFAULT_CONFIDENCE);
    }

    /**
     * Computes a two-sided exact (Clopper-Pearson) confidence interval for a binomial proportion from quantiles of the
     * F distribution.
     * <p>
     * The bounds are proportions.  When there are no successes, the lower bound is 0.  When every trial is a success,
     * the upper bound is 1.  When there are no trials, the interval is {@link ConfidenceInterval#UNDEFINED}.
     * </p>
     *
     * @param successes
     *     The number of successes
     * @param total
     *     The number of trials
     * @param confidence
     *     The confidence level, for example 0.95.
     *
     * @return The interval. This is never {@code null}.
     *
     * @throws IllegalArgumentException
     *     if {@code successes} or {@code total} is negative, if {@code successes} is greater than {@code total}, or if
     *     {@code confidence} is not between 0 and 1.
     */
    public static ConfidenceInterval clopperPearson(int successes, int total, double confidence) {
        ArgumentUtil.checkNotNegative(successes, "successes");
        ArgumentUtil.checkNotNegative(total, "total");
        ArgumentUtil.checkConfidence(confidence);
        if (total < successes) {
            throw new IllegalArgumentException("successes must not be greater than total");
        }

        if (total == 0) {
            return ConfidenceInterval.UNDEFINED;
        }

        final double alpha = 1 - confidence;
        final int failures = total - successes;

        final double lower;
        if (successes == 0) {
            lower = 0;
        } else {
            FDistribution distribution = new FDistribution(2.0 * successes, 2.0 * (failures + 1));
            double quantile = distribution.inverseCumulativeProbability(alpha / 2);
            lower = 1 / (1 + (failures + 1) / (successes * quantile));
        }

        final double upper;
        if (failures == 0) {
            upper = 1;
        } else {
            FDistribution distribution = new FDistribution(2.0 * (successes + 1), 2.0 * failures);
            double quantile = distribution.inverseCumulativeProbability(1 - alpha / 2);
            upper = 1 / (1 + failures / ((successes + 1) * quantile));
        }

        return new ConfidenceInterval(lower, upper);
    }

    /**
     * Computes the odds ratio of group A against group B at the default confidence level of 95%.
     *
     * @param eventsA
     *     The number of subjects in group A who had the event
     * @param totalA
     *     The number of subjects in group A
     * @param eventsB
     *     The number of subjects in group B who had the event
     * @param totalB
     *     The number of subjects in group B
     *
     * @return The odds ratio, as described in {@link #oddsRatio(int, int, int, int, double)}.
     */
    public static OddsRatio oddsRatio(int eventsA, int totalA, int eventsB, int totalB) {
        return oddsRatio(eventsA, totalA, eventsB, totalB, DEFAULT_CONFIDENCE);
    }

    /**
     * Computes the odds ratio of group A against group B with a Wald confidence interval on the log scale.
     * <p>
     * The variance of the log odds ratio is estimated as the sum of the reciprocals of the four cell counts (events and
     * non-events in each group).  The estimate is undefined when either group's odds cannot be formed or group B's odds
     * are zero.  The interval is undefined when any cell count is zero.  Neither case is an error.
     * </p>
     *
     * @param eventsA
     *     The number of subjects in group A who had the event
     * @param totalA
     *     The number of subjects in group A
     * @param eventsB
     *     The number of subjects in group B (the reference group) who had the event
     * @param totalB
     *     The number of subjects in group B
     * @param confidence
     *     The confidence level, for example 0.95.
     *
     * @return The odds ratio. This is never {@code null}.
     *
     * @throws IllegalArgumentException
     *     if any count is negative, if the events of a group exceed its total, or if {@code confidence} is not between
     *     0 and 1.
     */
    public static OddsRatio oddsRatio(int eventsA, int totalA, int eventsB, int totalB, double confidence) {
        ArgumentUtil.checkNotNegative(eventsA, "eventsA");
        ArgumentUtil.checkNotNegative(totalA, "totalA");
        ArgumentUtil.checkNotNegative(eventsB, "eventsB");
        ArgumentUtil.checkNotNegative(totalB, "totalB");
        ArgumentUtil.checkConfidence(confidence);
        if (totalA < eventsA) {
            throw new IllegalArgumentException("eventsA must not be greater than totalA");
        }
        if (totalB < eventsB) {
            throw new IllegalArgumentException("eventsB must not be greater than totalB");
        }

        // The cells of the two-by-two table.
        final int a = eventsA;
        final int b = totalA - eventsA;
        final int c = eventsB;
        final int d = totalB - eventsB;

        if (b == 0 || c == 0 || d == 0) {
            return new OddsRatio(Double.NaN, ConfidenceInterval.UNDEFINED);
        }
        final double estimate = ((double) a / b) / ((double) c / d);

        if (a == 0) {
            return new OddsRatio(estimate, ConfidenceInterval.UNDEFINED);
        }

        final double standardError = Math.sqrt(1.0 / a + 1.0 / b + 1.0 / c + 1.0 / d);
        final double z = new NormalDistribution().inverseCumulativeProbability(1 - (1 - confidence) / 2);
        final double logEstimate = Math.log(estimate);
        return new OddsRatio(
            estimate,
            new ConfidenceInterval(
                Math.exp(logEstimate - z * standardError),
                Math.exp(logEstimate + z * standardError)));
    }

    /**
     * Summarizes the rate of an event in each subgroup of subjects, per group, with the odds ratio of a treatment group
     * against a reference group.
     * <p>
     * A subject had the event if its value of {@code response} has the same string form as {@code eventValue}. Subjects
     * with a missing response count towards the total but not the events.
     * </p>
     * <p>
     * If {@code subgroup} is {@code null}, a single {@value #OVERALL_SUBGROUP} summary is returned.  Otherwise, there's
     * one summary per subgroup value, in the order in which the values first appear, with missing values in a
     * {@value #MISSING_CATEGORY} subgroup of their own (separate from a subgroup value spelled
     * {@value #MISSING_CATEGORY}).  Subgroup values are compared by their string form.  Groups are listed in the order
     * in which they first appear; the treatment and reference groups are always included.
     * </p>
     *
     * @param records
     *     The subject records
     * @param response
     *     The variable that records whether a subject had the event
     * @param eventValue
     *     The value of {@code response} that indicates an event, for example "Y".
     * @param subgroup
     *     The variable that stratifies the subjects, or {@code null}.
     * @param treatmentGroup
     *     The group in the numerator of the odds ratio
     * @param referenceGroup
     *     The group in the denominator of the odds ratio
     * @param confidence
     *     The confidence level for the intervals, for example 0.95.
     *
     * @return A new list of response summaries.
     *
     * @throws NullPointerException
     *     if any argument other than {@code subgroup} is {@code null}.
     * @throws IllegalArgumentException
     *     if the treatment and reference groups are the same or if {@code confidence} is not between 0 and 1.
     */
    public static List<ResponseSummary> summarizeResponses(List<SubjectRecord> records, Variable response,
        Object eventValue, Variable subgroup, String treatmentGroup, String referenceGroup, double confidence) {
        ArgumentUtil.checkNoNullElements(records, "records");
        ArgumentUtil.checkNotNull(response, "response");
        ArgumentUtil.checkNotNull(eventValue, "eventValue");
        ArgumentUtil.checkNotNull(treatmentGroup, "treatmentGroup");
        ArgumentUtil.checkNotNull(referenceGroup, "referenceGroup");
        ArgumentUtil.checkConfidence(confidence);
        if (treatmentGroup.equals(referenceGroup)) {
            throw new IllegalArgumentException("treatmentGroup and referenceGroup must be different");
        }

        List<String> groups = observedGroups(records);
        if (!groups.contains(treatmentGroup)) {
            groups.add(treatmentGroup);
        }
        if (!groups.contains(referenceGroup)) {
            groups.add(referenceGroup);
        }

        Map<Object, List<SubjectRecord>> recordsBySubgroup = new LinkedHashMap<>();
        if (subgroup == null) {
            recordsBySubgroup.put(OVERALL_SUBGROUP, records);
        } else {
            for (SubjectRecord record : records) {
                Object value = record.value(subgroup.name());
                Object key = MissingValue.isMissing(value) ? MISSING_KEY : value.toString();
                recordsBySubgroup.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
            }
        }

        final String event = eventValue.toString();
        List<ResponseSummary> summaries = new ArrayList<>(recordsBySubgroup.size());
        for (Map.Entry<Object, List<SubjectRecord>> entry : recordsBySubgroup.entrySet()) {
            Map<String, Integer> totals = countByGroup(entry.getValue(), groups);
            Map<String, Integer> events = new LinkedHashMap<>();
            for (SubjectRecord record : entry.getValue()) {
                Object value = record.value(response.name());
                if (!MissingValue.isMissing(value) && event.equals(value.toString())) {
                    events.merge(record.group(), 1, Integer::sum);
                }
            }

            Map<String, ResponseSummary.GroupResponse> responses = new LinkedHashMap<>();
            for (String group : groups) {
                int groupEvents = events.getOrDefault(group, 0);
                int groupTotal = totals.get(group);
                responses.put(group, new ResponseSummary.GroupResponse(
                    groupEvents,
                    groupTotal,
                    clopperPearson(groupEvents, groupTotal, confidence)));
            }

            ResponseSummary.GroupResponse treatment = responses.get(treatmentGroup);
            ResponseSummary.GroupResponse reference = responses.get(referenceGroup);
            OddsRatio oddsRatio = oddsRatio(
                treatment.events(),
                treatment.total(),
                reference.events(),
                reference.total(),
                confidence);

            summaries.add(new ResponseSummary(categoryLabel(entry.getKey()), responses, oddsRatio));
        }
        return summaries;
    }
}
