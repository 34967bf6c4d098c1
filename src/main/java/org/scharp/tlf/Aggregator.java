///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Summarizes a set of variables over the groups of a trial, producing long-form summary data that can be bound to a
 * {@link TableModel}.
 * <p>
 * The records given to the aggregator must already be filtered to the population of interest (for example, subjects
 * in the safety population).
 * </p>
 */
public final class Aggregator {

    private static final Logger logger = LogManager.getLogger(Aggregator.class);

    // private constructor to prevent anyone from instantiating the class.
    private Aggregator() {
    }

    /**
     * Summarizes variables with the groups listed in the order in which they first appear in {@code records}.
     *
     * @param records
     *     The subject records
     * @param variables
     *     The variables to summarize, in display order.
     *
     * @return The summary rows, as described in {@link #aggregate(List, List, List)}.
     */
    public static List<SummaryRow> aggregate(List<SubjectRecord> records, List<Variable> variables) {
        ArgumentUtil.checkNoNullElements(records, "records");
        return aggregate(records, StatEngine.observedGroups(records), variables);
    }

    /**
     * Summarizes variables over the given groups.
     * <p>
     * Each variable is summarized according to its type: categorical variables with
     * {@link StatEngine#summarizeCategorical(List, List, Variable)} and continuous variables with
     * {@link StatEngine#summarizeContinuous(List, List, Variable)}.  The rows of each variable are tagged with the
     * variable's {@link Variable#categoryLabel() category label}. The results are concatenated in the order in which
     * the variables are given.
     * </p>
     * <p>
     * Every variable's type is checked before anything is summarized, so a variable without a type fails the whole call.
     * </p>
     *
     * @param records
     *     The subject records
     * @param groups
     *     The groups in display order. Every record's group must be in this list. Groups without records are
     *     summarized as having no subjects.
     * @param variables
     *     The variables to summarize, in display order.
     *
     * @return A new list of summary rows.
     *
     * @throws NullPointerException
     *     if any argument is {@code null} or contains {@code null}.
     * @throws UnknownVariableTypeException
     *     if a variable has no type.
     * @throws IllegalArgumentException
     *     if a record's group is not in {@code groups} or a continuous variable has a non-numeric value.
     */
    public static List<SummaryRow> aggregate(List<SubjectRecord> records, List<String> groups,
        List<Variable> variables) {
        ArgumentUtil.checkNoNullElements(records, "records");
        ArgumentUtil.checkNoNullElements(groups, "groups");
        ArgumentUtil.checkNoNullElements(variables, "variables");

        for (Variable variable : variables) {
            if (variable.type() == null) {
                throw new UnknownVariableTypeException(variable.name());
            }
        }

        List<SummaryRow> rows = new ArrayList<>();
        for (Variable variable : variables) {
            final List<SummaryRow> variableRows;
            switch (variable.type()) {
            case CATEGORICAL:
                variableRows = StatEngine.summarizeCategorical(records, groups, variable);
                break;

            case CONTINUOUS:
                variableRows = StatEngine.summarizeContinuous(records, groups, variable);
                break;

            default:
                throw new UnknownVariableTypeException(variable.name());
            }

            logger.debug("Summarized {} variable {} into {} rows", variable.type(), variable.name(),
                variableRows.size());
            rows.addAll(variableRows);
        }
        return rows;
    }

    /**
     * Summarizes event rates at a 95% confidence level.
     *
     * @param records
     *     The subject records
     * @param response
     *     The categorical variable that records whether a subject had the event
     * @param eventValue
     *     The value of {@code response} that indicates an event
     * @param subgroup
     *     The categorical variable that stratifies the subjects, or {@code null} for a single overall summary.
     * @param treatmentGroup
     *     The group in the numerator of the odds ratio
     * @param referenceGroup
     *     The group in the denominator of the odds ratio
     *
     * @return The response summaries, as described in
     *     {@link #aggregateResponses(List, Variable, Object, Variable, String, String, double)}.
     */
    public static List<ResponseSummary> aggregateResponses(List<SubjectRecord> records, Variable response,
        Object eventValue, Variable subgroup, String treatmentGroup, String referenceGroup) {
        return aggregateResponses(records, response, eventValue, subgroup, treatmentGroup, referenceGroup,
            StatEngine.DEFAULT_CONFIDENCE);
    }

    /**
     * Summarizes event rates per subgroup with
     * {@link StatEngine#summarizeResponses(List, Variable, Object, Variable, String, String, double)}.
     *
     * @param records
     *     The subject records
     * @param response
     *     The categorical variable that records whether a subject had the event
     * @param eventValue
     *     The value of {@code response} that indicates an event
     * @param subgroup
     *     The categorical variable that stratifies the subjects, or {@code null} for a single overall summary.
     * @param treatmentGroup
     *     The group in the numerator of the odds ratio
     * @param referenceGroup
     *     The group in the denominator of the odds ratio
     * @param confidence
     *     The confidence level for the intervals
     *
     * @return A new list of response summaries.
     *
     * @throws UnknownVariableTypeException
     *     if {@code response} or {@code subgroup} has no type.
     * @throws IllegalArgumentException
     *     if {@code response} or {@code subgroup} is continuous.
     */
    public static List<ResponseSummary> aggregateResponses(List<SubjectRecord> records, Variable response,
        Object eventValue, Variable subgroup, String treatmentGroup, String referenceGroup, double confidence) {
        ArgumentUtil.checkNotNull(response, "response");
        checkCategorical(response, "response");
        if (subgroup != null) {
            checkCategorical(subgroup, "subgroup");
        }

        List<ResponseSummary> summaries = StatEngine.summarizeResponses(records, response, eventValue, subgroup,
            treatmentGroup, referenceGroup, confidence);
        logger.debug("Summarized responses of {} into {} subgroups", response.name(), summaries.size());
        return summaries;
    }

    private static void checkCategorical(Variable variable, String argumentName) {
        if (variable.type() == null) {
            throw new UnknownVariableTypeException(variable.name());
        }
        if (variable.type() != VariableType.CATEGORICAL) {
            throw new IllegalArgumentException(argumentName + " must be a categorical variable");
        }
    }
}
