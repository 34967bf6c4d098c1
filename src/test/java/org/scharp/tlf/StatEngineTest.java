///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link StatEngine}. */
public class StatEngineTest {

    private static final double TOLERANCE = 1e-6;

    private static final Variable SEX = Variable.builder().
        name("SEX").
        type(VariableType.CATEGORICAL).
        label("Sex").
        levels(List.of("F", "M")).
        build();

    private static final Variable AGE = Variable.builder().
        name("AGE").
        type(VariableType.CONTINUOUS).
        label("Age").
        unit("years").
        build();

    private static SubjectRecord record(String group, String variableName, Object value) {
        Map<String, Object> values = new HashMap<>();
        values.put(variableName, value);
        return new SubjectRecord(group, values);
    }

    private static void assertDouble(double expected, Object actual) {
        assertTrue(actual instanceof Double, "expected a Double but was " + actual);
        assertThat((Double) actual, closeTo(expected, TOLERANCE));
    }

    //
    // summarizeCategorical
    //

    @Test
    void testSummarizeCategorical() {
        List<SubjectRecord> records = List.of(
            record("Placebo", "SEX", "F"),
            record("Placebo", "SEX", "M"),
            record("Placebo", "SEX", null),
            record("Drug", "SEX", "F"),
            record("Drug", "SEX", "F"));

        List<SummaryRow> rows = StatEngine.summarizeCategorical(records, List.of("Placebo", "Drug"), SEX);

        assertEquals(3, rows.size());

        SummaryRow female = rows.get(0);
        assertEquals("F", female.label());
        assertEquals("Sex", female.category());
        assertEquals(List.of("Placebo", "Drug"), female.groups());
        assertEquals(1, female.value("Placebo", Statistic.N));
        assertDouble(1.0 / 3, female.value("Placebo", Statistic.PERCENT));
        assertEquals(2, female.value("Drug", Statistic.N));
        assertDouble(1.0, female.value("Drug", Statistic.PERCENT));

        // A level that no one in a group has is still reported.
        SummaryRow male = rows.get(1);
        assertEquals("M", male.label());
        assertEquals(1, male.value("Placebo", Statistic.N));
        assertEquals(0, male.value("Drug", Statistic.N));
        assertDouble(0.0, male.value("Drug", Statistic.PERCENT));

        // Missing values are counted last so that each group's counts add up to its size.
        SummaryRow missing = rows.get(2);
        assertEquals(StatEngine.MISSING_CATEGORY, missing.label());
        assertEquals(1, missing.value("Placebo", Statistic.N));
        assertEquals(0, missing.value("Drug", Statistic.N));
    }

    @Test
    void testSummarizeCategoricalUnlistedCategories() {
        List<SubjectRecord> records = List.of(
            record("A", "SEX", "U"),
            record("A", "SEX", "M"),
            record("A", "SEX", "X"),
            record("A", "SEX", "U"));

        List<SummaryRow> rows = StatEngine.summarizeCategorical(records, SEX);

        List<String> labels = new ArrayList<>();
        for (SummaryRow row : rows) {
            labels.add(row.label());
        }
        // Levels first, then the other categories in the order they were seen.
        assertEquals(List.of("F", "M", "U", "X"), labels);
        assertEquals(2, rows.get(2).value("A", Statistic.N));
        assertDouble(0.5, rows.get(2).value("A", Statistic.PERCENT));
    }

    @Test
    void testSummarizeCategoricalEmptyGroup() {
        List<SubjectRecord> records = List.of(record("Placebo", "SEX", "F"));

        List<SummaryRow> rows = StatEngine.summarizeCategorical(records, List.of("Placebo", "Drug"), SEX);

        assertEquals(2, rows.size());
        assertEquals(0, rows.get(0).value("Drug", Statistic.N));
        assertSame(MissingValue.UNDEFINED, rows.get(0).value("Drug", Statistic.PERCENT));
    }

    @Test
    void testSummarizeCategoricalNumericValues() {
        Variable dose = Variable.builder().name("DOSE").type(VariableType.CATEGORICAL).build();
        List<SubjectRecord> records = List.of(
            record("A", "DOSE", 10),
            record("A", "DOSE", 20),
            record("A", "DOSE", 10));

        List<SummaryRow> rows = StatEngine.summarizeCategorical(records, dose);

        assertEquals(2, rows.size());
        assertEquals("10", rows.get(0).label());
        assertEquals(2, rows.get(0).value("A", Statistic.N));
        assertEquals("20", rows.get(1).label());
        assertEquals("DOSE", rows.get(1).category());
    }

    @Test
    void testSummarizeCategoricalMixedValueTypes() {
        Variable dose = Variable.builder().name("DOSE").type(VariableType.CATEGORICAL).build();
        List<SubjectRecord> records = List.of(record("A", "DOSE", 1), record("A", "DOSE", "1"));

        // Values are categorized by their string form.
        List<SummaryRow> rows = StatEngine.summarizeCategorical(records, dose);

        assertEquals(1, rows.size());
        assertEquals("1", rows.get(0).label());
        assertEquals(2, rows.get(0).value("A", Statistic.N));
    }

    @Test
    void testSummarizeCategoricalValueNamedMissing() {
        Variable response = Variable.builder().name("RESP").type(VariableType.CATEGORICAL).build();
        List<SubjectRecord> records = List.of(
            record("A", "RESP", StatEngine.MISSING_CATEGORY),
            record("A", "RESP", StatEngine.MISSING_CATEGORY),
            record("A", "RESP", null),
            record("A", "RESP", "Yes"));

        List<SummaryRow> rows = StatEngine.summarizeCategorical(records, response);

        // The observed value and the missing values are counted in separate rows.
        assertEquals(3, rows.size());
        assertEquals(StatEngine.MISSING_CATEGORY, rows.get(0).label());
        assertEquals(2, rows.get(0).value("A", Statistic.N));
        assertEquals("Yes", rows.get(1).label());
        assertEquals(1, rows.get(1).value("A", Statistic.N));
        assertEquals(StatEngine.MISSING_CATEGORY, rows.get(2).label());
        assertEquals(1, rows.get(2).value("A", Statistic.N));
        assertDouble(0.25, rows.get(2).value("A", Statistic.PERCENT));

        int sum = 0;
        for (SummaryRow row : rows) {
            sum += (Integer) row.value("A", Statistic.N);
        }
        assertEquals(records.size(), sum);
    }

    @Test
    void testUnknownGroup() {
        List<SubjectRecord> records = List.of(record("Placebo", "SEX", "F"), record("Other", "SEX", "M"));

        Exception exception = assertThrows(IllegalArgumentException.class,
            () -> StatEngine.summarizeCategorical(records, List.of("Placebo", "Drug"), SEX));
        assertEquals("record group \"Other\" is not one of [Placebo, Drug]", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class,
            () -> StatEngine.summarizeContinuous(records, List.of("Placebo"), AGE));
        assertEquals("record group \"Other\" is not one of [Placebo]", exception.getMessage());
    }

    //
    // summarizeContinuous
    //

    @Test
    void testSummarizeContinuous() {
        List<SubjectRecord> records = List.of(
            record("Placebo", "AGE", 30),
            record("Placebo", "AGE", 40),
            record("Drug", "AGE", 50),
            record("Drug", "AGE", 60.0),
            record("Drug", "AGE", null));

        List<SummaryRow> rows = StatEngine.summarizeContinuous(records, AGE);

        assertEquals(4, rows.size());
        assertEquals(StatEngine.N_LABEL, rows.get(0).label());
        assertEquals(StatEngine.MEAN_SD_LABEL, rows.get(1).label());
        assertEquals(StatEngine.MEDIAN_LABEL, rows.get(2).label());
        assertEquals(StatEngine.RANGE_LABEL, rows.get(3).label());
        for (SummaryRow row : rows) {
            assertEquals("Age (years)", row.category());
            assertEquals(List.of("Placebo", "Drug"), row.groups());
        }

        // The missing age isn't counted.
        assertEquals(2, rows.get(0).value("Placebo", Statistic.N));
        assertEquals(2, rows.get(0).value("Drug", Statistic.N));

        assertDouble(35, rows.get(1).value("Placebo", Statistic.MEAN));
        assertDouble(Math.sqrt(50), rows.get(1).value("Placebo", Statistic.SD));
        assertDouble(55, rows.get(1).value("Drug", Statistic.MEAN));
        assertDouble(Math.sqrt(50), rows.get(1).value("Drug", Statistic.SD));

        assertDouble(35, rows.get(2).value("Placebo", Statistic.MEDIAN));
        assertDouble(55, rows.get(2).value("Drug", Statistic.MEDIAN));

        assertDouble(30, rows.get(3).value("Placebo", Statistic.MIN));
        assertDouble(40, rows.get(3).value("Placebo", Statistic.MAX));
        assertDouble(50, rows.get(3).value("Drug", Statistic.MIN));
        assertDouble(60, rows.get(3).value("Drug", Statistic.MAX));
    }

    @Test
    void testSummarizeContinuousOddMedian() {
        List<SubjectRecord> records = List.of(
            record("A", "AGE", 70),
            record("A", "AGE", 20),
            record("A", "AGE", 45));

        List<SummaryRow> rows = StatEngine.summarizeContinuous(records, AGE);

        assertDouble(45, rows.get(2).value("A", Statistic.MEDIAN));
        assertDouble(20, rows.get(3).value("A", Statistic.MIN));
        assertDouble(70, rows.get(3).value("A", Statistic.MAX));
    }

    @Test
    void testSummarizeContinuousSingleValue() {
        List<SubjectRecord> records = List.of(record("A", "AGE", 42));

        List<SummaryRow> rows = StatEngine.summarizeContinuous(records, AGE);

        assertEquals(1, rows.get(0).value("A", Statistic.N));
        assertDouble(42, rows.get(1).value("A", Statistic.MEAN));
        assertSame(MissingValue.UNDEFINED, rows.get(1).value("A", Statistic.SD));
        assertDouble(42, rows.get(2).value("A", Statistic.MEDIAN));
    }

    @Test
    void testSummarizeContinuousEmptyGroup() {
        List<SubjectRecord> records = List.of(record("A", "AGE", 42), record("B", "AGE", MissingValue.STANDARD));

        List<SummaryRow> rows = StatEngine.summarizeContinuous(records, List.of("A", "B", "C"), AGE);

        for (String group : List.of("B", "C")) {
            assertEquals(0, rows.get(0).value(group, Statistic.N));
            assertSame(MissingValue.NOT_APPLICABLE, rows.get(1).value(group, Statistic.MEAN));
            assertSame(MissingValue.NOT_APPLICABLE, rows.get(1).value(group, Statistic.SD));
            assertSame(MissingValue.NOT_APPLICABLE, rows.get(2).value(group, Statistic.MEDIAN));
            assertSame(MissingValue.NOT_APPLICABLE, rows.get(3).value(group, Statistic.MIN));
            assertSame(MissingValue.NOT_APPLICABLE, rows.get(3).value(group, Statistic.MAX));
        }
    }

    @Test
    void testSummarizeContinuousNonNumeric() {
        List<SubjectRecord> records = List.of(record("A", "AGE", 42), record("A", "AGE", "forty"));

        Exception exception = assertThrows(IllegalArgumentException.class,
            () -> StatEngine.summarizeContinuous(records, AGE));
        assertEquals("value of AGE must be a Number but was \"forty\"", exception.getMessage());
    }

    @Test
    void testNullArguments() {
        Exception exception = assertThrows(NullPointerException.class,
            () -> StatEngine.summarizeCategorical(null, SEX));
        assertEquals("records must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class,
            () -> StatEngine.summarizeContinuous(List.of(), List.of(), null));
        assertEquals("variable must not be null", exception.getMessage());
    }

    //
    // clopperPearson
    //

    @Test
    void testClopperPearson() {
        ConfidenceInterval interval = StatEngine.clopperPearson(3, 10);
        assertThat(interval.lower(), closeTo(0.06673951, TOLERANCE));
        assertThat(interval.upper(), closeTo(0.65245285, TOLERANCE));
        assertThat(interval.lowerPercent(), closeTo(6.673951, 1e-4));
        assertThat(interval.upperPercent(), closeTo(65.245285, 1e-4));
        assertTrue(interval.isDefined());

        // The interval for the complementary proportion is the mirror image.
        interval = StatEngine.clopperPearson(7, 10);
        assertThat(interval.lower(), closeTo(1 - 0.65245285, TOLERANCE));
        assertThat(interval.upper(), closeTo(1 - 0.06673951, TOLERANCE));
    }

    @Test
    void testClopperPearsonBoundaries() {
        // With no successes, the lower bound is 0 and the upper bound has a closed form.
        ConfidenceInterval interval = StatEngine.clopperPearson(0, 10);
        assertEquals(0.0, interval.lower());
        assertThat(interval.upper(), closeTo(1 - Math.pow(0.025, 0.1), TOLERANCE));

        // With all successes, the upper bound is 1.
        interval = StatEngine.clopperPearson(10, 10);
        assertThat(interval.lower(), closeTo(Math.pow(0.025, 0.1), TOLERANCE));
        assertEquals(1.0, interval.upper());
        assertEquals(100.0, interval.upperPercent());

        // A single subject
        interval = StatEngine.clopperPearson(1, 1);
        assertThat(interval.lower(), closeTo(0.025, TOLERANCE));
        assertEquals(1.0, interval.upper());
    }

    @Test
    void testClopperPearsonConfidence() {
        ConfidenceInterval interval95 = StatEngine.clopperPearson(5, 20);
        ConfidenceInterval interval90 = StatEngine.clopperPearson(5, 20, 0.90);
        ConfidenceInterval interval99 = StatEngine.clopperPearson(5, 20, 0.99);

        // Higher confidence means a wider interval.
        assertThat(interval90.lower(), greaterThan(interval95.lower()));
        assertThat(interval90.upper(), lessThan(interval95.upper()));
        assertThat(interval99.lower(), lessThan(interval95.lower()));
        assertThat(interval99.upper(), greaterThan(interval95.upper()));

        // Every interval contains the point estimate.
        for (ConfidenceInterval interval : List.of(interval90, interval95, interval99)) {
            assertThat(interval.lower(), lessThan(0.25));
            assertThat(interval.upper(), greaterThan(0.25));
        }
    }

    @Test
    void testClopperPearsonNoSubjects() {
        ConfidenceInterval interval = StatEngine.clopperPearson(0, 0);
        assertEquals(ConfidenceInterval.UNDEFINED, interval);
        assertFalse(interval.isDefined());
        assertTrue(Double.isNaN(interval.lowerPercent()));
    }

    @Test
    void testClopperPearsonInvalidArguments() {
        Exception exception = assertThrows(IllegalArgumentException.class, () -> StatEngine.clopperPearson(11, 10));
        assertEquals("successes must not be greater than total", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> StatEngine.clopperPearson(-1, 10));
        assertEquals("successes must not be negative", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> StatEngine.clopperPearson(0, -1));
        assertEquals("total must not be negative", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> StatEngine.clopperPearson(3, 10, 1.0));
        assertEquals("confidence must be between 0 and 1 (exclusive)", exception.getMessage());
    }

    //
    // oddsRatio
    //

    @Test
    void testOddsRatio() {
        OddsRatio oddsRatio = StatEngine.oddsRatio(7, 10, 3, 10);

        double expected = (7.0 / 3) / (3.0 / 7);
        assertThat(oddsRatio.estimate(), closeTo(expected, 1e-12));
        assertTrue(oddsRatio.isDefined());

        // Wald interval on the log scale.
        double standardError = Math.sqrt(1.0 / 7 + 1.0 / 3 + 1.0 / 3 + 1.0 / 7);
        double z = 1.959963984540054;
        assertThat(oddsRatio.interval().lower(), closeTo(Math.exp(Math.log(expected) - z * standardError), TOLERANCE));
        assertThat(oddsRatio.interval().upper(), closeTo(Math.exp(Math.log(expected) + z * standardError), TOLERANCE));
        assertThat(oddsRatio.interval().lower(), lessThan(oddsRatio.estimate()));
        assertThat(oddsRatio.interval().upper(), greaterThan(oddsRatio.estimate()));
    }

    @Test
    void testOddsRatioSymmetry() {
        // Swapping the groups inverts the ratio.
        OddsRatio forward = StatEngine.oddsRatio(4, 12, 6, 9);
        OddsRatio backward = StatEngine.oddsRatio(6, 9, 4, 12);
        assertThat(forward.estimate() * backward.estimate(), closeTo(1.0, 1e-12));
        assertThat(forward.interval().lower() * backward.interval().upper(), closeTo(1.0, TOLERANCE));
    }

    @Test
    void testOddsRatioZeroCells() {
        // No events in the treatment group: the estimate is 0 but there's no interval.
        OddsRatio oddsRatio = StatEngine.oddsRatio(0, 10, 3, 10);
        assertEquals(0.0, oddsRatio.estimate());
        assertTrue(oddsRatio.isEstimateDefined());
        assertFalse(oddsRatio.interval().isDefined());
        assertFalse(oddsRatio.isDefined());

        // All events in the treatment group
        oddsRatio = StatEngine.oddsRatio(10, 10, 3, 10);
        assertFalse(oddsRatio.isEstimateDefined());
        assertEquals(ConfidenceInterval.UNDEFINED, oddsRatio.interval());

        // No events in the reference group
        oddsRatio = StatEngine.oddsRatio(3, 10, 0, 10);
        assertTrue(Double.isNaN(oddsRatio.estimate()));
        assertEquals(ConfidenceInterval.UNDEFINED, oddsRatio.interval());

        // All events in the reference group
        oddsRatio = StatEngine.oddsRatio(3, 10, 10, 10);
        assertFalse(oddsRatio.isEstimateDefined());
        assertFalse(oddsRatio.isDefined());

        // Empty groups
        oddsRatio = StatEngine.oddsRatio(0, 0, 0, 0);
        assertFalse(oddsRatio.isDefined());
    }

    @Test
    void testOddsRatioInvalidArguments() {
        Exception exception = assertThrows(IllegalArgumentException.class, () -> StatEngine.oddsRatio(5, 4, 1, 2));
        assertEquals("eventsA must not be greater than totalA", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> StatEngine.oddsRatio(1, 4, 3, 2));
        assertEquals("eventsB must not be greater than totalB", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> StatEngine.oddsRatio(1, 4, -1, 2));
        assertEquals("eventsB must not be negative", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> StatEngine.oddsRatio(1, 4, 1, 2, 0));
        assertEquals("confidence must be between 0 and 1 (exclusive)", exception.getMessage());
    }

    //
    // summarizeResponses
    //

    private static List<SubjectRecord> responseRecords() {
        List<SubjectRecord> records = new ArrayList<>();
        // Drug: 7 of 10 respond; Placebo: 3 of 10 respond.
        for (int i = 0; i < 10; i++) {
            records.add(new SubjectRecord("Drug", Map.of("RESP", i < 7 ? "Y" : "N", "SITE", i % 2 == 0 ? "A" : "B")));
        }
        for (int i = 0; i < 10; i++) {
            records.add(new SubjectRecord("Placebo", Map.of("RESP", i < 3 ? "Y" : "N", "SITE", i % 2 == 0 ? "A" : "B")));
        }
        return records;
    }

    private static final Variable RESPONSE = Variable.builder().name("RESP").type(VariableType.CATEGORICAL).build();

    private static final Variable SITE = Variable.builder().name("SITE").type(VariableType.CATEGORICAL).build();

    @Test
    void testSummarizeResponsesOverall() {
        List<ResponseSummary> summaries = StatEngine.summarizeResponses(responseRecords(), RESPONSE, "Y", null,
            "Drug", "Placebo", 0.95);

        assertEquals(1, summaries.size());
        ResponseSummary summary = summaries.get(0);
        assertEquals(StatEngine.OVERALL_SUBGROUP, summary.subgroup());
        assertEquals(List.of("Drug", "Placebo"), summary.groups());

        assertEquals(7, summary.response("Drug").events());
        assertEquals(10, summary.response("Drug").total());
        assertThat(summary.response("Drug").proportion(), closeTo(0.7, 1e-12));
        assertEquals(StatEngine.clopperPearson(7, 10), summary.response("Drug").interval());

        assertEquals(3, summary.response("Placebo").events());
        assertEquals(StatEngine.clopperPearson(3, 10), summary.response("Placebo").interval());

        assertEquals(StatEngine.oddsRatio(7, 10, 3, 10), summary.oddsRatio());
    }

    @Test
    void testSummarizeResponsesBySubgroup() {
        List<ResponseSummary> summaries = StatEngine.summarizeResponses(responseRecords(), RESPONSE, "Y", SITE,
            "Drug", "Placebo", 0.95);

        assertEquals(2, summaries.size());
        assertEquals("A", summaries.get(0).subgroup());
        assertEquals("B", summaries.get(1).subgroup());

        // Site A has the even-numbered subjects: Drug responders 0, 2, 4, 6 and Placebo responders 0, 2.
        assertEquals(4, summaries.get(0).response("Drug").events());
        assertEquals(5, summaries.get(0).response("Drug").total());
        assertEquals(2, summaries.get(0).response("Placebo").events());
        assertEquals(5, summaries.get(0).response("Placebo").total());

        assertEquals(3, summaries.get(1).response("Drug").events());
        assertEquals(1, summaries.get(1).response("Placebo").events());
    }

    @Test
    void testSummarizeResponsesMissingResponse() {
        List<SubjectRecord> records = new ArrayList<>(responseRecords());
        records.add(record("Drug", "RESP", null));

        List<ResponseSummary> summaries = StatEngine.summarizeResponses(records, RESPONSE, "Y", null,
            "Drug", "Placebo", 0.95);

        // A subject without a response is a non-responder.
        assertEquals(7, summaries.get(0).response("Drug").events());
        assertEquals(11, summaries.get(0).response("Drug").total());
    }

    @Test
    void testSummarizeResponsesSubgroupNamedMissing() {
        List<SubjectRecord> records = List.of(
            new SubjectRecord("Drug", Map.of("RESP", "Y", "SITE", StatEngine.MISSING_CATEGORY)),
            new SubjectRecord("Drug", Map.of("RESP", "Y")),
            new SubjectRecord("Drug", Map.of("RESP", "N")),
            new SubjectRecord("Placebo", Map.of("RESP", "N", "SITE", StatEngine.MISSING_CATEGORY)));

        List<ResponseSummary> summaries = StatEngine.summarizeResponses(records, RESPONSE, "Y", SITE,
            "Drug", "Placebo", 0.95);

        // Subjects without a site are not mixed into the site that is spelled "Missing".
        assertEquals(2, summaries.size());
        assertEquals(StatEngine.MISSING_CATEGORY, summaries.get(0).subgroup());
        assertEquals(1, summaries.get(0).response("Drug").total());
        assertEquals(1, summaries.get(0).response("Placebo").total());
        assertEquals(StatEngine.MISSING_CATEGORY, summaries.get(1).subgroup());
        assertEquals(2, summaries.get(1).response("Drug").total());
        assertEquals(1, summaries.get(1).response("Drug").events());
        assertEquals(0, summaries.get(1).response("Placebo").total());
    }

    @Test
    void testSummarizeResponsesAbsentGroup() {
        List<SubjectRecord> records = List.of(record("Drug", "RESP", "Y"), record("Drug", "RESP", "N"));

        List<ResponseSummary> summaries = StatEngine.summarizeResponses(records, RESPONSE, "Y", null,
            "Drug", "Placebo", 0.95);

        ResponseSummary summary = summaries.get(0);
        assertEquals(List.of("Drug", "Placebo"), summary.groups());
        assertEquals(0, summary.response("Placebo").total());
        assertTrue(Double.isNaN(summary.response("Placebo").proportion()));
        assertEquals(ConfidenceInterval.UNDEFINED, summary.response("Placebo").interval());
        assertFalse(summary.oddsRatio().isDefined());
    }

    @Test
    void testSummarizeResponsesSameGroups() {
        Exception exception = assertThrows(IllegalArgumentException.class,
            () -> StatEngine.summarizeResponses(responseRecords(), RESPONSE, "Y", null, "Drug", "Drug", 0.95));
        assertEquals("treatmentGroup and referenceGroup must be different", exception.getMessage());
    }
}
