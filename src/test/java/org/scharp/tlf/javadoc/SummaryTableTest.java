package org.scharp.tlf.javadoc;

import org.junit.jupiter.api.Test;
import org.scharp.tlf.Aggregator;
import org.scharp.tlf.ColumnSelector;
import org.scharp.tlf.FootnoteLocation;
import org.scharp.tlf.FootnoteMarks;
import org.scharp.tlf.FormatRule;
import org.scharp.tlf.Grid;
import org.scharp.tlf.GridRow;
import org.scharp.tlf.ResponseSummary;
import org.scharp.tlf.RowSelector;
import org.scharp.tlf.StatEngine;
import org.scharp.tlf.SubjectRecord;
import org.scharp.tlf.SummaryRow;
import org.scharp.tlf.TableModel;
import org.scharp.tlf.Variable;
import org.scharp.tlf.VariableType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * A class for executing the sample code that's within the JavaDoc.
 */
public class SummaryTableTest {

    @Test
    void testPackageSample() {
        Variable sex = Variable.builder().
            name("SEX").
            type(VariableType.CATEGORICAL).
            label("Sex").
            levels(List.of("F", "M")).
            build();

        Variable age = Variable.builder().
            name("AGE").
            type(VariableType.CONTINUOUS).
            label("Age").
            unit("years").
            build();

        List<SubjectRecord> records = List.of(
            new SubjectRecord("Placebo", Map.of("SEX", "F", "AGE", 30)),
            new SubjectRecord("Placebo", Map.of("SEX", "M", "AGE", 40)),
            new SubjectRecord("Drug", Map.of("SEX", "F", "AGE", 50)),
            new SubjectRecord("Drug", Map.of("SEX", "F", "AGE", 60)));

        List<SummaryRow> summary = Aggregator.aggregate(records, List.of("Placebo", "Drug"), List.of(sex, age));

        TableModel model = TableModel.bind(summary, SummaryRow.LABEL_FIELD, SummaryRow.CATEGORY_FIELD).
            title("Table 14.1.1 Demographics").
            applyFormat(ColumnSelector.prefix("pct_"), FormatRule.percent(1)).
            applyFormat(ColumnSelector.prefix("mean_").or(ColumnSelector.prefix("sd_")), FormatRule.fixedDecimal(1)).
            mergeColumns("Placebo", List.of("n_Placebo", "pct_Placebo"), "{1} ({2})").
            mergeColumns("Drug", List.of("n_Drug", "pct_Drug"), "{1} ({2})");

        Grid grid = model.render();

        assertEquals("Table 14.1.1 Demographics", grid.title());
        assertEquals("Placebo", grid.columns().get(0).id());
        assertEquals("Drug", grid.columns().get(1).id());
        assertEquals("1 (50.0%)", grid.text("row1", "Placebo"));
        assertEquals("2 (100.0%)", grid.text("row1", "Drug"));
        assertEquals("1 (50.0%)", grid.text("row2", "Placebo"));
        assertEquals("0 (0.0%)", grid.text("row2", "Drug"));
        assertEquals("35.0", grid.text("row4", "mean_Placebo"));
        assertEquals("55.0", grid.text("row4", "mean_Drug"));
    }

    /**
     * The demographics table for four subjects, two in each arm.
     */
    @Test
    void testDemographicsTable() {
        Variable age = Variable.builder().
            name("AGE").
            type(VariableType.CONTINUOUS).
            label("Age").
            unit("years").
            build();

        List<SubjectRecord> records = List.of(
            new SubjectRecord("Placebo", Map.of("AGE", 30)),
            new SubjectRecord("Placebo", Map.of("AGE", 40)),
            new SubjectRecord("Drug 1", Map.of("AGE", 50)),
            new SubjectRecord("Drug 1", Map.of("AGE", 60)));

        List<SummaryRow> summary = Aggregator.aggregate(records, List.of(age));

        List<String> groups = List.of("Placebo", "Drug 1");
        TableModel model = TableModel.bind(summary, SummaryRow.LABEL_FIELD, SummaryRow.CATEGORY_FIELD).
            stubHeader("Characteristic").
            applyFormat(ColumnSelector.prefix("mean_").or(ColumnSelector.prefix("median_")), FormatRule.fixedDecimal(1)).
            applyFormat(ColumnSelector.prefix("sd_"), FormatRule.fixedDecimal(2)).
            applyFormat(ColumnSelector.prefix("min_").or(ColumnSelector.prefix("max_")), FormatRule.integer());
        for (String group : groups) {
            model.
                mergeColumns("stat_" + group, List.of("mean_" + group, "sd_" + group), "{1} ({2})").
                mergeColumns("range_" + group, List.of("min_" + group, "max_" + group), "{1} - {2}").
                relabelColumns(Map.of("n_" + group, group));
        }
        model.addSpanner("Treatment", List.of("n_Placebo", "n_Drug 1"));

        Grid grid = model.render();

        assertEquals("Characteristic", grid.stubHeader());
        assertEquals(2, grid.headerRows().size());

        List<GridRow> body = grid.body();
        assertEquals(GridRow.Kind.GROUP_HEADER, body.get(0).kind());
        assertEquals("Age (years)", body.get(0).stub().text());

        assertEquals("2", grid.text("row1", "n_Placebo"));
        assertEquals("2", grid.text("row1", "n_Drug 1"));
        assertEquals("35.0 (7.07)", grid.text("row2", "stat_Placebo"));
        assertEquals("55.0 (7.07)", grid.text("row2", "stat_Drug 1"));
        assertEquals("35.0", grid.text("row3", "median_Placebo"));
        assertEquals("55.0", grid.text("row3", "median_Drug 1"));
        assertEquals("30 - 40", grid.text("row4", "range_Placebo"));
        assertEquals("50 - 60", grid.text("row4", "range_Drug 1"));
    }

    /**
     * The event rate table for ten subjects in each arm.
     */
    @Test
    void testEventRateTable() {
        List<SubjectRecord> records = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            records.add(new SubjectRecord("Placebo", Map.of("RESP", i < 3 ? "Y" : "N")));
            records.add(new SubjectRecord("Drug 1", Map.of("RESP", i < 7 ? "Y" : "N")));
        }

        Variable response = Variable.builder().
            name("RESP").
            type(VariableType.CATEGORICAL).
            label("Responder").
            build();

        List<ResponseSummary> summaries = Aggregator.aggregateResponses(records, response, "Y", null, "Drug 1",
            "Placebo");

        TableModel model = TableModel.bind(summaries, ResponseSummary.SUBGROUP_FIELD, null).
            applyFormat(ColumnSelector.prefix("pct_"), FormatRule.percent(1)).
            applyFormat(
                ColumnSelector.prefix("lower_").or(ColumnSelector.prefix("upper_")).or(ColumnSelector.prefix("or")),
                FormatRule.fixedDecimal(2)).
            footnoteMarks(FootnoteMarks.LETTERS);
        for (String group : List.of("Placebo", "Drug 1")) {
            model.
                mergeColumns("rate_" + group, List.of("events_" + group, "total_" + group, "pct_" + group),
                    "{1}/{2} ({3})").
                mergeColumns("ci_" + group, List.of("lower_" + group, "upper_" + group), "({1}, {2})");
        }
        model.
            mergeColumns("Odds Ratio", List.of("or", "or_lower", "or_upper"), "{1} ({2}, {3})").
            addFootnote(FootnoteLocation.columnHeaders("Odds Ratio"), "Drug 1 relative to Placebo").
            addFootnote(FootnoteLocation.columnHeaders("ci_Placebo", "ci_Drug 1"), "Exact (Clopper-Pearson) 95% CI");

        Grid grid = model.render();

        assertEquals(StatEngine.OVERALL_SUBGROUP, grid.row("row1").stub().text());
        assertEquals("3/10 (30.0%)", grid.text("row1", "rate_Placebo"));
        assertEquals("7/10 (70.0%)", grid.text("row1", "rate_Drug 1"));
        assertEquals("(0.07, 0.65)", grid.text("row1", "ci_Placebo"));
        assertEquals("(0.35, 0.93)", grid.text("row1", "ci_Drug 1"));
        assertEquals("5.44 (0.80, 36.87)", grid.text("row1", "Odds Ratio"));
        assertEquals(Map.of("a", "Drug 1 relative to Placebo", "b", "Exact (Clopper-Pearson) 95% CI"),
            grid.footnotes());
    }

    /**
     * A table whose merged value column shows a different statistic in each row group.
     */
    @Test
    void testRowSpecificMerges() {
        Variable sex = Variable.builder().name("SEX").type(VariableType.CATEGORICAL).label("Sex").build();
        Variable weight = Variable.builder().name("WT").type(VariableType.CONTINUOUS).label("Weight").unit("kg").build();

        List<SubjectRecord> records = List.of(
            new SubjectRecord("All", Map.of("SEX", "F", "WT", 60.5)),
            new SubjectRecord("All", Map.of("SEX", "M", "WT", 80.25)),
            new SubjectRecord("All", Map.of("SEX", "F", "WT", 70)));

        TableModel model = TableModel.bind(
                Aggregator.aggregate(records, List.of(sex, weight)),
                SummaryRow.LABEL_FIELD,
                SummaryRow.CATEGORY_FIELD).
            applyFormat(ColumnSelector.prefix("pct_"), FormatRule.percent(0)).
            applyFormat(ColumnSelector.all(), RowSelector.inGroup("Weight (kg)"), FormatRule.fixedDecimal(1)).
            applyFormat(ColumnSelector.prefix("n_"), FormatRule.integer()).
            mergeColumns("All", List.of("n_All", "pct_All"), "{1} ({2})", RowSelector.inGroup("Sex")).
            mergeColumns("All", List.of("mean_All", "sd_All"), "{1} ({2})", RowSelector.stub(StatEngine.MEAN_SD_LABEL)).
            mergeColumns("All", List.of("min_All", "max_All"), "{1} - {2}", RowSelector.stub(StatEngine.RANGE_LABEL)).
            substituteMissing("").
            indentRows(List.of("row1", "row2", "row3", "row4", "row5", "row6"), 1);

        Grid grid = model.render();

        // The median isn't merged, so it keeps a column of its own and the n column shows nothing in its row.
        assertEquals(
            " | All | median_All\n" +
                "Sex\n" +
                "  F | 2 (67%) | \n" +
                "  M | 1 (33%) | \n" +
                "Weight (kg)\n" +
                "  n | 3 | \n" +
                "  Mean (SD) | 70.3 (9.9) | \n" +
                "  Median |  | 70.0\n" +
                "  Min - Max | 60.5 - 80.3 | \n",
            grid.toString());
    }
}
