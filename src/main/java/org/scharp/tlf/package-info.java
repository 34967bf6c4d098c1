///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library builds the summary tables that are reported for clinical trials.
 * </p>
 *
 * <p>
 * A table is produced in four stages:
 * </p>
 * <ol>
 * <li>{@link org.scharp.tlf.StatEngine} computes descriptive statistics and confidence intervals.</li>
 * <li>{@link org.scharp.tlf.Aggregator} summarizes a list of variables over the trial's groups, producing long-form
 * summary rows.</li>
 * <li>{@link org.scharp.tlf.TableModel} binds the summary rows into an abstract table, which is then shaped with
 * format rules, merges, spanners, row groups, and footnotes.</li>
 * <li>{@link org.scharp.tlf.Renderer} resolves the model into a {@link org.scharp.tlf.Grid} of finalized text.</li>
 * </ol>
 *
 * <pre>
 * Variable sex = Variable.builder().
 *     name("SEX").
 *     type(VariableType.CATEGORICAL).
 *     label("Sex").
 *     levels(List.of("F", "M")).
 *     build();
 *
 * Variable age = Variable.builder().
 *     name("AGE").
 *     type(VariableType.CONTINUOUS).
 *     label("Age").
 *     unit("years").
 *     build();
 *
 * List&lt;SubjectRecord&gt; records = List.of(
 *     new SubjectRecord("Placebo", Map.of("SEX", "F", "AGE", 30)),
 *     new SubjectRecord("Placebo", Map.of("SEX", "M", "AGE", 40)),
 *     new SubjectRecord("Drug", Map.of("SEX", "F", "AGE", 50)),
 *     new SubjectRecord("Drug", Map.of("SEX", "F", "AGE", 60)));
 *
 * List&lt;SummaryRow&gt; summary = Aggregator.aggregate(records, List.of("Placebo", "Drug"), List.of(sex, age));
 *
 * TableModel model = TableModel.bind(summary, SummaryRow.LABEL_FIELD, SummaryRow.CATEGORY_FIELD).
 *     title("Table 14.1.1 Demographics").
 *     applyFormat(ColumnSelector.prefix("pct_"), FormatRule.percent(1)).
 *     applyFormat(ColumnSelector.prefix("mean_").or(ColumnSelector.prefix("sd_")), FormatRule.fixedDecimal(1)).
 *     mergeColumns("Placebo", List.of("n_Placebo", "pct_Placebo"), "{1} ({2})").
 *     mergeColumns("Drug", List.of("n_Drug", "pct_Drug"), "{1} ({2})");
 *
 * Grid grid = model.render();
 * </pre>
 *
 * <h2>A Clinical Table Primer for Java Programmers</h2>
 *
 * <p>
 * The results of a clinical trial are reported as "tables, listings, and figures" (TLFs). A summary table has one
 * column per treatment group (or "arm") and one or more rows per variable.  The left-most column, called the "stub",
 * holds the label of each row.  Rows that belong to the same variable are gathered under a row group whose label is
 * the variable's label.
 * </p>
 *
 * <p>
 * A categorical variable, such as sex or race, is summarized by the number of subjects in each category and that
 * number as a percentage of the subjects in the group.  A continuous variable, such as age or weight, is summarized by
 * the number of subjects with a value, the mean, the standard deviation, the median, and the range. Tables
 * conventionally merge several statistics into a single cell, for example "12 (40.0%)" or "35.2 (7.1)".
 * </p>
 *
 * <p>
 * Efficacy tables report the proportion of subjects who had a response, with an exact (Clopper-Pearson) confidence
 * interval, and the odds ratio of a response in the treatment group relative to the reference group.
 * </p>
 *
 * <p>
 * Statistics that can't be computed, such as the standard deviation of a single value, are represented by
 * {@link org.scharp.tlf.MissingValue} and appear in the rendered table as the model's missing text.
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * This library checks its input strictly and throws clear exceptions as soon as possible (fail-fast).  A reference to
 * an unknown row, column, or field is reported with {@link org.scharp.tlf.UnknownReferenceException} when the
 * transformation is applied, not when the table is rendered.  A transformation that throws leaves the table model
 * unchanged.
 * </p>
 */
package org.scharp.tlf;
