///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The abstract structure of a report table: rows, columns, row groups, spanners, merge rules, format rules, and
 * footnotes.
 * <p>
 * A model is created by {@linkplain #bind binding} long-form summary data and is then changed by a sequence of
 * transformations.  Each transformation either succeeds completely or throws without changing the model.  The order in
 * which merges and footnotes are declared is preserved and determines how the model is rendered.
 * </p>
 * <p>
 * A model has a single owner. It is not safe for concurrent use; callers that share a model between threads must
 * serialize all access to it.  Use {@link #copy()} to take a snapshot.
 * </p>
 *
 * <pre>
 * TableModel model = TableModel.bind(summaryRows, SummaryRow.LABEL_FIELD, SummaryRow.CATEGORY_FIELD).
 *     applyFormat(ColumnSelector.prefix("pct_"), FormatRule.percent(1)).
 *     mergeColumns("Placebo", List.of("n_Placebo", "pct_Placebo"), "{1} ({2})").
 *     footnoteMarks(FootnoteMarks.LETTERS);
 * Grid grid = model.render();
 * </pre>
 */
public final class TableModel {

    /** The default text of missing values. */
    public static final String DEFAULT_MISSING_TEXT = "NA";

    /**
     * A format rule applied to a resolved set of cells.
     */
    static final class FormatAssignment {
        private final Set<String> columnIds;
        private final Set<String> rowIds;
        private final FormatRule rule;

        FormatAssignment(Set<String> columnIds, Set<String> rowIds, FormatRule rule) {
            this.columnIds = Collections.unmodifiableSet(columnIds);
            this.rowIds = Collections.unmodifiableSet(rowIds);
            this.rule = rule;
        }

        boolean appliesTo(String rowId, String columnId) {
            return columnIds.contains(columnId) && rowIds.contains(rowId);
        }

        FormatRule rule() {
            return rule;
        }
    }

    private final List<Column> columns;
    private final List<Row> rows;
    private final List<String> rowGroups;
    private final List<Spanner> spanners;
    private final List<MergeRule> mergeRules;
    private final List<FormatAssignment> formatAssignments;
    private final List<Footnote> footnotes;

    private String title;
    private String subtitle;
    private String stubHeader;
    private String missingText;
    private FootnoteMarks footnoteMarks;

    private TableModel() {
        columns = new ArrayList<>();
        rows = new ArrayList<>();
        rowGroups = new ArrayList<>();
        spanners = new ArrayList<>();
        mergeRules = new ArrayList<>();
        formatAssignments = new ArrayList<>();
        footnotes = new ArrayList<>();

        title = "";
        subtitle = "";
        stubHeader = "";
        missingText = DEFAULT_MISSING_TEXT;
        footnoteMarks = FootnoteMarks.NUMBERS;
    }

    private TableModel(TableModel other) {
        // All elements are immutable, so copying the lists is a complete snapshot.
        columns = new ArrayList<>(other.columns);
        rows = new ArrayList<>(other.rows);
        rowGroups = new ArrayList<>(other.rowGroups);
        spanners = new ArrayList<>(other.spanners);
        mergeRules = new ArrayList<>(other.mergeRules);
        formatAssignments = new ArrayList<>(other.formatAssignments);
        footnotes = new ArrayList<>(other.footnotes);

        title = other.title;
        subtitle = other.subtitle;
        stubHeader = other.stubHeader;
        missingText = other.missingText;
        footnoteMarks = other.footnoteMarks;
    }

    /**
     * Creates a table model from long-form summary data.
     * <p>
     * Each element of {@code data} becomes a row whose stub is the value of the {@code stubField} field and whose row
     * group is the value of the {@code groupField} field.  A row whose group is blank or missing isn't in any row group.
     * Every other field becomes a column, in the order in which the fields are first seen.  A column's identifier and
     * initial label are the field's name. Rows are identified as "row1", "row2", and so on.
     * </p>
     * <p>
     * The data is copied, so the model doesn't share any state with the summaries from which it was created.
     * </p>
     *
     * @param data
     *     The summary data
     * @param stubField
     *     The name of the field that holds each row's stub label, for example {@link SummaryRow#LABEL_FIELD}.
     * @param groupField
     *     The name of the field that holds each row's group, for example {@link SummaryRow#CATEGORY_FIELD}, or
     *     {@code null} if the rows aren't grouped.
     *
     * @return A new table model
     *
     * @throws NullPointerException
     *     if {@code data} or {@code stubField} is {@code null}, or if {@code data} contains {@code null}.
     * @throws UnknownReferenceException
     *     if a row doesn't have the stub or group field.
     */
    public static TableModel bind(List<? extends LongFormRow> data, String stubField, String groupField) {
        ArgumentUtil.checkNoNullElements(data, "data");
        ArgumentUtil.checkNotNull(stubField, "stubField");

        TableModel model = new TableModel();
        Set<String> columnIds = new LinkedHashSet<>();
        int rowNumber = 0;
        for (LongFormRow dataRow : data) {
            rowNumber++;
            Map<String, Object> fields = new LinkedHashMap<>(dataRow.fields());

            if (!fields.containsKey(stubField)) {
                throw new UnknownReferenceException("field", stubField);
            }
            String stub = textOf(fields.remove(stubField));

            String group = null;
            if (groupField != null) {
                if (!fields.containsKey(groupField)) {
                    throw new UnknownReferenceException("field", groupField);
                }
                group = textOf(fields.remove(groupField));
                if (group.isBlank()) {
                    group = null;
                } else if (!model.rowGroups.contains(group)) {
                    model.rowGroups.add(group);
                }
            }

            columnIds.addAll(fields.keySet());
            model.rows.add(new Row("row" + rowNumber, stub, 0, group, Collections.unmodifiableMap(fields)));
        }

        for (String columnId : columnIds) {
            model.columns.add(new Column(columnId, columnId, 0, Alignment.CENTER, false, false));
        }
        return model;
    }

    private static String textOf(Object value) {
        return MissingValue.isMissing(value) ? "" : value.toString();
    }

    /**
     * Creates an independent copy of this model.  Transformations of the copy don't affect this model, and vice versa.
     *
     * @return A new table model
     */
    public TableModel copy() {
        return new TableModel(this);
    }

    //
    // Lookup
    //

    private int columnIndex(String columnId) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).id().equals(columnId)) {
                return i;
            }
        }
        return -1;
    }

    private int rowIndex(String rowId) {
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).id().equals(rowId)) {
                return i;
            }
        }
        return -1;
    }

    private void checkColumnsExist(Iterable<String> columnIds) {
        for (String columnId : columnIds) {
            if (columnIndex(columnId) < 0) {
                throw new UnknownReferenceException("column", columnId);
            }
        }
    }

    private void checkRowsExist(Iterable<String> rowIds) {
        for (String rowId : rowIds) {
            if (rowIndex(rowId) < 0) {
                throw new UnknownReferenceException("row", rowId);
            }
        }
    }

    /**
     * Gets a column.
     *
     * @param columnId
     *     The column's identifier
     *
     * @return The column
     *
     * @throws UnknownReferenceException
     *     if there is no such column.
     */
    public Column column(String columnId) {
        int index = columnIndex(columnId);
        if (index < 0) {
            throw new UnknownReferenceException("column", columnId);
        }
        return columns.get(index);
    }

    /**
     * Gets a row.
     *
     * @param rowId
     *     The row's identifier
     *
     * @return The row
     *
     * @throws UnknownReferenceException
     *     if there is no such row.
     */
    public Row row(String rowId) {
        int index = rowIndex(rowId);
        if (index < 0) {
            throw new UnknownReferenceException("row", rowId);
        }
        return rows.get(index);
    }

    /**
     * Gets the identifiers of the columns that a selector selects.
     *
     * @param selector
     *     The selector
     *
     * @return A new list of column identifiers, in column order.
     *
     * @throws UnknownReferenceException
     *     if the selector names a column that isn't in this model.
     */
    public List<String> columnIds(ColumnSelector selector) {
        ArgumentUtil.checkNotNull(selector, "selector");
        checkColumnsExist(selector.requiredIds());

        List<String> selected = new ArrayList<>();
        for (Column column : columns) {
            if (selector.matches(column)) {
                selected.add(column.id());
            }
        }
        return selected;
    }

    /**
     * Gets the identifiers of the rows that a selector selects.
     *
     * @param selector
     *     The selector
     *
     * @return A new list of row identifiers, in row order.
     *
     * @throws UnknownReferenceException
     *     if the selector names a row that isn't in this model.
     */
    public List<String> rowIds(RowSelector selector) {
        ArgumentUtil.checkNotNull(selector, "selector");
        checkRowsExist(selector.requiredIds());

        List<String> selected = new ArrayList<>();
        for (Row row : rows) {
            if (selector.matches(row)) {
                selected.add(row.id());
            }
        }
        return selected;
    }

    //
    // Transformations
    //

    /**
     * Formats the numbers of the selected columns in every row.
     *
     * @param columnSelector
     *     The columns to format
     * @param rule
     *     The format rule
     *
     * @return This model
     *
     * @see #applyFormat(ColumnSelector, RowSelector, FormatRule)
     */
    public TableModel applyFormat(ColumnSelector columnSelector, FormatRule rule) {
        return applyFormat(columnSelector, RowSelector.all(), rule);
    }

    /**
     * Formats the numbers of the selected cells.
     * <p>
     * The selectors are evaluated now.  When more than one format rule applies to a cell, the one applied last wins.
     * </p>
     *
     * @param columnSelector
     *     The columns to format
     * @param rowSelector
     *     The rows to format
     * @param rule
     *     The format rule
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     * @throws UnknownReferenceException
     *     if a selector names a row or column that isn't in this model.
     */
    public TableModel applyFormat(ColumnSelector columnSelector, RowSelector rowSelector, FormatRule rule) {
        ArgumentUtil.checkNotNull(rule, "rule");
        Set<String> columnIds = new LinkedHashSet<>(columnIds(columnSelector));
        Set<String> rowIds = new LinkedHashSet<>(rowIds(rowSelector));

        formatAssignments.add(new FormatAssignment(columnIds, rowIds, rule));
        return this;
    }

    /**
     * Merges columns in every row.
     *
     * @param targetId
     *     The identifier of the merged column
     * @param sourceIds
     *     The columns to merge
     * @param pattern
     *     The pattern into which the sources' text is substituted
     *
     * @return This model
     *
     * @see #mergeColumns(String, List, String, RowSelector)
     */
    public TableModel mergeColumns(String targetId, List<String> sourceIds, String pattern) {
        return mergeColumns(targetId, sourceIds, pattern, RowSelector.all());
    }

    /**
     * Merges the rendered text of two to four source columns into a merged column.
     * <p>
     * In each selected row, the merged column's text is {@code pattern} with {@code {1}} replaced by the first
     * source's text, {@code {2}} by the second source's text, and so on.  The sources' text is formatted and has missing
     * values substituted before it's merged.
     * </p>
     * <p>
     * If {@code targetId} is new, the merged column is placed where the first source column is.  If {@code targetId}
     * is an existing merged column, this adds another rule to it, and for rows selected by more than one rule, the rule
     * added last wins.  In rows that no rule selects, the merged column shows the first source of its first rule.
     * </p>
     * <p>
     * Source columns are left out of the rendered grid, but they can still be formatted, footnoted, and used as sources
     * of later merges.
     * </p>
     *
     * @param targetId
     *     The identifier of the merged column
     * @param sourceIds
     *     The columns to merge, in placeholder order.
     * @param pattern
     *     The pattern into which the sources' text is substituted
     * @param rowSelector
     *     The rows to which this merge applies
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if any argument is {@code null} or {@code sourceIds} contains {@code null}.
     * @throws IllegalArgumentException
     *     if there are fewer than 2 or more than 4 sources, if {@code targetId} names a column that isn't a merged
     *     column, or if the merge would make a column depend on itself.
     * @throws UnknownReferenceException
     *     if a source column or a selected row isn't in this model.
     * @throws InvalidMergePatternException
     *     if the pattern doesn't use exactly the placeholders {@code {1}} through {@code {n}}, where n is the number of
     *     sources.
     */
    public TableModel mergeColumns(String targetId, List<String> sourceIds, String pattern, RowSelector rowSelector) {
        ArgumentUtil.checkNotBlank(targetId, "targetId");
        ArgumentUtil.checkNoNullElements(sourceIds, "sourceIds");
        ArgumentUtil.checkNotNull(pattern, "pattern");
        if (sourceIds.size() < MergeRule.MIN_SOURCES || MergeRule.MAX_SOURCES < sourceIds.size()) {
            throw new IllegalArgumentException("a merge must have between " + MergeRule.MIN_SOURCES + " and " +
                MergeRule.MAX_SOURCES + " source columns");
        }
        checkColumnsExist(sourceIds);
        MergeRule.checkPattern(pattern, sourceIds.size());

        int targetIndex = columnIndex(targetId);
        if (0 <= targetIndex && !columns.get(targetIndex).isMerged()) {
            throw new IllegalArgumentException("column " + targetId + " is not a merged column");
        }
        for (String sourceId : sourceIds) {
            if (dependsOn(sourceId, targetId)) {
                throw new IllegalArgumentException("merging " + sourceId + " into " + targetId +
                    " would make " + targetId + " depend on itself");
            }
        }

        Set<String> rowIds = new LinkedHashSet<>(rowIds(rowSelector));
        if (targetIndex < 0) {
            columns.add(
                columnIndex(sourceIds.get(0)),
                new Column(targetId, targetId, 0, Alignment.CENTER, true, false));
        }
        mergeRules.add(new MergeRule(targetId, sourceIds, pattern, rowIds));
        return this;
    }

    /**
     * Determines whether a column's text depends on another column's text.
     *
     * @param columnId
     *     The column whose dependencies are checked
     * @param otherId
     *     The column that might be a dependency
     *
     * @return {@code true}, if {@code columnId} is {@code otherId} or is merged from it, directly or indirectly.
     */
    private boolean dependsOn(String columnId, String otherId) {
        if (columnId.equals(otherId)) {
            return true;
        }
        for (MergeRule rule : mergeRules) {
            if (rule.targetId().equals(columnId)) {
                for (String sourceId : rule.sourceIds()) {
                    if (dependsOn(sourceId, otherId)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * Adds a level 1 spanner over some columns.
     *
     * @param label
     *     The spanner's text
     * @param columnIds
     *     The columns under the spanner
     *
     * @return This model
     *
     * @see #addSpanner(String, List, int)
     */
    public TableModel addSpanner(String label, List<String> columnIds) {
        return addSpanner(label, columnIds, 1);
    }

    /**
     * Adds a spanner over some columns.  A column may have at most one spanner per level.
     *
     * @param label
     *     The spanner's text
     * @param columnIds
     *     The columns under the spanner
     * @param level
     *     The header level of the spanner. Level 1 is directly above the column labels.
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if {@code label} or {@code columnIds} is {@code null}, or if {@code columnIds} contains {@code null}.
     * @throws IllegalArgumentException
     *     if {@code columnIds} is empty, if {@code level} is less than 1, or if a column already has a spanner at
     *     {@code level}.
     * @throws UnknownReferenceException
     *     if a column isn't in this model.
     */
    public TableModel addSpanner(String label, List<String> columnIds, int level) {
        ArgumentUtil.checkNotNull(label, "label");
        ArgumentUtil.checkNoNullElements(columnIds, "columnIds");
        if (columnIds.isEmpty()) {
            throw new IllegalArgumentException("columnIds must not be empty");
        }
        if (level < 1) {
            throw new IllegalArgumentException("level must be at least 1");
        }
        checkColumnsExist(columnIds);
        for (Spanner spanner : spanners) {
            if (spanner.level() == level) {
                for (String columnId : columnIds) {
                    if (spanner.columnIds().contains(columnId)) {
                        throw new IllegalArgumentException(
                            "column " + columnId + " already has a spanner at level " + level);
                    }
                }
            }
        }

        spanners.add(new Spanner(label, level, new ArrayList<>(new LinkedHashSet<>(columnIds))));
        return this;
    }

    /**
     * Puts rows into a row group.  Rows that were in another group are moved.
     *
     * @param label
     *     The group's label, which is rendered as a header row before the group's rows.
     * @param rowIds
     *     The rows to put in the group
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if {@code label} or {@code rowIds} is {@code null}, or if {@code rowIds} contains {@code null}.
     * @throws UnknownReferenceException
     *     if a row isn't in this model.
     */
    public TableModel addRowGroup(String label, List<String> rowIds) {
        ArgumentUtil.checkNotNull(label, "label");
        ArgumentUtil.checkNoNullElements(rowIds, "rowIds");
        checkRowsExist(rowIds);

        for (String rowId : rowIds) {
            int index = rowIndex(rowId);
            rows.set(index, rows.get(index).withGroup(label));
        }
        if (!rowGroups.contains(label)) {
            rowGroups.add(label);
        }
        return this;
    }

    /**
     * Sets the width of some columns.
     *
     * @param columnIds
     *     The columns
     * @param width
     *     The width in characters. 0 means no particular width.
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if {@code columnIds} is {@code null} or contains {@code null}.
     * @throws IllegalArgumentException
     *     if {@code width} is negative.
     * @throws UnknownReferenceException
     *     if a column isn't in this model.
     */
    public TableModel setWidth(List<String> columnIds, int width) {
        ArgumentUtil.checkNoNullElements(columnIds, "columnIds");
        ArgumentUtil.checkNotNegative(width, "width");
        checkColumnsExist(columnIds);

        for (String columnId : columnIds) {
            int index = columnIndex(columnId);
            columns.set(index, columns.get(index).withWidth(width));
        }
        return this;
    }

    /**
     * Sets the alignment of some columns.
     *
     * @param columnIds
     *     The columns
     * @param alignment
     *     The alignment
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if an argument is {@code null} or {@code columnIds} contains {@code null}.
     * @throws UnknownReferenceException
     *     if a column isn't in this model.
     */
    public TableModel setAlignment(List<String> columnIds, Alignment alignment) {
        ArgumentUtil.checkNoNullElements(columnIds, "columnIds");
        ArgumentUtil.checkNotNull(alignment, "alignment");
        checkColumnsExist(columnIds);

        for (String columnId : columnIds) {
            int index = columnIndex(columnId);
            columns.set(index, columns.get(index).withAlignment(alignment));
        }
        return this;
    }

    /**
     * Changes the labels of some columns.
     *
     * @param labels
     *     A map of column identifier to new label.
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if {@code labels} is {@code null} or has a {@code null} key or value.
     * @throws UnknownReferenceException
     *     if a column isn't in this model.
     */
    public TableModel relabelColumns(Map<String, String> labels) {
        ArgumentUtil.checkNotNull(labels, "labels");
        ArgumentUtil.checkNoNullElements(labels.keySet(), "labels keys");
        ArgumentUtil.checkNoNullElements(labels.values(), "labels values");
        checkColumnsExist(labels.keySet());

        for (Map.Entry<String, String> entry : labels.entrySet()) {
            int index = columnIndex(entry.getKey());
            columns.set(index, columns.get(index).withLabel(entry.getValue()));
        }
        return this;
    }

    /**
     * Sets the indentation level of some rows' stubs.
     *
     * @param rowIds
     *     The rows
     * @param level
     *     The indentation level. 0 means not indented.
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if {@code rowIds} is {@code null} or contains {@code null}.
     * @throws IllegalArgumentException
     *     if {@code level} is negative.
     * @throws UnknownReferenceException
     *     if a row isn't in this model.
     */
    public TableModel indentRows(List<String> rowIds, int level) {
        ArgumentUtil.checkNoNullElements(rowIds, "rowIds");
        ArgumentUtil.checkNotNegative(level, "level");
        checkRowsExist(rowIds);

        for (String rowId : rowIds) {
            int index = rowIndex(rowId);
            rows.set(index, rows.get(index).withIndent(level));
        }
        return this;
    }

    /**
     * Leaves some columns out of the rendered grid.  Their values remain available to format rules and merges.
     *
     * @param columnIds
     *     The columns to hide
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if {@code columnIds} is {@code null} or contains {@code null}.
     * @throws UnknownReferenceException
     *     if a column isn't in this model.
     */
    public TableModel hideColumns(List<String> columnIds) {
        ArgumentUtil.checkNoNullElements(columnIds, "columnIds");
        checkColumnsExist(columnIds);

        for (String columnId : columnIds) {
            int index = columnIndex(columnId);
            columns.set(index, columns.get(index).withHidden(true));
        }
        return this;
    }

    /**
     * Adds a footnote.  Marks are assigned when the model is rendered, in the order in which footnotes are added.
     *
     * @param location
     *     Where the footnote's mark is placed
     * @param text
     *     The footnote's text
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if an argument is {@code null}.
     * @throws UnknownReferenceException
     *     if the location refers to a row or column that isn't in this model.
     */
    public TableModel addFootnote(FootnoteLocation location, String text) {
        ArgumentUtil.checkNotNull(location, "location");
        ArgumentUtil.checkNotNull(text, "text");
        if (location.rowId() != null) {
            checkRowsExist(List.of(location.rowId()));
        }
        checkColumnsExist(location.columnIds());

        footnotes.add(new Footnote(location, text));
        return this;
    }

    /**
     * Sets the title of the table.
     *
     * @param title
     *     The title. This may be blank.
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if {@code title} is {@code null}.
     */
    public TableModel title(String title) {
        ArgumentUtil.checkNotNull(title, "title");
        this.title = title;
        return this;
    }

    /**
     * Sets the subtitle of the table.
     *
     * @param subtitle
     *     The subtitle. This may be blank.
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if {@code subtitle} is {@code null}.
     */
    public TableModel subtitle(String subtitle) {
        ArgumentUtil.checkNotNull(subtitle, "subtitle");
        this.subtitle = subtitle;
        return this;
    }

    /**
     * Sets the label above the stub column.
     *
     * @param stubHeader
     *     The label. This may be blank.
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if {@code stubHeader} is {@code null}.
     */
    public TableModel stubHeader(String stubHeader) {
        ArgumentUtil.checkNotNull(stubHeader, "stubHeader");
        this.stubHeader = stubHeader;
        return this;
    }

    /**
     * Sets the text that replaces every missing value when the table is rendered.  The default is
     * {@value #DEFAULT_MISSING_TEXT}.
     *
     * @param text
     *     The replacement text. This may be blank.
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if {@code text} is {@code null}.
     */
    public TableModel substituteMissing(String text) {
        ArgumentUtil.checkNotNull(text, "text");
        this.missingText = text;
        return this;
    }

    /**
     * Sets the symbols used to mark footnotes.  The default is {@link FootnoteMarks#NUMBERS}.
     *
     * @param footnoteMarks
     *     The footnote marks
     *
     * @return This model
     *
     * @throws NullPointerException
     *     if {@code footnoteMarks} is {@code null}.
     */
    public TableModel footnoteMarks(FootnoteMarks footnoteMarks) {
        ArgumentUtil.checkNotNull(footnoteMarks, "footnoteMarks");
        this.footnoteMarks = footnoteMarks;
        return this;
    }

    /**
     * Renders this model.  This doesn't change the model, so rendering it again gives an equal grid.
     *
     * @return The rendered grid
     */
    public Grid render() {
        return Renderer.render(this);
    }

    //
    // Accessors
    //

    /**
     * Gets the columns of this model, including hidden and merged columns.
     *
     * @return An unmodifiable snapshot of the columns, in order.
     */
    public List<Column> columns() {
        return List.copyOf(columns);
    }

    /**
     * Gets the rows of this model.
     *
     * @return An unmodifiable snapshot of the rows, in order.
     */
    public List<Row> rows() {
        return List.copyOf(rows);
    }

    /**
     * Gets the labels of the row groups, in display order.
     *
     * @return An unmodifiable snapshot of the row group labels.
     */
    public List<String> rowGroups() {
        return List.copyOf(rowGroups);
    }

    /**
     * Gets the spanners, in the order in which they were added.
     *
     * @return An unmodifiable snapshot of the spanners.
     */
    public List<Spanner> spanners() {
        return List.copyOf(spanners);
    }

    /**
     * Gets the merge rules, in the order in which they were added.
     *
     * @return An unmodifiable snapshot of the merge rules.
     */
    public List<MergeRule> mergeRules() {
        return List.copyOf(mergeRules);
    }

    /**
     * Gets the footnotes, in the order in which they were added.
     *
     * @return An unmodifiable snapshot of the footnotes.
     */
    public List<Footnote> footnotes() {
        return List.copyOf(footnotes);
    }

    List<FormatAssignment> formatAssignments() {
        return Collections.unmodifiableList(formatAssignments);
    }

    /**
     * Gets the title of the table.
     *
     * @return The title. This is blank if there's no title.
     */
    public String title() {
        return title;
    }

    /**
     * Gets the subtitle of the table.
     *
     * @return The subtitle. This is blank if there's no subtitle.
     */
    public String subtitle() {
        return subtitle;
    }

    /**
     * Gets the label above the stub column.
     *
     * @return The label. This may be blank.
     */
    public String stubHeader() {
        return stubHeader;
    }

    /**
     * Gets the text that replaces missing values.
     *
     * @return The text
     */
    public String missingText() {
        return missingText;
    }

    /**
     * Gets the symbols used to mark footnotes.
     *
     * @return The footnote marks
     */
    public FootnoteMarks footnoteMarks() {
        return footnoteMarks;
    }

    /**
     * Determines whether a column appears in the rendered grid: it isn't hidden and isn't the source of a merge.
     *
     * @param column
     *     The column
     *
     * @return {@code true}, if the column is rendered.
     */
    boolean isVisible(Column column) {
        if (column.isHidden()) {
            return false;
        }
        for (MergeRule rule : mergeRules) {
            if (rule.sourceIds().contains(column.id())) {
                return false;
            }
        }
        return true;
    }
}
