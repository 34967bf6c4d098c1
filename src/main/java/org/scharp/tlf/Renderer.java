///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a {@link TableModel} into a {@link Grid} of finalized cell text.
 * <p>
 * The text of a body cell is determined as follows:
 * </p>
 * <ol>
 * <li>If the cell's column is a merged column, the merge rule that applies to the row is given the rendered text of
 * its sources.</li>
 * <li>If the value is missing, it is replaced with the model's missing text.</li>
 * <li>If the value is a number, it is formatted with the last format rule applied to the cell, or written in plain
 * decimal notation if no format rule applies.</li>
 * <li>Otherwise, the value's string form is used.</li>
 * </ol>
 * <p>
 * Rendering doesn't change the model.
 * </p>
 */
public final class Renderer {

    private static final Logger logger = LogManager.getLogger(Renderer.class);

    // private constructor to prevent anyone from instantiating the class.
    private Renderer() {
    }

    /**
     * Renders a table model.
     *
     * @param model
     *     The model to render
     *
     * @return A new grid
     *
     * @throws NullPointerException
     *     if {@code model} is {@code null}.
     */
    public static Grid render(TableModel model) {
        ArgumentUtil.checkNotNull(model, "model");

        List<Column> visibleColumns = new ArrayList<>();
        for (Column column : model.columns()) {
            if (model.isVisible(column)) {
                visibleColumns.add(column);
            }
        }

        // Assign the footnote marks in declaration order.
        Map<String, String> footnotes = new LinkedHashMap<>();
        Map<String, List<String>> headerMarks = new HashMap<>();
        Map<String, List<String>> stubMarks = new HashMap<>();
        Map<String, Map<String, List<String>>> cellMarks = new HashMap<>();
        List<Footnote> modelFootnotes = model.footnotes();
        for (int i = 0; i < modelFootnotes.size(); i++) {
            Footnote footnote = modelFootnotes.get(i);
            String mark = model.footnoteMarks().mark(i);
            footnotes.put(mark, footnote.text());

            FootnoteLocation location = footnote.location();
            switch (location.kind()) {
            case COLUMN_HEADER:
                for (String columnId : location.columnIds()) {
                    headerMarks.computeIfAbsent(columnId, k -> new ArrayList<>()).add(mark);
                }
                break;

            case STUB:
                stubMarks.computeIfAbsent(location.rowId(), k -> new ArrayList<>()).add(mark);
                break;

            case CELL:
                cellMarks.computeIfAbsent(location.rowId(), k -> new HashMap<>()).
                    computeIfAbsent(location.columnIds().get(0), k -> new ArrayList<>()).add(mark);
                break;

            default:
                throw new IllegalStateException("unknown footnote location " + location.kind());
            }
        }

        List<List<HeaderCell>> headerRows = renderHeader(model, visibleColumns, headerMarks);

        List<GridColumn> gridColumns = new ArrayList<>(visibleColumns.size());
        for (Column column : visibleColumns) {
            gridColumns.add(new GridColumn(column.id(), column.width(), column.alignment()));
        }

        // Ungrouped rows come first, then each row group under its header.
        List<GridRow> body = new ArrayList<>();
        List<Row> rows = model.rows();
        for (Row row : rows) {
            if (row.group() == null) {
                body.add(renderRow(model, row, visibleColumns, stubMarks, cellMarks));
            }
        }
        for (String group : model.rowGroups()) {
            List<GridRow> groupRows = new ArrayList<>();
            for (Row row : rows) {
                if (group.equals(row.group())) {
                    groupRows.add(renderRow(model, row, visibleColumns, stubMarks, cellMarks));
                }
            }
            if (!groupRows.isEmpty()) {
                body.add(new GridRow(GridRow.Kind.GROUP_HEADER, null, new GridCell(group, List.of()), 0, List.of()));
                body.addAll(groupRows);
            }
        }

        logger.debug("Rendered {} header rows, {} body rows, {} columns, and {} footnotes", headerRows.size(),
            body.size(), gridColumns.size(), footnotes.size());

        return new Grid(model.title(), model.subtitle(), model.stubHeader(), headerRows, gridColumns, body,
            footnotes);
    }

    private static List<List<HeaderCell>> renderHeader(TableModel model, List<Column> visibleColumns,
        Map<String, List<String>> headerMarks) {

        int maxLevel = 0;
        for (Spanner spanner : model.spanners()) {
            maxLevel = Math.max(maxLevel, spanner.level());
        }

        List<List<HeaderCell>> headerRows = new ArrayList<>();
        for (int level = maxLevel; 1 <= level; level--) {
            Map<String, Spanner> spannerOfColumn = new HashMap<>();
            for (Spanner spanner : model.spanners()) {
                if (spanner.level() == level) {
                    for (String columnId : spanner.columnIds()) {
                        spannerOfColumn.put(columnId, spanner);
                    }
                }
            }

            // Consecutive visible columns under the same spanner share one cell.
            List<HeaderCell> headerRow = new ArrayList<>();
            boolean hasSpanner = false;
            int i = 0;
            while (i < visibleColumns.size()) {
                Spanner spanner = spannerOfColumn.get(visibleColumns.get(i).id());
                int span = 1;
                if (spanner != null) {
                    while (i + span < visibleColumns.size() &&
                        spannerOfColumn.get(visibleColumns.get(i + span).id()) == spanner) {
                        span++;
                    }
                    headerRow.add(new HeaderCell(spanner.label(), span, List.of()));
                    hasSpanner = true;
                } else {
                    headerRow.add(new HeaderCell("", 1, List.of()));
                }
                i += span;
            }

            // A level whose spanners only cover columns that aren't rendered has nothing to show.
            if (hasSpanner) {
                headerRows.add(headerRow);
            }
        }

        List<HeaderCell> labels = new ArrayList<>(visibleColumns.size());
        for (Column column : visibleColumns) {
            labels.add(new HeaderCell(column.label(), 1, headerMarks.getOrDefault(column.id(), List.of())));
        }
        headerRows.add(labels);

        return headerRows;
    }

    private static GridRow renderRow(TableModel model, Row row, List<Column> visibleColumns,
        Map<String, List<String>> stubMarks, Map<String, Map<String, List<String>>> cellMarks) {

        Map<String, List<String>> marksOfRow = cellMarks.getOrDefault(row.id(), Map.of());
        List<GridCell> cells = new ArrayList<>(visibleColumns.size());
        for (Column column : visibleColumns) {
            cells.add(new GridCell(cellText(model, row, column.id()), marksOfRow.getOrDefault(column.id(), List.of())));
        }

        GridCell stub = new GridCell(row.stub(), stubMarks.getOrDefault(row.id(), List.of()));
        return new GridRow(GridRow.Kind.DATA, row.id(), stub, row.indent(), cells);
    }

    /**
     * Gets the finalized text of a cell.  Merges can't form a cycle, so the recursion through merge sources ends.
     */
    static String cellText(TableModel model, Row row, String columnId) {
        Column column = model.column(columnId);
        if (column.isMerged()) {
            MergeRule firstRule = null;
            MergeRule matchingRule = null;
            for (MergeRule rule : model.mergeRules()) {
                if (rule.targetId().equals(columnId)) {
                    if (firstRule == null) {
                        firstRule = rule;
                    }
                    if (rule.rowIds().contains(row.id())) {
                        matchingRule = rule;
                    }
                }
            }

            if (matchingRule == null) {
                return cellText(model, row, firstRule.sourceIds().get(0));
            }
            List<String> sourceTexts = new ArrayList<>(matchingRule.sourceIds().size());
            for (String sourceId : matchingRule.sourceIds()) {
                sourceTexts.add(cellText(model, row, sourceId));
            }
            return matchingRule.apply(sourceTexts);
        }

        Object value = row.value(columnId);
        if (MissingValue.isMissing(value)) {
            return model.missingText();
        }
        if (value instanceof Number number) {
            return formatNumber(model, row.id(), columnId, number);
        }
        return value.toString();
    }

    private static String formatNumber(TableModel model, String rowId, String columnId, Number number) {
        if (number instanceof Double || number instanceof Float) {
            double doubleValue = number.doubleValue();
            if (Double.isInfinite(doubleValue)) {
                return doubleValue < 0 ? "-Inf" : "Inf";
            }
        }

        FormatRule rule = null;
        for (TableModel.FormatAssignment assignment : model.formatAssignments()) {
            if (assignment.appliesTo(rowId, columnId)) {
                rule = assignment.rule();
            }
        }

        if (rule == null) {
            return FormatRule.toBigDecimal(number).stripTrailingZeros().toPlainString();
        }
        return rule.format(number);
    }
}
