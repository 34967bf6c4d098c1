///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A rule that renders the cells of a merged column by substituting the rendered text of its source columns into a
 * pattern.
 * <p>
 * A pattern refers to the source columns with numbered placeholders: {@code {1}} is the first source, {@code {2}}
 * the second, and so on.  For example, merging a count and a percentage with {@code "{1} ({2})"} renders as "3 (30.0%)".
 * </p>
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class MergeRule {

    /** The fewest columns that can be merged. */
    public static final int MIN_SOURCES = 2;

    /** The most columns that can be merged. */
    public static final int MAX_SOURCES = 4;

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+)}");

    private final String targetId;
    private final List<String> sourceIds;
    private final String pattern;
    private final Set<String> rowIds;

    MergeRule(String targetId, List<String> sourceIds, String pattern, Set<String> rowIds) {
        this.targetId = targetId;
        this.sourceIds = List.copyOf(sourceIds);
        this.pattern = pattern;
        this.rowIds = Collections.unmodifiableSet(rowIds);
    }

    /**
     * Checks that a pattern uses exactly the placeholders {@code {1}} through {@code {n}}.
     *
     * @param pattern
     *     The pattern
     * @param totalSources
     *     The number of source columns, n.
     *
     * @throws InvalidMergePatternException
     *     if the pattern's placeholders don't match the source columns.
     */
    static void checkPattern(String pattern, int totalSources) {
        Set<Integer> placeholders = new TreeSet<>();
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        while (matcher.find()) {
            try {
                placeholders.add(Integer.valueOf(matcher.group(1)));
            } catch (NumberFormatException exception) {
                throw new InvalidMergePatternException("pattern \"" + pattern + "\" has an invalid placeholder");
            }
        }

        Set<Integer> expected = new TreeSet<>();
        for (int i = 1; i <= totalSources; i++) {
            expected.add(i);
        }
        if (!placeholders.equals(expected)) {
            throw new InvalidMergePatternException(
                "pattern \"" + pattern + "\" must use the placeholders {1} through {" + totalSources + "}");
        }
    }

    /**
     * Substitutes rendered values into this rule's pattern.
     *
     * @param values
     *     The rendered text of each source column, in source order.
     *
     * @return The merged text.
     */
    String apply(List<String> values) {
        assert values.size() == sourceIds.size() : "wrong number of values";

        Matcher matcher = PLACEHOLDER.matcher(pattern);
        StringBuilder builder = new StringBuilder();
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            matcher.appendReplacement(builder, Matcher.quoteReplacement(values.get(index - 1)));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    /**
     * Gets the identifier of the merged column.
     *
     * @return The identifier
     */
    public String targetId() {
        return targetId;
    }

    /**
     * Gets the columns whose values are merged.
     *
     * @return An unmodifiable list of column identifiers, in placeholder order.
     */
    public List<String> sourceIds() {
        return sourceIds;
    }

    /**
     * Gets the pattern into which values are substituted.
     *
     * @return The pattern
     */
    public String pattern() {
        return pattern;
    }

    /**
     * Gets the rows to which this rule applies.
     *
     * @return An unmodifiable set of row identifiers.
     */
    public Set<String> rowIds() {
        return rowIds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetId, sourceIds, pattern, rowIds);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MergeRule otherRule)) {
            return false;
        }
        return targetId.equals(otherRule.targetId) &&
            sourceIds.equals(otherRule.sourceIds) &&
            pattern.equals(otherRule.pattern) &&
            rowIds.equals(otherRule.rowIds);
    }

    @Override
    public String toString() {
        return targetId + " = \"" + pattern + "\" " + sourceIds;
    }
}
