///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.List;

/**
 * The sequence of symbols used to mark footnotes.  Marks are assigned in the order in which footnotes are declared.
 */
public enum FootnoteMarks {
    /** 1, 2, 3, ... */
    NUMBERS(List.of()),

    /** a, b, c, ..., z, aa, bb, ... */
    LETTERS(alphabet('a')),

    /** A, B, C, ..., Z, AA, BB, ... */
    UPPERCASE_LETTERS(alphabet('A')),

    /** *, &dagger;, &Dagger;, &sect;, &para;, &#x2016;, **, &dagger;&dagger;, ... */
    SYMBOLS(List.of("*", "†", "‡", "§", "¶", "‖"));

    private final List<String> symbols;

    FootnoteMarks(List<String> symbols) {
        this.symbols = symbols;
    }

    private static List<String> alphabet(char first) {
        String[] letters = new String[26];
        for (int i = 0; i < letters.length; i++) {
            letters[i] = String.valueOf((char) (first + i));
        }
        return List.of(letters);
    }

    /**
     * Gets the mark of a footnote.
     * <p>
     * Once the symbols are exhausted, they repeat: the symbol is written twice on the second pass, three times on the
     * third pass, and so on.
     * </p>
     *
     * @param index
     *     The footnote's position in declaration order, starting at 0.
     *
     * @return The mark
     *
     * @throws IllegalArgumentException
     *     if {@code index} is negative.
     */
    public String mark(int index) {
        ArgumentUtil.checkNotNegative(index, "index");

        if (symbols.isEmpty()) {
            return String.valueOf(index + 1);
        }
        return symbols.get(index % symbols.size()).repeat(index / symbols.size() + 1);
    }
}
