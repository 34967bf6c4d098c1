///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.Objects;

/**
 * A note attached to a location in a table.  Its mark is assigned when the table is rendered.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class Footnote {

    private final FootnoteLocation location;
    private final String text;

    Footnote(FootnoteLocation location, String text) {
        this.location = location;
        this.text = text;
    }

    /**
     * Gets where this footnote's mark is placed.
     *
     * @return The location
     */
    public FootnoteLocation location() {
        return location;
    }

    /**
     * Gets the text of this footnote.
     *
     * @return The text
     */
    public String text() {
        return text;
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, text);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Footnote otherFootnote)) {
            return false;
        }
        return location.equals(otherFootnote.location) && text.equals(otherFootnote.text);
    }

    @Override
    public String toString() {
        return location + ": " + text;
    }
}
