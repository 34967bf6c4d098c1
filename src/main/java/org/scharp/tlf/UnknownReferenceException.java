///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

/**
 * Thrown when a transformation of a {@link TableModel} refers to a row or column that isn't in the model.
 */
public class UnknownReferenceException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String id;

    /**
     * Creates an exception for an unknown row or column.
     *
     * @param kind
     *     What {@code id} identifies, "row" or "column".
     * @param id
     *     The identifier that isn't in the model.
     */
    public UnknownReferenceException(String kind, String id) {
        super("unknown " + kind + " \"" + id + "\"");
        this.id = id;
    }

    /**
     * Gets the identifier that isn't in the model.
     *
     * @return The unknown identifier
     */
    public String id() {
        return id;
    }
}
