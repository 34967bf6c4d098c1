///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

/**
 * Thrown when the placeholders of a merge pattern don't match the columns that are merged.
 */
public class InvalidMergePatternException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception for a bad merge pattern.
     *
     * @param message
     *     A description of the problem.
     */
    public InvalidMergePatternException(String message) {
        super(message);
    }
}
