///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

/**
 * The kind of summary that is produced for a variable.
 */
public enum VariableType {
    /** A variable whose values are categories, summarized as counts and percentages. */
    CATEGORICAL,

    /** A numeric variable, summarized with n, mean, standard deviation, median, and range. */
    CONTINUOUS,
}
