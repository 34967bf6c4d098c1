///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

/**
 * The horizontal alignment of a column's text.
 */
public enum Alignment {
    LEFT,
    CENTER,
    RIGHT,
}
