///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

import java.util.Map;

/**
 * A row of long-form summary data that can be bound to a {@link TableModel}.
 */
public interface LongFormRow {

    /**
     * Gets this row's fields in a stable order.
     *
     * @return An unmodifiable map of field name to value. Values are {@link Number}s, {@link String}s, or
     *     {@link MissingValue}s.
     */
    Map<String, Object> fields();
}
