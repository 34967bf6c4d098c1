///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.tlf;

/**
 * Thrown when a variable is summarized but has no {@link VariableType}.
 */
public class UnknownVariableTypeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String variableName;

    /**
     * Creates an exception for a variable without a type.
     *
     * @param variableName
     *     The name of the variable
     */
    public UnknownVariableTypeException(String variableName) {
        super("variable " + variableName + " is neither categorical nor continuous");
        this.variableName = variableName;
    }

    /**
     * Gets the name of the variable that has no type.
     *
     * @return The variable's name
     */
    public String variableName() {
        return variableName;
    }
}
