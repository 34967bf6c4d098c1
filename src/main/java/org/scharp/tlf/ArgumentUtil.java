package org.scharp.tlf;

import java.util.Collection;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {

    // private constructor to prevent anyone from instantiating the class.
    private ArgumentUtil() {
    }

    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Throws an exception if {@code argument} is {@code null} or contains only whitespace.
     *
     * @param argument
     *     The string to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code argument} is blank.
     */
    static void checkNotBlank(String argument, String argumentName) {
        checkNotNull(argument, argumentName);
        if (argument.isBlank()) {
            throw new IllegalArgumentException(argumentName + " must not be blank");
        }
    }

    /**
     * Throws an exception if {@code collection} is {@code null} or contains a {@code null} element.
     *
     * @param collection
     *     The collection to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code collection} is {@code null} or has a {@code null} element.
     */
    static void checkNoNullElements(Collection<?> collection, String argumentName) {
        checkNotNull(collection, argumentName);
        for (Object element : collection) {
            if (element == null) {
                throw new NullPointerException(argumentName + " must not contain null");
            }
        }
    }

    /**
     * Throws an exception if {@code argument} is negative (less than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is negative
     */
    static void checkNotNegative(int argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument < 0) {
            throw new IllegalArgumentException(argumentName + " must not be negative");
        }
    }

    /**
     * Throws an exception if {@code confidence} is not a usable confidence level.
     *
     * @param confidence
     *     The confidence level to check, such as 0.95.
     *
     * @throws IllegalArgumentException
     *     if {@code confidence} is not strictly between 0 and 1.
     */
    static void checkConfidence(double confidence) {
        // This is written to also reject NaN.
        if (!(0 < confidence && confidence < 1)) {
            throw new IllegalArgumentException("confidence must be between 0 and 1 (exclusive)");
        }
    }
}
