package org.scharp.tlf;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ArgumentUtilTest {

    /** Tests for {@link ArgumentUtil#checkNotNull(Object, String)} */
    @Test
    void testCheckNotNull() {
        ArgumentUtil.checkNotNull("", "arg");
        ArgumentUtil.checkNotNull(0, "arg");

        Exception exception = assertThrows(NullPointerException.class, () -> ArgumentUtil.checkNotNull(null, "myArg"));
        assertEquals("myArg must not be null", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkNotBlank(String, String)} */
    @Test
    void testCheckNotBlank() {
        ArgumentUtil.checkNotBlank("x", "arg");
        ArgumentUtil.checkNotBlank(" x ", "arg");

        Exception exception = assertThrows(NullPointerException.class, () -> ArgumentUtil.checkNotBlank(null, "arg"));
        assertEquals("arg must not be null", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> ArgumentUtil.checkNotBlank("", "name"));
        assertEquals("name must not be blank", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> ArgumentUtil.checkNotBlank(" \t", "name"));
        assertEquals("name must not be blank", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkNoNullElements} */
    @Test
    void testCheckNoNullElements() {
        ArgumentUtil.checkNoNullElements(List.of(), "list");
        ArgumentUtil.checkNoNullElements(List.of("a", "b"), "list");

        Exception exception = assertThrows(NullPointerException.class,
            () -> ArgumentUtil.checkNoNullElements(null, "list"));
        assertEquals("list must not be null", exception.getMessage());

        exception = assertThrows(NullPointerException.class,
            () -> ArgumentUtil.checkNoNullElements(Arrays.asList("a", null), "records"));
        assertEquals("records must not contain null", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkNotNegative(int, String)} */
    @Test
    void testCheckNotNegative() {
        ArgumentUtil.checkNotNegative(0, "arg");
        ArgumentUtil.checkNotNegative(Integer.MAX_VALUE, "arg");

        Exception exception = assertThrows(IllegalArgumentException.class,
            () -> ArgumentUtil.checkNotNegative(-1, "width"));
        assertEquals("width must not be negative", exception.getMessage());
    }

    /** Tests for {@link ArgumentUtil#checkConfidence(double)} */
    @Test
    void testCheckConfidence() {
        ArgumentUtil.checkConfidence(0.95);
        ArgumentUtil.checkConfidence(0.5);
        ArgumentUtil.checkConfidence(Math.nextDown(1.0));

        for (double confidence : new double[] { 0, 1, -0.5, 1.5, Double.NaN }) {
            Exception exception = assertThrows(IllegalArgumentException.class,
                () -> ArgumentUtil.checkConfidence(confidence));
            assertEquals("confidence must be between 0 and 1 (exclusive)", exception.getMessage());
        }
    }
}
