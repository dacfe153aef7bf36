package com.norma.orchestration.tool;

import com.norma.orchestration.exception.ToolException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionCalculatorTest {

    private final ExpressionCalculator calculator = new ExpressionCalculator();

    @Test
    void testArithmeticOverNamedValues() {
        assertEquals(28.0, calculator.evaluate("cover_mm + d / 2", Map.of("cover_mm", 20.0, "d", 16.0)));
    }

    @Test
    void testIntegerDivisionIsNotTruncated() {
        assertEquals(3.5, calculator.evaluate("7 / 2", Map.of()));
    }

    @Test
    void testFunctionsAndConstants() {
        assertEquals(3.0, calculator.evaluate("floor(d / 5)", Map.of("d", 16.0)));
        assertEquals(4.0, calculator.evaluate("ceil(d / 5)", Map.of("d", 16.0)));
        assertEquals(12.0, calculator.evaluate("max(a, b) + min(a, b)", Map.of("a", 5.0, "b", 7.0)));
        assertEquals(Math.PI * 4.0, calculator.evaluate("pi * r ^ 2", Map.of("r", 2.0)), 1e-9);
        assertEquals(8.0, calculator.evaluate("2 ** 3", Map.of()));
        assertEquals(5.0, calculator.evaluate("sqrt(pow(3, 2) + pow(4, 2))", Map.of()));
    }

    @Test
    void testMissingValueIsReported() {
        ToolException ex = assertThrows(ToolException.class,
                () -> calculator.evaluate("cover_mm + d", Map.of("cover_mm", 20.0)));
        assertTrue(ex.getMessage().contains("[d]"));
    }

    @Test
    void testUnknownFunctionAndForeignSyntaxAreRejected() {
        assertThrows(ToolException.class, () -> calculator.evaluate("exec(1)", Map.of()));
        assertThrows(ToolException.class, () -> calculator.evaluate("T(java.lang.Runtime)", Map.of()));
        assertThrows(ToolException.class, () -> calculator.evaluate("'a' + 1", Map.of()));
        assertThrows(ToolException.class, () -> calculator.evaluate(" ", Map.of()));
    }

    @Test
    void testDivisionByZeroIsAnError() {
        assertThrows(ToolException.class, () -> calculator.evaluate("a / 0", Map.of("a", 1.0)));
    }
}
