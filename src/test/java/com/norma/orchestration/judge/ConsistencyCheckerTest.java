package com.norma.orchestration.judge;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConsistencyCheckerTest {

    private final ConsistencyChecker checker = new ConsistencyChecker();

    @Test
    void testNewKeysAreAcceptedWithoutComparison() {
        ConsistencyChecker.Report report = checker.check(Map.of("cover_mm", 20), Map.of());

        assertEquals(0, report.compared());
        assertEquals(1.0, report.score());
        assertEquals(Map.of("cover_mm", 20), report.accepted());
    }

    @Test
    void testNumbersCompareWithRelativeTolerance() {
        assertTrue(ConsistencyChecker.agrees(20, 20.0));
        assertTrue(ConsistencyChecker.agrees("20", 20));
        assertTrue(ConsistencyChecker.agrees("0,5", 0.5));
        assertTrue(ConsistencyChecker.agrees(1000000.0, 1000000.5));
        assertFalse(ConsistencyChecker.agrees(20, 20.01));
    }

    @Test
    void testTextIsNormalized() {
        assertTrue(ConsistencyChecker.agrees("  XC3 ", "xc3"));
        assertTrue(ConsistencyChecker.agrees("class  B25", "Class B25"));
        assertFalse(ConsistencyChecker.agrees("XC3", "XC4"));
    }

    @Test
    void testContradictionsLowerScore() {
        ConsistencyChecker.Report report = checker.check(
                Map.of("cover_mm", 25, "exposure_class", "XC3"),
                Map.of("cover_mm", 20, "exposure_class", "xc3"));

        assertEquals(2, report.compared());
        assertEquals(0.5, report.score());
        assertTrue(report.hasContradictions());
        assertTrue(report.details().contains("cover_mm: known 20, new 25"));
        assertFalse(report.accepted().containsKey("cover_mm"));
        assertTrue(report.accepted().containsKey("exposure_class"));
    }

    @Test
    void testReservedKeysAreIgnored() {
        ConsistencyChecker.Report report = checker.check(
                Map.of("rejected_sources", List.of("x")),
                Map.of("rejected_sources", List.of("y")));

        assertEquals(0, report.compared());
        assertTrue(report.accepted().isEmpty());
    }
}
