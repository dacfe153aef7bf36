package com.norma.orchestration.judge;

import com.norma.orchestration.model.Decision;
import com.norma.orchestration.model.DecisionScores;
import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.ReplanInstructions;
import com.norma.orchestration.model.ReplanStrategy;
import com.norma.orchestration.model.StepResult;
import com.norma.orchestration.model.StepTool;
import com.norma.orchestration.model.Verdict;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoopDetectorTest {

    private final LoopDetector detector = new LoopDetector();

    private static PlanStep search(int number, List<String> keywords) {
        return PlanStep.pending(number, "Search", StepTool.SEARCH, Map.of("keywords", keywords));
    }

    private static ExecutionHistoryEntry entry(int sequence, PlanStep step, ReplanStrategy strategy) {
        Decision decision = strategy == null
                ? new Decision(Verdict.CONTINUE, "next", new DecisionScores(1.0, 1.0), null, false, null, null, null)
                : new Decision(Verdict.REPLAN, "replan", new DecisionScores(1.0, 1.0), null, false,
                        ReplanInstructions.of(strategy, strategy.label()), null, null);
        return new ExecutionHistoryEntry(sequence, step, StepResult.notFound("none"), decision, Instant.now());
    }

    @Test
    void testIdenticalSignaturesIgnoreKeywordOrderAndCase() {
        List<ExecutionHistoryEntry> history = List.of(
                entry(1, search(1, List.of("Fire rating", "atrium")), null),
                entry(2, search(2, List.of("atrium", "fire rating ")), null));

        assertTrue(detector.isLoop(search(3, List.of("ATRIUM", "fire rating")), history, 3));
    }

    @Test
    void testDifferentParametersAreNoLoop() {
        List<ExecutionHistoryEntry> history = List.of(
                entry(1, search(1, List.of("fire rating")), null),
                entry(2, search(2, List.of("smoke")), null));

        assertFalse(detector.isLoop(search(3, List.of("smoke")), history, 3));
        assertTrue(detector.isLoop(search(3, List.of("smoke")), history, 2));
    }

    @Test
    void testShortHistoryIsNoLoop() {
        List<ExecutionHistoryEntry> history = List.of(entry(1, search(1, List.of("a")), null));

        assertFalse(detector.isLoop(search(2, List.of("a")), history, 3));
    }

    @Test
    void testAlternativeSkipsUsedAndExcludedStrategies() {
        List<ExecutionHistoryEntry> history = List.of(
                entry(1, search(1, List.of("a")), ReplanStrategy.CHANGE_KEYWORDS),
                entry(2, search(2, List.of("a")), null));

        assertEquals(ReplanStrategy.FORM_NEW_HYPOTHESIS, detector.alternativeStrategy(history, 3, null));
        assertEquals(ReplanStrategy.REFINE_AND_RESTRICT_SEARCH,
                detector.alternativeStrategy(history, 3, ReplanStrategy.FORM_NEW_HYPOTHESIS));
    }

    @Test
    void testNoAlternativeLeft() {
        List<ExecutionHistoryEntry> history = List.of(
                entry(1, search(1, List.of("a")), ReplanStrategy.CHANGE_KEYWORDS),
                entry(2, search(2, List.of("a")), ReplanStrategy.FORM_NEW_HYPOTHESIS));

        assertNull(detector.alternativeStrategy(history, 3, ReplanStrategy.REFINE_AND_RESTRICT_SEARCH));
    }
}
