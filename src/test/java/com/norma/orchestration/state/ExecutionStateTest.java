package com.norma.orchestration.state;

import com.norma.orchestration.model.Decision;
import com.norma.orchestration.model.DecisionScores;
import com.norma.orchestration.model.ExecutionSnapshot;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.Query;
import com.norma.orchestration.model.ScratchpadUpdate;
import com.norma.orchestration.model.SessionStatus;
import com.norma.orchestration.model.StepResult;
import com.norma.orchestration.model.StepTool;
import com.norma.orchestration.model.Verdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionStateTest {

    private static final Decision CONTINUE = new Decision(Verdict.CONTINUE, "pending steps",
            new DecisionScores(1.0, 1.0), null, false, null, null, null);

    private ExecutionState state;
    private PlanStep first;

    @BeforeEach
    void setUp() {
        state = new ExecutionState(UUID.randomUUID(), new Query("  How thick must the slab be?  "));
        first = PlanStep.pending(1, "Search", StepTool.SEARCH, Map.of("keywords", List.of("slab thickness")));
        PlanStep second = PlanStep.pending(2, "Search", StepTool.SEARCH, Map.of("keywords", List.of("slab")));
        state.installPlan(Plan.create("State slab thickness", List.of("thickness_mm"), false, null, List.of(first, second)));
    }

    @Test
    void testGetByPath() {
        assertEquals("How thick must the slab be?", state.get("query"));
        assertEquals(SessionStatus.PLANNING, state.get("status"));
        assertEquals("State slab thickness", state.get("plan.goal"));
        assertEquals(0, state.get("plan.current_step_index"));
        assertEquals(1, state.get("plan.version"));
        assertEquals(0, state.get("history.size"));
        assertNull(state.get("scratchpad.thickness_mm"));
        assertThrows(IllegalArgumentException.class, () -> state.get("plan.owner"));
    }

    @Test
    void testStatusTransitionsAreChecked() {
        state.setStatus(SessionStatus.EXECUTING);
        state.setStatus(SessionStatus.JUDGING);
        assertThrows(IllegalStateException.class, () -> state.setStatus(SessionStatus.COMPLETED));
        state.setStatus(SessionStatus.HUMAN_REVIEW);
        assertThrows(IllegalStateException.class, () -> state.setStatus(SessionStatus.EXECUTING));
    }

    @Test
    void testScratchpadMergeSetsAppendsAndRemoves() {
        state.mergeScratchpad(ScratchpadUpdate.builder()
                .set("thickness_mm", 200)
                .append("rejected_sources", "GOST 1")
                .build());
        state.mergeScratchpad(ScratchpadUpdate.builder()
                .append("rejected_sources", "GOST 1")
                .append("rejected_sources", "GOST 2")
                .build());

        assertEquals(200, state.get("scratchpad.thickness_mm"));
        assertEquals(List.of("GOST 1", "GOST 2"), state.getScratchpad().getStrings("rejected_sources"));

        state.mergeScratchpad(ScratchpadUpdate.builder().remove("thickness_mm").build());
        assertFalse(state.getScratchpad().contains("thickness_mm"));
    }

    @Test
    void testHistoryIsAppendOnlyAndSequenced() {
        state.appendHistory(first, StepResult.notFound("nothing"), CONTINUE);
        state.appendHistory(first, StepResult.notFound("still nothing"), CONTINUE);

        assertEquals(2, state.getHistory().size());
        assertEquals(1, state.getHistory().entries().get(0).sequence());
        assertEquals(2, state.getHistory().entries().get(1).sequence());
        assertEquals(List.of(state.getHistory().entries().get(1)), state.getHistory().latest(1));
        assertThrows(UnsupportedOperationException.class,
                () -> state.getHistory().entries().remove(0));
    }

    @Test
    void testReplaceRemainingStepsCountsReplans() {
        state.advanceStep();
        state.replaceRemainingSteps(List.of(PlanStep.pending(1, "New search", StepTool.SEARCH,
                Map.of("keywords", List.of("floor slab")))));

        assertEquals(1, state.getReplanCount());
        assertEquals(2, state.get("plan.version"));
        assertEquals(3, state.getPlan().currentStep().number());
    }

    @Test
    void testFrozenStateRejectsMutationButSnapshots() {
        state.recordDispatch();
        state.freeze();

        assertThrows(IllegalStateException.class, state::recordDispatch);
        assertThrows(IllegalStateException.class, () -> state.mergeScratchpad(ScratchpadUpdate.EMPTY));
        assertThrows(IllegalStateException.class, () -> state.appendHistory(first, StepResult.notFound("x"), CONTINUE));

        ExecutionSnapshot snapshot = state.snapshot();
        assertEquals(1, snapshot.dispatchCount());
        assertEquals("State slab thickness", snapshot.goal());
        assertEquals(2, snapshot.steps().size());
    }

    @Test
    void testCancellationFlag() {
        assertFalse(state.isCancelRequested());
        state.requestCancel();
        assertTrue(state.isCancelRequested());
    }
}
