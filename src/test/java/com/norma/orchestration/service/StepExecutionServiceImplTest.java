package com.norma.orchestration.service;

import com.norma.config.NormaAgentProperties;
import com.norma.orchestration.exception.ParseException;
import com.norma.orchestration.exception.ToolException;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.Query;
import com.norma.orchestration.model.ResultStatus;
import com.norma.orchestration.model.StepDispatch;
import com.norma.orchestration.model.StepResult;
import com.norma.orchestration.model.StepTool;
import com.norma.orchestration.state.ExecutionState;
import com.norma.orchestration.state.Plan;
import com.norma.orchestration.tool.StepToolHandler;
import com.norma.orchestration.tool.ToolRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StepExecutionServiceImplTest {

    private final ExecutorService toolExecutor = Executors.newFixedThreadPool(2);
    private final NormaAgentProperties properties = new NormaAgentProperties();
    private StepToolHandler handler;
    private StepExecutionServiceImpl service;
    private ExecutionState state;

    @BeforeEach
    void setUp() {
        handler = mock(StepToolHandler.class);
        when(handler.tool()).thenReturn(StepTool.SEARCH);
        service = new StepExecutionServiceImpl(new ToolRegistry(List.of(handler)), toolExecutor, properties,
                new OrchestrationMetricsService());
        state = new ExecutionState(UUID.randomUUID(), new Query("q"));
        state.installPlan(Plan.create("goal", List.of(), false, null, List.of(
                PlanStep.pending(1, "Search", StepTool.SEARCH, Map.of("keywords", List.of("cover"))),
                PlanStep.pending(2, "Search", StepTool.SEARCH, Map.of("keywords", List.of("slab"))))));
    }

    @AfterEach
    void tearDown() {
        toolExecutor.shutdownNow();
    }

    @Test
    void testSuccessAdvancesCursor() {
        when(handler.execute(any())).thenReturn(StepResult.notFound("none"));

        StepDispatch dispatch = service.dispatch(state);

        assertEquals(1, dispatch.step().number());
        assertEquals(ResultStatus.NOT_FOUND, dispatch.result().status());
        assertEquals(1, state.getDispatchCount());
        assertEquals(1, state.get("plan.current_step_index"));
    }

    @Test
    void testFailureIsRetriedOnce() {
        when(handler.execute(any()))
                .thenThrow(new ToolException("backend 503"))
                .thenReturn(StepResult.notFound("none"));

        StepDispatch dispatch = service.dispatch(state);

        assertEquals(ResultStatus.NOT_FOUND, dispatch.result().status());
        assertEquals(1, state.getDispatchCount());
        verify(handler, times(2)).execute(any());
    }

    @Test
    void testExhaustedRetriesGiveErrorWithoutAdvancing() {
        when(handler.execute(any())).thenThrow(new ToolException("backend 503"));

        StepDispatch dispatch = service.dispatch(state);

        assertEquals(ResultStatus.ERROR, dispatch.result().status());
        assertTrue(dispatch.result().errorMessage().contains("backend 503"));
        assertEquals(0, state.get("plan.current_step_index"));
        verify(handler, times(2)).execute(any());
    }

    @Test
    void testTimeoutBecomesError() {
        properties.setToolTimeout(Duration.ofMillis(100));
        properties.setToolRetries(0);
        when(handler.execute(any())).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return StepResult.notFound("late");
        });

        StepDispatch dispatch = service.dispatch(state);

        assertEquals(ResultStatus.ERROR, dispatch.result().status());
        assertTrue(dispatch.result().errorMessage().contains("timed out"));
    }

    @Test
    void testParseFailurePropagates() {
        when(handler.execute(any())).thenThrow(new ParseException("evidence-analysis", "bad output"));

        assertThrows(ParseException.class, () -> service.dispatch(state));
        verify(handler, times(1)).execute(any());
    }

    @Test
    void testExhaustedPlanCannotDispatch() {
        state.advanceStep();
        state.advanceStep();

        assertThrows(IllegalStateException.class, () -> service.dispatch(state));
    }
}
