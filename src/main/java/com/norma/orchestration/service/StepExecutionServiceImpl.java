package com.norma.orchestration.service;

import static com.norma.orchestration.OrchestrationConstants.TOOL_FAILED_MESSAGE;

import com.norma.config.NormaAgentProperties;
import com.norma.orchestration.api.StepExecutionService;
import com.norma.orchestration.exception.ParseException;
import com.norma.orchestration.exception.ServiceUnavailableException;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.ResultStatus;
import com.norma.orchestration.model.StepDispatch;
import com.norma.orchestration.model.StepResult;
import com.norma.orchestration.state.ExecutionState;
import com.norma.orchestration.tool.StepContext;
import com.norma.orchestration.tool.StepToolHandler;
import com.norma.orchestration.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class StepExecutionServiceImpl implements StepExecutionService {

    private final ToolRegistry toolRegistry;
    private final ExecutorService toolExecutor;
    private final NormaAgentProperties properties;
    private final OrchestrationMetricsService metricsService;

    public StepExecutionServiceImpl(ToolRegistry toolRegistry,
                                    @Qualifier("toolExecutor") ExecutorService toolExecutor,
                                    NormaAgentProperties properties,
                                    OrchestrationMetricsService metricsService) {
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    @Override
    public StepDispatch dispatch(ExecutionState state) {
        if (state.getPlan() == null || state.getPlan().isExhausted()) {
            throw new IllegalStateException("No pending step to dispatch");
        }
        PlanStep step = state.getPlan().currentStep();
        state.recordDispatch();
        StepResult result = invoke(StepContext.of(state, step));
        if (result.status() != ResultStatus.ERROR) {
            state.advanceStep();
        }
        metricsService.recordDispatch(step.tool(), result.status());
        log.info("Dispatch #{} step {} [{}] -> {}", state.getDispatchCount(), step.number(), step.tool().wireName(),
                result.status().wireName());
        return new StepDispatch(step, result);
    }

    private StepResult invoke(StepContext context) {
        PlanStep step = context.step();
        StepToolHandler handler = toolRegistry.find(step.tool()).orElse(null);
        if (handler == null) {
            return StepResult.error(TOOL_FAILED_MESSAGE + "no handler for tool " + step.tool().wireName());
        }
        int attempts = 1 + properties.getToolRetries();
        String lastError = "unknown failure";
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return CompletableFuture.supplyAsync(() -> handler.execute(context), toolExecutor)
                        .orTimeout(properties.getToolTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .join();
            } catch (CompletionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                if (cause instanceof ParseException parseException) {
                    throw parseException;
                }
                if (cause instanceof ServiceUnavailableException unavailable) {
                    throw unavailable;
                }
                lastError = cause instanceof TimeoutException
                        ? "timed out after " + properties.getToolTimeout().toSeconds() + "s"
                        : String.valueOf(cause.getMessage());
                log.warn("Step {} [{}] failed (attempt {}/{}): {}", step.number(), step.tool().wireName(),
                        attempt, attempts, lastError);
            }
        }
        return StepResult.error(TOOL_FAILED_MESSAGE + lastError);
    }
}
