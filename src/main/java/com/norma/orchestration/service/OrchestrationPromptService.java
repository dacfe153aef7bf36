package com.norma.orchestration.service;

import static com.norma.orchestration.OrchestrationConstants.*;

import com.norma.config.NormaAgentProperties;
import com.norma.orchestration.llm.LlmRequest;
import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.ReplanInstructions;
import com.norma.orchestration.state.ExecutionState;
import com.norma.orchestration.tool.StepContext;
import com.norma.search.DocumentReference;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class OrchestrationPromptService {

    private static final int PAGE_TEXT_LIMIT = 2000;

    private final NormaAgentProperties properties;
    private final JsonProcessingService jsonProcessingService;

    public LlmRequest planRequest(ExecutionState state) {
        return new LlmRequest(state.getSessionId(), PURPOSE_PLAN,
                PLANNER_SYSTEM_PROMPT.formatted(properties.getMaxSteps()),
                PLANNER_USER_TEMPLATE,
                Map.of("query", state.getQuery().text()));
    }

    public LlmRequest replanRequest(ExecutionState state, ReplanInstructions instructions) {
        String goal = state.getPlan() == null ? "" : state.getPlan().getGoal();
        String details = StringUtils.hasText(instructions.details()) ? instructions.details() : instructions.strategy().label();
        List<String> rejected = state.getScratchpad().getStrings(SCRATCHPAD_REJECTED_SOURCES);
        return new LlmRequest(state.getSessionId(), PURPOSE_REPLAN,
                REPLANNER_SYSTEM_PROMPT.formatted(Math.max(1, properties.getMaxSteps() - state.getDispatchCount())),
                REPLANNER_USER_TEMPLATE,
                Map.of("query", state.getQuery().text(),
                        "goal", goal,
                        "strategy", instructions.strategy().name(),
                        "details", details,
                        "completed", describeHistory(state.getHistory().entries()),
                        "scratchpad", jsonProcessingService.toJson(state.getScratchpad().asMap()),
                        "rejected", rejected.isEmpty() ? "None." : String.join("\n", rejected)));
    }

    public LlmRequest evidenceRequest(StepContext context, List<DocumentReference> documents) {
        return new LlmRequest(context.sessionId(), PURPOSE_EVIDENCE,
                EVIDENCE_SYSTEM_PROMPT,
                EVIDENCE_USER_TEMPLATE,
                Map.of("action", context.step().action(),
                        "scratchpad", jsonProcessingService.toJson(context.scratchpad()),
                        "documents", describeDocuments(documents)));
    }

    public LlmRequest finalizeRequest(ExecutionState state, List<ExecutionHistoryEntry> usableEntries) {
        String goal = state.getPlan() == null ? "" : state.getPlan().getGoal();
        return new LlmRequest(state.getSessionId(), PURPOSE_FINALIZE,
                FINALIZER_SYSTEM_PROMPT,
                FINALIZER_USER_TEMPLATE,
                Map.of("query", state.getQuery().text(),
                        "goal", goal,
                        "scratchpad", jsonProcessingService.toJson(state.getScratchpad().asMap()),
                        "steps", describeHistory(usableEntries)));
    }

    private String describeHistory(List<ExecutionHistoryEntry> entries) {
        if (entries.isEmpty()) {
            return "None.";
        }
        StringBuilder sb = new StringBuilder();
        for (ExecutionHistoryEntry entry : entries) {
            PlanStep step = entry.step();
            sb.append("- step ").append(step.number())
                    .append(" [").append(step.tool().wireName()).append("] ")
                    .append(step.action())
                    .append(" -> ").append(entry.result().status().wireName());
            if (entry.result().source() != null) {
                sb.append(" (").append(entry.result().source().documentName()).append(")");
            }
            if (StringUtils.hasText(entry.result().summary())) {
                sb.append(": ").append(entry.result().summary());
            }
            if (StringUtils.hasText(entry.result().errorMessage())) {
                sb.append(": ").append(entry.result().errorMessage());
            }
            sb.append("\n");
        }
        return sb.toString().trim();
    }

    private String describeDocuments(List<DocumentReference> documents) {
        StringBuilder sb = new StringBuilder();
        int index = 1;
        for (DocumentReference document : documents) {
            sb.append("[").append(index++).append("] ").append(document.docCode());
            if (StringUtils.hasText(document.title())) {
                sb.append(" (").append(document.title()).append(")");
            }
            if (document.pageNumber() > 0) {
                sb.append(", page ").append(document.pageNumber());
            }
            String text = StringUtils.hasText(document.text()) ? document.text() : document.snippet();
            if (text != null && text.length() > PAGE_TEXT_LIMIT) {
                text = text.substring(0, PAGE_TEXT_LIMIT) + "...";
            }
            sb.append("\n").append(text == null ? "" : text).append("\n\n");
        }
        return sb.toString().trim();
    }
}
