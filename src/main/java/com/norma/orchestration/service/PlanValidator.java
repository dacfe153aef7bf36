package com.norma.orchestration.service;

import static com.norma.orchestration.OrchestrationConstants.*;

import com.norma.orchestration.exception.PlanValidationException;
import com.norma.orchestration.model.CalculationTemplate;
import com.norma.orchestration.model.PlanDraft;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.StepTool;
import com.norma.orchestration.state.Plan;
import com.norma.orchestration.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns planner drafts into executable steps. Steps whose tool has no handler, or that lack
 * the parameters their tool needs, are dropped; a draft left with no step is invalid.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlanValidator {

    private final ToolRegistry toolRegistry;

    public Plan buildPlan(PlanDraft draft) {
        if (draft == null || !StringUtils.hasText(draft.goal())) {
            throw new PlanValidationException("Plan has no goal");
        }
        List<PlanStep> steps = toSteps(draft.steps());
        if (steps.isEmpty()) {
            throw new PlanValidationException("Plan has no valid step");
        }
        CalculationTemplate calculation = draft.calculation() != null && draft.calculation().isUsable()
                ? draft.calculation()
                : null;
        boolean requiresCalculation = Boolean.TRUE.equals(draft.requiresCalculation()) || calculation != null;
        List<String> requiredFacts = draft.requiredFacts() == null ? List.of() : draft.requiredFacts().stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .distinct()
                .toList();
        return Plan.create(draft.goal(), requiredFacts, requiresCalculation, calculation, steps);
    }

    /**
     * Valid steps in draft order, numbered from 1. The plan renumbers them again when they
     * replace the remaining steps of an existing plan.
     */
    public List<PlanStep> toSteps(List<PlanDraft.StepDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            return List.of();
        }
        List<PlanDraft.StepDraft> ordered = new ArrayList<>(drafts);
        ordered.removeIf(draft -> draft == null);
        ordered.sort(Comparator.comparing(PlanDraft.StepDraft::stepNumber, Comparator.nullsLast(Comparator.naturalOrder())));
        List<PlanStep> steps = new ArrayList<>();
        for (PlanDraft.StepDraft draft : ordered) {
            StepTool tool = StepTool.from(draft.tool());
            if (!toolRegistry.supports(tool)) {
                log.warn("Dropping step '{}': tool '{}' has no handler.", draft.action(), draft.tool());
                continue;
            }
            Map<String, Object> parameters = mergeParameters(draft);
            PlanStep step = PlanStep.pending(steps.size() + 1, draft.action(), tool, parameters);
            String problem = missingParameters(step);
            if (problem != null) {
                log.warn("Dropping step '{}': {}.", draft.action(), problem);
                continue;
            }
            steps.add(step);
        }
        return steps;
    }

    public PlanStep calculationStep(CalculationTemplate template) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put(PARAM_EXPRESSION, template.expression());
        parameters.put(PARAM_OUTPUT_VARIABLE, template.outputVariable());
        parameters.put(PARAM_INPUT_VARIABLES, template.inputVariables());
        return PlanStep.pending(1, "Calculate " + template.outputVariable(), StepTool.CALCULATE, parameters);
    }

    private Map<String, Object> mergeParameters(PlanDraft.StepDraft draft) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        if (draft.parameters() != null) {
            parameters.putAll(draft.parameters());
        }
        putIfAbsent(parameters, PARAM_KEYWORDS, draft.keywords());
        putIfAbsent(parameters, PARAM_EXPECTED_DOCUMENTS, draft.expectedDocuments());
        putIfAbsent(parameters, PARAM_EXPRESSION, draft.expression());
        putIfAbsent(parameters, PARAM_OUTPUT_VARIABLE, draft.outputVariable());
        putIfAbsent(parameters, PARAM_INPUT_VARIABLES, draft.inputVariables());
        // Older prompts used semantic_keywords inside parameters too
        if (!parameters.containsKey(PARAM_KEYWORDS) && parameters.containsKey("semantic_keywords")) {
            parameters.put(PARAM_KEYWORDS, parameters.remove("semantic_keywords"));
        }
        return parameters;
    }

    private void putIfAbsent(Map<String, Object> parameters, String key, Object value) {
        if (value != null && !parameters.containsKey(key)) {
            parameters.put(key, value);
        }
    }

    private String missingParameters(PlanStep step) {
        return switch (step.tool()) {
            case SEARCH -> step.keywords().isEmpty() ? "search step without keywords" : null;
            case CALCULATE -> !StringUtils.hasText(String.valueOf(step.parameters().getOrDefault(PARAM_EXPRESSION, "")))
                    || !StringUtils.hasText(String.valueOf(step.parameters().getOrDefault(PARAM_OUTPUT_VARIABLE, "")))
                    ? "calculate step without expression or output variable"
                    : null;
            default -> "unsupported tool";
        };
    }
}
