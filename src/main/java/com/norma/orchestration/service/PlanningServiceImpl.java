package com.norma.orchestration.service;

import static com.norma.orchestration.OrchestrationConstants.*;

import com.norma.orchestration.api.PlanningService;
import com.norma.orchestration.exception.PlanValidationException;
import com.norma.orchestration.model.CalculationTemplate;
import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.PlanDraft;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.ReplanInstructions;
import com.norma.orchestration.model.ReplanStrategy;
import com.norma.orchestration.model.ScratchpadUpdate;
import com.norma.orchestration.model.SearchHypothesis;
import com.norma.orchestration.model.StepTool;
import com.norma.orchestration.state.ExecutionState;
import com.norma.orchestration.state.Plan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlanningServiceImpl implements PlanningService {

    private static final int PLANNING_ATTEMPTS = 2;

    private final StructuredOutputService structuredOutputService;
    private final OrchestrationPromptService promptService;
    private final PlanValidator planValidator;
    private final OrchestrationMetricsService metricsService;

    @Override
    public void createInitialPlan(ExecutionState state) {
        for (int attempt = 1; ; attempt++) {
            PlanDraft draft = structuredOutputService.request(promptService.planRequest(state), PlanDraft.class);
            try {
                Plan plan = planValidator.buildPlan(draft);
                state.installPlan(plan);
                state.mergeScratchpad(seedScratchpad(draft));
                metricsService.recordPlan("initial", plan.getVersion(), plan.getSteps().size());
                log.info("Plan installed for session {}: goal='{}', steps={}, requiredFacts={}, requiresCalculation={}",
                        state.getSessionId(), plan.getGoal(), plan.getSteps().size(), plan.getRequiredFacts(),
                        plan.isRequiresCalculation());
                return;
            } catch (PlanValidationException ex) {
                if (attempt >= PLANNING_ATTEMPTS) {
                    throw ex;
                }
                log.warn("Initial plan rejected ({}); asking the planner once more.", ex.getMessage());
            }
        }
    }

    @Override
    public void replan(ExecutionState state, ReplanInstructions instructions) {
        Plan plan = state.getPlan();
        if (plan == null) {
            throw new IllegalStateException("Cannot replan before a plan is installed");
        }
        for (int attempt = 1; ; attempt++) {
            try {
                List<PlanStep> steps = instructions.strategy() == ReplanStrategy.FORM_CALCULATION_STEP
                        ? List.of(calculationStep(state, instructions))
                        : replacementSteps(state, instructions);
                state.replaceRemainingSteps(steps);
                metricsService.recordPlan("replan:" + instructions.strategy().name(), plan.getVersion(), steps.size());
                log.info("Replanned session {} with {}: {} new steps, plan version {}.", state.getSessionId(),
                        instructions.strategy(), steps.size(), plan.getVersion());
                return;
            } catch (PlanValidationException ex) {
                if (attempt >= PLANNING_ATTEMPTS) {
                    throw ex;
                }
                log.warn("Replan with {} rejected ({}); asking the planner once more.", instructions.strategy(),
                        ex.getMessage());
            }
        }
    }

    private PlanStep calculationStep(ExecutionState state, ReplanInstructions instructions) {
        CalculationTemplate template = state.getPlan().getCalculation();
        if (template != null && template.isUsable()) {
            return planValidator.calculationStep(template);
        }
        return planValidator.toSteps(requestDraft(state, instructions).steps()).stream()
                .filter(step -> step.tool() == StepTool.CALCULATE)
                .findFirst()
                .orElseThrow(() -> new PlanValidationException("Replan produced no calculate step"));
    }

    private List<PlanStep> replacementSteps(ExecutionState state, ReplanInstructions instructions) {
        List<PlanStep> steps = planValidator.toSteps(requestDraft(state, instructions).steps());
        if (!instructions.allowRejected()) {
            steps = withoutRejected(steps, state.getScratchpad().getStrings(SCRATCHPAD_REJECTED_SOURCES));
        }
        steps = enforceStrategy(steps, instructions.strategy(), state);
        if (steps.isEmpty()) {
            throw new PlanValidationException("Replan with " + instructions.strategy() + " left no valid step");
        }
        return steps;
    }

    private PlanDraft requestDraft(ExecutionState state, ReplanInstructions instructions) {
        return structuredOutputService.request(promptService.replanRequest(state, instructions), PlanDraft.class);
    }

    /**
     * Removes rejected documents from search filters and drops steps that repeat a rejected
     * keyword set or whose every expected document was rejected.
     */
    List<PlanStep> withoutRejected(List<PlanStep> steps, List<String> rejectedSources) {
        if (rejectedSources.isEmpty()) {
            return steps;
        }
        Set<String> rejectedKeywordSets = rejectedSources.stream()
                .filter(entry -> entry.startsWith(REJECTED_KEYWORDS_PREFIX))
                .collect(Collectors.toSet());
        Set<String> rejectedDocuments = rejectedSources.stream()
                .filter(entry -> !entry.startsWith(REJECTED_KEYWORDS_PREFIX))
                .map(StepSignatures::documentKey)
                .collect(Collectors.toSet());
        List<PlanStep> kept = new ArrayList<>();
        for (PlanStep step : steps) {
            if (step.tool() != StepTool.SEARCH) {
                kept.add(step);
                continue;
            }
            if (rejectedKeywordSets.contains(StepSignatures.rejectedKeywordsEntry(step.keywords()))) {
                log.info("Dropping replanned step {}: keyword set {} was rejected.", step.number(), step.keywords());
                continue;
            }
            List<String> expected = step.expectedDocuments();
            List<String> allowed = expected.stream()
                    .filter(document -> !rejectedDocuments.contains(StepSignatures.documentKey(document)))
                    .toList();
            if (!expected.isEmpty() && allowed.isEmpty()) {
                log.info("Dropping replanned step {}: all expected documents {} were rejected.", step.number(), expected);
                continue;
            }
            kept.add(allowed.size() == expected.size() ? step : withParameter(step, PARAM_EXPECTED_DOCUMENTS, allowed));
        }
        return kept;
    }

    private List<PlanStep> enforceStrategy(List<PlanStep> steps, ReplanStrategy strategy, ExecutionState state) {
        List<ExecutionHistoryEntry> history = state.getHistory().entries();
        return switch (strategy) {
            case CHANGE_KEYWORDS -> {
                Set<List<String>> usedKeywords = history.stream()
                        .filter(entry -> entry.step().tool() == StepTool.SEARCH)
                        .map(entry -> StepSignatures.normalizeTerms(entry.step().keywords()))
                        .collect(Collectors.toSet());
                yield steps.stream()
                        .filter(step -> step.tool() != StepTool.SEARCH
                                || !usedKeywords.contains(StepSignatures.normalizeTerms(step.keywords())))
                        .toList();
            }
            case FORM_NEW_HYPOTHESIS -> {
                Set<String> usedSignatures = history.stream()
                        .map(entry -> StepSignatures.signature(entry.step()))
                        .collect(Collectors.toSet());
                yield steps.stream()
                        .filter(step -> !usedSignatures.contains(StepSignatures.signature(step)))
                        .toList();
            }
            case REFINE_AND_RESTRICT_SEARCH -> {
                List<String> rejected = state.getScratchpad().getStrings(SCRATCHPAD_REJECTED_SOURCES).stream()
                        .map(StepSignatures::documentKey)
                        .toList();
                List<String> priority = state.getScratchpad().getStrings(SCRATCHPAD_PRIORITY_DOCUMENTS).stream()
                        .filter(document -> !rejected.contains(StepSignatures.documentKey(document)))
                        .toList();
                yield steps.stream()
                        .map(step -> step.tool() == StepTool.SEARCH && step.expectedDocuments().isEmpty() && !priority.isEmpty()
                                ? withParameter(step, PARAM_EXPECTED_DOCUMENTS, priority)
                                : step)
                        .toList();
            }
            case FORM_CALCULATION_STEP -> steps;
        };
    }

    private PlanStep withParameter(PlanStep step, String key, Object value) {
        Map<String, Object> parameters = new LinkedHashMap<>(step.parameters());
        parameters.put(key, value);
        return PlanStep.pending(step.number(), step.action(), step.tool(), parameters);
    }

    private ScratchpadUpdate seedScratchpad(PlanDraft draft) {
        ScratchpadUpdate.Builder update = ScratchpadUpdate.builder();
        if (StringUtils.hasText(draft.queryDomain())) {
            update.set(SCRATCHPAD_QUERY_DOMAIN, draft.queryDomain().trim());
        }
        if (draft.priorityDocuments() != null && !draft.priorityDocuments().isEmpty()) {
            update.set(SCRATCHPAD_PRIORITY_DOCUMENTS, draft.priorityDocuments().stream()
                    .filter(StringUtils::hasText)
                    .map(String::trim)
                    .toList());
        }
        if (draft.searchHypotheses() != null && !draft.searchHypotheses().isEmpty()) {
            List<Map<String, Object>> hypotheses = new ArrayList<>();
            for (SearchHypothesis hypothesis : draft.searchHypotheses()) {
                if (hypothesis == null || !StringUtils.hasText(hypothesis.hypothesis())) {
                    continue;
                }
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("hypothesis", hypothesis.hypothesis());
                entry.put(PARAM_KEYWORDS, hypothesis.keywords() == null ? List.of() : hypothesis.keywords());
                entry.put(PARAM_EXPECTED_DOCUMENTS,
                        hypothesis.expectedDocuments() == null ? List.of() : hypothesis.expectedDocuments());
                hypotheses.add(entry);
            }
            if (!hypotheses.isEmpty()) {
                update.set(SCRATCHPAD_SEARCH_HYPOTHESES, hypotheses);
            }
        }
        return update.build();
    }
}
