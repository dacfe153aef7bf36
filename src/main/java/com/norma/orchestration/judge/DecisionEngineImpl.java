package com.norma.orchestration.judge;

import static com.norma.orchestration.OrchestrationConstants.SCRATCHPAD_REJECTED_SOURCES;

import com.norma.config.NormaAgentProperties;
import com.norma.orchestration.api.DecisionEngine;
import com.norma.orchestration.model.Decision;
import com.norma.orchestration.model.DecisionScores;
import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.ReplanInstructions;
import com.norma.orchestration.model.ReplanStrategy;
import com.norma.orchestration.model.ResultStatus;
import com.norma.orchestration.model.ScratchpadUpdate;
import com.norma.orchestration.model.StepDispatch;
import com.norma.orchestration.model.StepResult;
import com.norma.orchestration.model.StepTool;
import com.norma.orchestration.model.Verdict;
import com.norma.orchestration.service.StepSignatures;
import com.norma.orchestration.state.ExecutionState;
import com.norma.orchestration.state.Plan;
import com.norma.orchestration.state.Scratchpad;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based judge. Stages run in a fixed order and a later stage only overrides an earlier
 * one when it ranks higher: budget, then loop, then contradiction, then status and
 * relevance, then goal completion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DecisionEngineImpl implements DecisionEngine {

    private final RelevanceScorer relevanceScorer;
    private final ConsistencyChecker consistencyChecker;
    private final LoopDetector loopDetector;
    private final NormaAgentProperties properties;

    @Override
    public Decision decide(ExecutionState state, StepDispatch dispatch) {
        PlanStep step = dispatch.step();
        StepResult result = dispatch.result();
        Plan plan = state.getPlan();
        Scratchpad scratchpad = state.getScratchpad();
        List<ExecutionHistoryEntry> history = state.getHistory().entries();
        ScratchpadUpdate.Builder update = ScratchpadUpdate.builder();
        List<String> reasons = new ArrayList<>();

        // 1. Status check
        ReplanStrategy statusStrategy = null;
        if (result.status() == ResultStatus.ERROR) {
            statusStrategy = step.tool() == StepTool.CALCULATE
                    ? ReplanStrategy.FORM_CALCULATION_STEP
                    : ReplanStrategy.REFINE_AND_RESTRICT_SEARCH;
            reasons.add("Step " + step.number() + " failed: " + result.errorMessage());
        } else if (result.status() == ResultStatus.NOT_FOUND) {
            if (step.tool() == StepTool.SEARCH && !step.keywords().isEmpty()) {
                update.append(SCRATCHPAD_REJECTED_SOURCES, StepSignatures.rejectedKeywordsEntry(step.keywords()));
            }
            if (!plan.hasPendingStep(StepTool.SEARCH)) {
                statusStrategy = ReplanStrategy.CHANGE_KEYWORDS;
            }
            reasons.add("Step " + step.number() + " found nothing for " + step.keywords());
        }

        // 2. Relevance
        double relevance = relevanceScorer.score(result, scratchpad);
        ReplanStrategy relevanceStrategy = null;
        if (result.status().isUsable() && result.source() != null && relevance < properties.getRelevanceThreshold()) {
            relevanceStrategy = ReplanStrategy.REFINE_AND_RESTRICT_SEARCH;
            update.append(SCRATCHPAD_REJECTED_SOURCES, result.source().documentName());
            reasons.add(String.format(Locale.ROOT, "Source %s is off-domain (relevance %.2f)",
                    result.source().documentName(), relevance));
        }

        // 3. Consistency
        Map<String, Object> facts = result.status().isUsable() && relevanceStrategy == null
                ? result.structuredOutput()
                : Map.of();
        ConsistencyChecker.Report consistency = consistencyChecker.check(facts, scratchpad.asMap());
        update.setAll(consistency.accepted());
        String contradictionDetails = consistency.hasContradictions() ? consistency.details() : null;
        boolean earlierContradiction = history.stream().anyMatch(entry -> entry.decision().contradictionDetails() != null);
        if (contradictionDetails != null) {
            reasons.add("New facts contradict known ones: " + contradictionDetails);
        }

        // 4. Loop detection
        boolean loop = loopDetector.isLoop(step, history, properties.getLoopWindow());
        boolean earlierLoop = history.stream().anyMatch(entry -> entry.decision().loopDetected());
        if (loop) {
            reasons.add("Last " + properties.getLoopWindow() + " dispatches repeat " + step.tool().wireName()
                    + " with identical parameters");
        }

        // 5. Goal completion
        Set<String> knownKeys = new HashSet<>(scratchpad.asMap().keySet());
        knownKeys.addAll(consistency.accepted().keySet());
        List<String> missingFacts = plan.getRequiredFacts().stream().filter(fact -> !knownKeys.contains(fact)).toList();
        boolean anyUsable = result.status().isUsable()
                || history.stream().anyMatch(entry -> entry.result().status().isUsable());
        boolean dataComplete = plan.getRequiredFacts().isEmpty()
                ? plan.isExhausted() && anyUsable
                : missingFacts.isEmpty();
        boolean computationDone = !plan.isRequiresCalculation() || calculationSucceeded(step, result, history);

        Verdict verdict;
        ReplanStrategy strategy = null;
        String humanReviewReason = null;
        if (dataComplete && computationDone) {
            verdict = Verdict.FINALIZE;
            reasons.add("All required facts are known");
        } else if (dataComplete) {
            if (plan.hasPendingStep(StepTool.CALCULATE)) {
                verdict = Verdict.CONTINUE;
            } else {
                verdict = Verdict.REPLAN;
                strategy = ReplanStrategy.FORM_CALCULATION_STEP;
            }
            reasons.add("Facts are complete but the goal still needs a calculation");
        } else if (plan.hasPendingStep()) {
            verdict = Verdict.CONTINUE;
            reasons.add(missingFacts.isEmpty() ? "Plan has pending steps" : "Still missing " + missingFacts);
        } else {
            verdict = Verdict.REPLAN;
            strategy = ReplanStrategy.FORM_NEW_HYPOTHESIS;
            reasons.add("Plan is exhausted without " + (missingFacts.isEmpty() ? "a usable result" : missingFacts));
        }

        // Status and relevance outrank goal completion
        ReplanStrategy bias = relevanceStrategy != null ? relevanceStrategy : statusStrategy;
        if (bias != null) {
            verdict = Verdict.REPLAN;
            strategy = bias;
        }

        // Contradiction outranks status
        if (contradictionDetails != null) {
            if (earlierContradiction) {
                verdict = Verdict.HUMAN_REVIEW;
                humanReviewReason = "Evidence contradicted known facts again: " + contradictionDetails;
            } else {
                verdict = Verdict.REPLAN;
                strategy = ReplanStrategy.FORM_NEW_HYPOTHESIS;
            }
        }

        // Loop outranks contradiction
        if (loop) {
            ReplanStrategy alternative = loopDetector.alternativeStrategy(history, properties.getLoopWindow(), bias);
            if (earlierLoop) {
                verdict = Verdict.HUMAN_REVIEW;
                humanReviewReason = "Repeated loop: " + step.tool().wireName() + " step " + step.number()
                        + " keeps repeating the same parameters";
            } else if (alternative == null) {
                verdict = Verdict.HUMAN_REVIEW;
                humanReviewReason = "Loop detected and every replanning strategy has been tried";
            } else {
                verdict = Verdict.REPLAN;
                strategy = alternative;
                humanReviewReason = null;
            }
        }

        // Budget outranks everything
        int dispatches = state.getDispatchCount();
        if (dispatches > properties.getMaxSteps()) {
            verdict = Verdict.HUMAN_REVIEW;
            humanReviewReason = "Step budget of " + properties.getMaxSteps() + " exceeded";
        } else if (dispatches >= properties.getMaxSteps() && verdict != Verdict.FINALIZE) {
            verdict = Verdict.HUMAN_REVIEW;
            humanReviewReason = "Step budget of " + properties.getMaxSteps() + " used up before the goal was met";
        } else if (verdict == Verdict.REPLAN && state.getReplanCount() >= properties.getMaxReplans()) {
            verdict = Verdict.HUMAN_REVIEW;
            humanReviewReason = "Replan budget of " + properties.getMaxReplans() + " used up";
        }
        if (humanReviewReason != null && verdict == Verdict.HUMAN_REVIEW) {
            reasons.add(humanReviewReason);
        }

        Decision decision = new Decision(
                verdict,
                String.join(". ", reasons),
                new DecisionScores(relevance, consistency.score()),
                contradictionDetails,
                loop,
                verdict == Verdict.REPLAN ? ReplanInstructions.of(strategy, strategy.label()) : null,
                update.build(),
                verdict == Verdict.HUMAN_REVIEW ? humanReviewReason : null);
        log.info("Verdict {} for step {} (relevance={}, consistency={}, loop={}{})", verdict, step.number(),
                String.format(Locale.ROOT, "%.2f", relevance), String.format(Locale.ROOT, "%.2f", consistency.score()),
                loop, strategy == null || verdict != Verdict.REPLAN ? "" : ", strategy=" + strategy);
        return decision;
    }

    private boolean calculationSucceeded(PlanStep step, StepResult result, List<ExecutionHistoryEntry> history) {
        if (step.tool() == StepTool.CALCULATE && result.status() == ResultStatus.SUCCESS) {
            return true;
        }
        return history.stream().anyMatch(entry -> entry.step().tool() == StepTool.CALCULATE
                && entry.result().status() == ResultStatus.SUCCESS);
    }
}
