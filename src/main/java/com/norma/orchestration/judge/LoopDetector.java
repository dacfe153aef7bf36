package com.norma.orchestration.judge;

import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.ReplanStrategy;
import com.norma.orchestration.service.StepSignatures;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Detects K consecutive dispatches with the same tool and normalized parameters, counting
 * the step being judged as the newest one.
 */
@Component
public class LoopDetector {

    private static final List<ReplanStrategy> ROTATION = List.of(
            ReplanStrategy.CHANGE_KEYWORDS,
            ReplanStrategy.FORM_NEW_HYPOTHESIS,
            ReplanStrategy.REFINE_AND_RESTRICT_SEARCH);

    public boolean isLoop(PlanStep current, List<ExecutionHistoryEntry> history, int window) {
        if (window < 2 || history.size() < window - 1) {
            return false;
        }
        String signature = StepSignatures.signature(current);
        List<ExecutionHistoryEntry> recent = history.subList(history.size() - (window - 1), history.size());
        return recent.stream().allMatch(entry -> StepSignatures.signature(entry.step()).equals(signature));
    }

    /**
     * First strategy of the rotation that neither the window's decisions nor {@code excluded}
     * used, or {@code null} when every one has been tried.
     */
    @Nullable
    public ReplanStrategy alternativeStrategy(List<ExecutionHistoryEntry> history, int window,
                                              @Nullable ReplanStrategy excluded) {
        Set<ReplanStrategy> used = EnumSet.noneOf(ReplanStrategy.class);
        int from = Math.max(0, history.size() - (window - 1));
        for (ExecutionHistoryEntry entry : history.subList(from, history.size())) {
            if (entry.decision().strategy() != null) {
                used.add(entry.decision().strategy());
            }
        }
        if (excluded != null) {
            used.add(excluded);
        }
        return ROTATION.stream().filter(strategy -> !used.contains(strategy)).findFirst().orElse(null);
    }
}
