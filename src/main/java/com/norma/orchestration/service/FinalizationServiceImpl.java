package com.norma.orchestration.service;

import static com.norma.orchestration.OrchestrationConstants.*;

import com.norma.orchestration.api.FinalizationService;
import com.norma.orchestration.exception.ParseException;
import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.FinalAnswer;
import com.norma.orchestration.model.FinalAnswerDraft;
import com.norma.orchestration.model.SessionStatus;
import com.norma.orchestration.model.SourceRef;
import com.norma.orchestration.state.ExecutionState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class FinalizationServiceImpl implements FinalizationService {

    static final String FALLBACK_LIMITATION = "The answer lists the collected facts because the summary could not be generated.";

    private final StructuredOutputService structuredOutputService;
    private final OrchestrationPromptService promptService;

    @Override
    public FinalAnswer finalizeAnswer(ExecutionState state) {
        List<ExecutionHistoryEntry> usable = state.getHistory().entries().stream()
                .filter(entry -> entry.result().status().isUsable())
                .toList();
        Set<SourceRef> citations = citations(usable, state.getScratchpad().getStrings(SCRATCHPAD_REJECTED_SOURCES));

        FinalAnswer answer;
        try {
            FinalAnswerDraft draft = structuredOutputService.request(
                    promptService.finalizeRequest(state, usable),
                    FinalAnswerDraft.class,
                    value -> {
                        if (!StringUtils.hasText(value.answer())) {
                            throw new IllegalArgumentException("answer is required");
                        }
                    });
            answer = new FinalAnswer(draft.answer().trim(), citations, draft.limitations());
        } catch (ParseException ex) {
            log.warn("Finalizer output unusable for session {}; falling back to a fact listing.", state.getSessionId());
            answer = new FinalAnswer(factListing(state), citations, List.of(FALLBACK_LIMITATION));
        }
        state.setStatus(SessionStatus.COMPLETED);
        log.info("Session {} finalized with {} citations.", state.getSessionId(), citations.size());
        return answer;
    }

    private Set<SourceRef> citations(List<ExecutionHistoryEntry> usable, List<String> rejectedSources) {
        Set<String> rejected = rejectedSources.stream()
                .filter(entry -> !entry.startsWith(REJECTED_KEYWORDS_PREFIX))
                .map(StepSignatures::documentKey)
                .collect(Collectors.toSet());
        Set<SourceRef> citations = new LinkedHashSet<>();
        for (ExecutionHistoryEntry entry : usable) {
            SourceRef source = entry.result().source();
            if (source != null && !rejected.contains(StepSignatures.documentKey(source.documentName()))) {
                citations.add(source);
            }
        }
        return citations;
    }

    private String factListing(ExecutionState state) {
        List<String> lines = new ArrayList<>();
        if (state.getPlan() != null) {
            lines.add(state.getPlan().getGoal());
        }
        for (Map.Entry<String, Object> fact : state.getScratchpad().asMap().entrySet()) {
            if (!fact.getKey().equals(SCRATCHPAD_PRIORITY_DOCUMENTS) && !fact.getKey().equals(SCRATCHPAD_QUERY_DOMAIN)
                    && !fact.getKey().equals(SCRATCHPAD_REJECTED_SOURCES)
                    && !fact.getKey().equals(SCRATCHPAD_SEARCH_HYPOTHESES)) {
                lines.add("- " + fact.getKey() + ": " + fact.getValue());
            }
        }
        return String.join("\n", lines);
    }
}
