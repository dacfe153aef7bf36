package com.norma.orchestration.judge;

import static com.norma.orchestration.OrchestrationConstants.SCRATCHPAD_PRIORITY_DOCUMENTS;
import static com.norma.orchestration.OrchestrationConstants.SCRATCHPAD_QUERY_DOMAIN;

import com.norma.orchestration.model.SourceRef;
import com.norma.orchestration.model.StepResult;
import com.norma.orchestration.service.StepSignatures;
import com.norma.orchestration.state.Scratchpad;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores how well a result's source matches the question's subject area.
 * <p>
 * Priority documents score 1.0. Otherwise the score is the share of query-domain stems that
 * also occur in the document's code or title. Stems are the first {@value #STEM_LENGTH}
 * characters of tokens at least {@value #MIN_TOKEN_LENGTH} long, which tolerates inflected
 * forms.
 */
@Component
public class RelevanceScorer {

    static final double UNKNOWN_DOMAIN_SCORE = 0.5;
    private static final int MIN_TOKEN_LENGTH = 3;
    private static final int STEM_LENGTH = 5;

    public double score(StepResult result, Scratchpad scratchpad) {
        if (!result.status().isUsable()) {
            return 0.0;
        }
        SourceRef source = result.source();
        if (source == null) {
            return 1.0;
        }
        String documentKey = StepSignatures.documentKey(source.documentName());
        for (String priority : scratchpad.getStrings(SCRATCHPAD_PRIORITY_DOCUMENTS)) {
            String priorityKey = StepSignatures.documentKey(priority);
            if (!priorityKey.isEmpty() && (documentKey.equals(priorityKey) || documentKey.contains(priorityKey))) {
                return 1.0;
            }
        }
        Object domain = scratchpad.get(SCRATCHPAD_QUERY_DOMAIN);
        Set<String> domainStems = stems(domain == null ? null : domain.toString());
        if (domainStems.isEmpty()) {
            return UNKNOWN_DOMAIN_SCORE;
        }
        Set<String> sourceStems = stems(source.documentName() + " " + (source.domain() == null ? "" : source.domain()));
        long matched = domainStems.stream().filter(sourceStems::contains).count();
        return (double) matched / domainStems.size();
    }

    private Set<String> stems(String text) {
        List<String> tokens = TextTokenizer.tokenize(text);
        Set<String> stems = new LinkedHashSet<>();
        for (String token : tokens) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                stems.add(token.length() > STEM_LENGTH ? token.substring(0, STEM_LENGTH) : token);
            }
        }
        return stems;
    }
}
