package com.norma.orchestration.service;

import static com.norma.orchestration.OrchestrationConstants.REJECTED_KEYWORDS_PREFIX;

import com.norma.orchestration.model.PlanStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical forms used to compare steps, keyword sets and document codes.
 */
public final class StepSignatures {

    private StepSignatures() {
    }

    /**
     * Tool plus parameters with keys sorted, strings trimmed and lower-cased, and string
     * lists sorted, so reordered keywords still produce the same signature.
     */
    public static String signature(PlanStep step) {
        Map<String, Object> normalized = new TreeMap<>();
        step.parameters().forEach((key, value) -> normalized.put(key, normalizeValue(value)));
        return step.tool().wireName() + normalized;
    }

    public static List<String> normalizeTerms(List<String> terms) {
        return terms.stream()
                .filter(term -> term != null && !term.isBlank())
                .map(term -> term.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .sorted()
                .toList();
    }

    public static String rejectedKeywordsEntry(List<String> keywords) {
        return REJECTED_KEYWORDS_PREFIX + " " + String.join(", ", normalizeTerms(keywords));
    }

    public static String documentKey(String documentName) {
        return documentName == null ? "" : documentName.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof String text) {
            return text.trim().toLowerCase(Locale.ROOT);
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>();
            boolean allStrings = true;
            for (Object item : list) {
                Object normalizedItem = normalizeValue(item);
                allStrings &= normalizedItem instanceof String;
                items.add(normalizedItem);
            }
            if (allStrings) {
                return items.stream().map(Object::toString).sorted().toList();
            }
            return items;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new TreeMap<>();
            map.forEach((key, item) -> nested.put(String.valueOf(key), normalizeValue(item)));
            return nested;
        }
        return value;
    }
}
