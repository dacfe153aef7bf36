package com.norma.orchestration.judge;

import static com.norma.orchestration.OrchestrationConstants.*;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compares newly extracted facts with scratchpad values stored under the same key.
 */
@Component
public class ConsistencyChecker {

    static final double RELATIVE_TOLERANCE = 1e-6;

    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(?:[.,]\\d+)?(?:[eE][-+]?\\d+)?");
    private static final Set<String> RESERVED_KEYS = Set.of(SCRATCHPAD_PRIORITY_DOCUMENTS, SCRATCHPAD_QUERY_DOMAIN,
            SCRATCHPAD_REJECTED_SOURCES, SCRATCHPAD_SEARCH_HYPOTHESES);

    public record Report(int compared, List<String> contradictions, Map<String, Object> accepted) {

        public double score() {
            return compared == 0 ? 1.0 : 1.0 - (double) contradictions.size() / compared;
        }

        public boolean hasContradictions() {
            return !contradictions.isEmpty();
        }

        public String details() {
            return String.join("; ", contradictions);
        }
    }

    public Report check(Map<String, Object> facts, Map<String, Object> scratchpad) {
        int compared = 0;
        List<String> contradictions = new ArrayList<>();
        Map<String, Object> accepted = new LinkedHashMap<>();
        for (Map.Entry<String, Object> fact : facts.entrySet()) {
            String key = fact.getKey();
            if (RESERVED_KEYS.contains(key)) {
                continue;
            }
            Object existing = scratchpad.get(key);
            if (existing == null) {
                accepted.put(key, fact.getValue());
                continue;
            }
            compared++;
            if (agrees(existing, fact.getValue())) {
                accepted.put(key, fact.getValue());
            } else {
                contradictions.add(key + ": known " + existing + ", new " + fact.getValue());
            }
        }
        return new Report(compared, List.copyOf(contradictions), accepted);
    }

    static boolean agrees(Object existing, Object candidate) {
        Double left = number(existing);
        Double right = number(candidate);
        if (left != null && right != null) {
            if (left.equals(right)) {
                return true;
            }
            return Math.abs(left - right) <= RELATIVE_TOLERANCE * Math.max(Math.abs(left), Math.abs(right));
        }
        return normalize(existing).equals(normalize(candidate));
    }

    private static Double number(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && NUMERIC.matcher(text.trim()).matches()) {
            return Double.parseDouble(text.trim().replace(',', '.'));
        }
        return null;
    }

    private static String normalize(Object value) {
        if (value instanceof Number number && Double.isFinite(number.doubleValue())) {
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        }
        if (value instanceof List<?> list) {
            List<String> items = new ArrayList<>();
            for (Object item : list) {
                items.add(normalize(item));
            }
            return items.toString();
        }
        return String.valueOf(value).trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
