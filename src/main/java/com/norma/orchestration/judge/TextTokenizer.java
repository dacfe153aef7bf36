package com.norma.orchestration.judge;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lower-cases text and splits it on anything that is not a letter or digit.
 */
final class TextTokenizer {

    private TextTokenizer() {
    }

    static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        StringBuilder b = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            b.append(Character.isLetterOrDigit(c) ? c : ' ');
        }
        List<String> tokens = new ArrayList<>();
        for (String part : b.toString().trim().split("\\s+")) {
            if (!part.isBlank()) {
                tokens.add(part);
            }
        }
        return tokens;
    }
}
