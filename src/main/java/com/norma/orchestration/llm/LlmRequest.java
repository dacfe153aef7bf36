package com.norma.orchestration.llm;

import java.util.Map;
import java.util.UUID;

/**
 * One language model call. The user prompt is a template whose {@code {name}} placeholders
 * are filled from {@code params}.
 */
public record LlmRequest(
        UUID sessionId,
        String purpose,
        String systemPrompt,
        String userTemplate,
        Map<String, Object> params
) {

    public LlmRequest {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public LlmRequest withRetry(String retryPurpose, String retrySystemPrompt) {
        return new LlmRequest(sessionId, retryPurpose, retrySystemPrompt, userTemplate, params);
    }

    public String renderUserPrompt() {
        String rendered = userTemplate;
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            rendered = rendered.replace("{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
        }
        return rendered;
    }
}
