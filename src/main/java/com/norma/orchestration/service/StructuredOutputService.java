package com.norma.orchestration.service;

import static com.norma.orchestration.OrchestrationConstants.*;

import com.norma.config.NormaAgentProperties;
import com.norma.orchestration.api.SessionAuditService;
import com.norma.orchestration.exception.ParseException;
import com.norma.orchestration.llm.LanguageModelClient;
import com.norma.orchestration.llm.LlmRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Consumer;

/**
 * Calls the language model and binds its answer to a schema type. A response that does not
 * parse, or that {@code validator} rejects with an {@link IllegalArgumentException}, is
 * retried with a reminder appended to the system prompt until {@code norma.parse-retries}
 * calls have been made.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructuredOutputService {

    private final LanguageModelClient languageModelClient;
    private final JsonProcessingService jsonProcessingService;
    private final SessionAuditService auditService;
    private final OrchestrationMetricsService metricsService;
    private final NormaAgentProperties properties;

    public <T> T request(LlmRequest request, Class<T> type) {
        return request(request, type, value -> {
        });
    }

    public <T> T request(LlmRequest request, Class<T> type, Consumer<T> validator) {
        int attempts = properties.getParseRetries();
        LlmRequest current = request;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (attempt > 1) {
                current = request.withRetry(request.purpose() + RETRY_SUFFIX,
                        request.systemPrompt() + INVALID_JSON_RETRY_PROMPT);
            }
            metricsService.recordLlmRequest(current.purpose());
            String response = languageModelClient.call(current);
            auditService.logPrompt(current.sessionId(), current.purpose(), current.systemPrompt(),
                    current.renderUserPrompt(), response);
            T value = jsonProcessingService.parseJsonResponse(current.purpose(), response, type);
            if (value == null) {
                continue;
            }
            try {
                validator.accept(value);
                return value;
            } catch (IllegalArgumentException ex) {
                log.warn("{} response failed validation (attempt {}/{}): {}", current.purpose(), attempt, attempts,
                        ex.getMessage());
            }
        }
        throw new ParseException(request.purpose(), "No valid " + type.getSimpleName() + " from the language model after "
                + attempts + " attempts (purpose=" + request.purpose() + ")");
    }
}
