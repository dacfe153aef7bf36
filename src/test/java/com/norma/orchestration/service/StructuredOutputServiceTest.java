package com.norma.orchestration.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.norma.config.NormaAgentProperties;
import com.norma.orchestration.api.SessionAuditService;
import com.norma.orchestration.exception.ParseException;
import com.norma.orchestration.llm.LanguageModelClient;
import com.norma.orchestration.llm.LlmRequest;
import com.norma.orchestration.model.FinalAnswerDraft;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StructuredOutputServiceTest {

    private final LlmRequest request = new LlmRequest(UUID.randomUUID(), "finalize", "Answer in JSON.",
            "Question: {query}", Map.of("query", "What cover?"));

    private LanguageModelClient languageModelClient;
    private SessionAuditService auditService;
    private StructuredOutputService service;

    @BeforeEach
    void setUp() {
        languageModelClient = mock(LanguageModelClient.class);
        auditService = mock(SessionAuditService.class);
        service = new StructuredOutputService(languageModelClient,
                new JsonProcessingService(new ObjectMapper().findAndRegisterModules()),
                auditService, new OrchestrationMetricsService(), new NormaAgentProperties());
    }

    @Test
    void testInvalidJsonIsRetriedWithReminder() {
        when(languageModelClient.call(any()))
                .thenReturn("Sure! Here you go")
                .thenReturn("```json\n{\"answer\": \"20 mm\", \"limitations\": []}\n```");

        FinalAnswerDraft draft = service.request(request, FinalAnswerDraft.class);

        assertEquals("20 mm", draft.answer());
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(languageModelClient, times(2)).call(captor.capture());
        LlmRequest retry = captor.getAllValues().get(1);
        assertEquals("finalize-retry", retry.purpose());
        assertTrue(retry.systemPrompt().endsWith("Return only valid JSON."));
        verify(auditService).logPrompt(request.sessionId(), "finalize", "Answer in JSON.", "Question: What cover?",
                "Sure! Here you go");
    }

    @Test
    void testValidatorRejectionCountsAsFailure() {
        when(languageModelClient.call(any()))
                .thenReturn("{\"answer\": \" \"}")
                .thenReturn("{\"answer\": \"20 mm\"}");

        FinalAnswerDraft draft = service.request(request, FinalAnswerDraft.class, value -> {
            if (value.answer() == null || value.answer().isBlank()) {
                throw new IllegalArgumentException("answer is required");
            }
        });

        assertEquals("20 mm", draft.answer());
    }

    @Test
    void testExhaustedRetriesRaiseParseException() {
        when(languageModelClient.call(any())).thenReturn("no json at all");

        ParseException ex = assertThrows(ParseException.class, () -> service.request(request, FinalAnswerDraft.class));

        assertEquals("finalize", ex.getPurpose());
        verify(languageModelClient, times(3)).call(any());
        verify(auditService, times(3)).logPrompt(any(), anyString(), anyString(), anyString(), anyString());
    }
}
