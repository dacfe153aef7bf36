package com.norma.api;

import com.norma.orchestration.OrchestratorService;
import com.norma.orchestration.model.FinalAnswer;
import com.norma.orchestration.model.Query;
import com.norma.orchestration.model.SessionOutcome;
import com.norma.orchestration.model.SourceRef;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QueryController.class)
class QueryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrchestratorService orchestratorService;

    @Test
    void testAnswer() throws Exception {
        UUID sessionId = UUID.randomUUID();
        FinalAnswer answer = new FinalAnswer("The minimum cover is 20 mm.",
                Set.of(new SourceRef("SP 63.13330.2018", "clause 10.3.2", null)), List.of());
        when(orchestratorService.answer(new Query("Minimum concrete cover for slabs?")))
                .thenReturn(SessionOutcome.completed(sessionId, answer, List.of()));

        mockMvc.perform(post("/api/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"Minimum concrete cover for slabs?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value(sessionId.toString()))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.finalAnswer.text").value("The minimum cover is 20 mm."))
                .andExpect(jsonPath("$.finalAnswer.citations[0].document_name").value("SP 63.13330.2018"))
                .andExpect(jsonPath("$.errorMessage").doesNotExist());
    }

    @Test
    void testBlankQueryIsRejected() throws Exception {
        mockMvc.perform(post("/api/queries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"  \"}"))
                .andExpect(status().isBadRequest());

        verify(orchestratorService, never()).answer(any());
    }

    @Test
    void testSubmit() throws Exception {
        UUID sessionId = UUID.randomUUID();
        when(orchestratorService.submit(any())).thenReturn(sessionId);

        mockMvc.perform(post("/api/queries/async")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"Minimum concrete cover for slabs?\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.sessionId").value(sessionId.toString()))
                .andExpect(jsonPath("$.submittedAt").exists());
    }
}
