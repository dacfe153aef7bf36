package com.norma.api;

import com.norma.orchestration.model.SessionOutcome;
import com.norma.orchestration.model.SessionStatus;
import com.norma.orchestration.service.SessionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionRegistry sessionRegistry;

    @Test
    void testGetRunningSession() throws Exception {
        UUID sessionId = UUID.randomUUID();
        when(sessionRegistry.find(sessionId))
                .thenReturn(Optional.of(SessionOutcome.running(sessionId, SessionStatus.JUDGING)));

        mockMvc.perform(get("/api/sessions/{sessionId}", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("JUDGING"))
                .andExpect(jsonPath("$.history").isEmpty());
    }

    @Test
    void testGetUnknownSession() throws Exception {
        UUID sessionId = UUID.randomUUID();
        when(sessionRegistry.find(sessionId)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/sessions/{sessionId}", sessionId))
                .andExpect(status().isNotFound());
    }

    @Test
    void testCancel() throws Exception {
        UUID running = UUID.randomUUID();
        when(sessionRegistry.cancel(running)).thenReturn(true);

        mockMvc.perform(post("/api/sessions/{sessionId}/cancel", running))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));

        mockMvc.perform(post("/api/sessions/{sessionId}/cancel", UUID.randomUUID()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("not-found"));
    }
}
