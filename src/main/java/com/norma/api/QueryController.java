package com.norma.api;

import com.norma.orchestration.OrchestratorService;
import com.norma.orchestration.model.Query;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/api/queries")
public class QueryController {

    private final OrchestratorService orchestratorService;

    public QueryController(OrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping
    public SessionResponse answer(@Valid @RequestBody QueryRequest request) {
        return SessionResponse.from(orchestratorService.answer(new Query(request.query())));
    }

    @PostMapping("/async")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SubmitResponse submit(@Valid @RequestBody QueryRequest request) {
        UUID sessionId = orchestratorService.submit(new Query(request.query()));
        return new SubmitResponse(sessionId, Instant.now());
    }
}
