package com.norma.orchestration.service;

import com.norma.orchestration.model.ResultStatus;
import com.norma.orchestration.model.SessionStatus;
import com.norma.orchestration.model.StepTool;
import com.norma.orchestration.model.Verdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class OrchestrationMetricsService {

    private final AtomicLong llmRequestCount = new AtomicLong();
    private final AtomicLong planCount = new AtomicLong();
    private final AtomicLong dispatchCount = new AtomicLong();
    private final AtomicLong toolFailureCount = new AtomicLong();
    private final AtomicLong sessionCount = new AtomicLong();
    private final Map<Verdict, AtomicLong> verdictCounts = new EnumMap<>(Verdict.class);

    public OrchestrationMetricsService() {
        for (Verdict verdict : Verdict.values()) {
            verdictCounts.put(verdict, new AtomicLong());
        }
    }

    public void recordLlmRequest(String purpose) {
        long count = llmRequestCount.incrementAndGet();
        log.info("LLM request #{} sent (purpose={}).", count, purpose);
    }

    public void recordPlan(String label, int version, int stepCount) {
        long count = planCount.incrementAndGet();
        log.info("Plan #{} ({}) installed as version {} with {} steps.", count, label, version, stepCount);
    }

    public void recordDispatch(StepTool tool, ResultStatus status) {
        long count = dispatchCount.incrementAndGet();
        log.debug("Dispatch #{} finished (tool={}, status={}).", count, tool.wireName(), status.wireName());
        if (status == ResultStatus.ERROR) {
            toolFailureCount.incrementAndGet();
        }
    }

    public void recordVerdict(Verdict verdict) {
        verdictCounts.get(verdict).incrementAndGet();
    }

    public long verdictCount(Verdict verdict) {
        return verdictCounts.get(verdict).get();
    }

    public long dispatchCount() {
        return dispatchCount.get();
    }

    public void logSummary(SessionStatus finalStatus) {
        long sessions = sessionCount.incrementAndGet();
        log.info("Session #{} ended with {}. Totals: llmRequests={}, plans={}, dispatches={}, toolFailures={}, verdicts={}.",
                sessions, finalStatus, llmRequestCount.get(), planCount.get(), dispatchCount.get(),
                toolFailureCount.get(), verdictCounts);
    }
}
