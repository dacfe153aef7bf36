package com.norma.orchestration.service;

import com.norma.orchestration.model.SessionOutcome;
import com.norma.orchestration.state.ExecutionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Running sessions by id with their latest published outcome, for polling and cancellation.
 */
@Component
@Slf4j
public class SessionRegistry {

    private static final Duration COMPLETED_TTL = Duration.ofMinutes(30);

    private final Map<UUID, ExecutionState> running = new ConcurrentHashMap<>();
    private final Map<UUID, SessionOutcome> outcomes = new ConcurrentHashMap<>();
    private final Map<UUID, Instant> completedAt = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration completedTtl;

    public SessionRegistry() {
        this(Clock.systemUTC(), COMPLETED_TTL);
    }

    SessionRegistry(Clock clock, Duration completedTtl) {
        this.clock = clock;
        this.completedTtl = completedTtl;
    }

    public void register(ExecutionState state) {
        cleanupExpiredSessions();
        running.put(state.getSessionId(), state);
        outcomes.put(state.getSessionId(), SessionOutcome.running(state.getSessionId(), state.getStatus()));
    }

    public void publish(SessionOutcome outcome) {
        outcomes.put(outcome.sessionId(), outcome);
        if (outcome.status().isTerminal()) {
            running.remove(outcome.sessionId());
            completedAt.put(outcome.sessionId(), clock.instant());
        }
    }

    public Optional<SessionOutcome> find(UUID sessionId) {
        cleanupExpiredSessions();
        return Optional.ofNullable(outcomes.get(sessionId));
    }

    public boolean isRunning(UUID sessionId) {
        return running.containsKey(sessionId);
    }

    /**
     * Raises the cancellation flag of a running session. The loop notices it before its next
     * stage and escalates.
     *
     * @return {@code false} when no session with that id is running
     */
    public boolean cancel(UUID sessionId) {
        ExecutionState state = running.get(sessionId);
        if (state == null) {
            return false;
        }
        state.requestCancel();
        log.info("Cancellation requested for session {}.", sessionId);
        return true;
    }

    /**
     * Forgets finished sessions whose outcome has been kept longer than the retention period.
     */
    private void cleanupExpiredSessions() {
        Instant cutoff = clock.instant().minus(completedTtl);
        completedAt.entrySet().removeIf(entry -> {
            if (entry.getValue().isBefore(cutoff)) {
                outcomes.remove(entry.getKey());
                return true;
            }
            return false;
        });
    }
}
