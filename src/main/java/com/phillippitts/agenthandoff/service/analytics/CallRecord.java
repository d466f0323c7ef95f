package com.phillippitts.agenthandoff.service.analytics;

import com.phillippitts.agenthandoff.exception.ErrorCode;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bookkeeping for one call. Mutated by {@link LoggingAnalyticsAdapter} only; all access is
 * synchronized on the instance.
 */
public final class CallRecord {

    /**
     * @param at     time of the transition
     * @param from   previous persona or state
     * @param to     new persona or state
     * @param reason reason tag
     */
    public record Transition(Instant at, String from, String to, String reason) {}

    private final String contextId;
    private final String initialPersona;
    private final Instant startedAt;
    private final List<Transition> transitions = new ArrayList<>();
    private final List<ErrorCode> errors = new ArrayList<>();
    private CallStatus status = CallStatus.ACTIVE;
    private Integer rating;
    private Instant endedAt;

    CallRecord(String contextId, String initialPersona, Instant startedAt) {
        this.contextId = contextId;
        this.initialPersona = initialPersona;
        this.startedAt = startedAt;
    }

    synchronized void addTransition(Transition transition) {
        transitions.add(transition);
    }

    synchronized void addError(ErrorCode code) {
        errors.add(code);
    }

    synchronized void end(CallStatus status, Integer rating, Instant endedAt) {
        this.status = status;
        this.rating = rating;
        this.endedAt = endedAt;
    }

    public String getContextId() {
        return contextId;
    }

    public String getInitialPersona() {
        return initialPersona;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized List<Transition> getTransitions() {
        return List.copyOf(transitions);
    }

    public synchronized List<ErrorCode> getErrors() {
        return List.copyOf(errors);
    }

    public synchronized CallStatus getStatus() {
        return status;
    }

    public synchronized Integer getRating() {
        return rating;
    }

    /**
     * Call duration, measured to now while the call is active.
     */
    public synchronized Duration getDuration() {
        return Duration.between(startedAt, endedAt == null ? Instant.now() : endedAt);
    }
}
