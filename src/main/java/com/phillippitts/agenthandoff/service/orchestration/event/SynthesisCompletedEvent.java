package com.phillippitts.agenthandoff.service.orchestration.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when a synthesis finishes, whatever the outcome. Not published for a synthesis
 * cancelled by closing its context.
 *
 * @param contextId  conversation context
 * @param outcome    success, failed or timeout
 * @param agentType  synthesized agent type, null unless successful
 * @param durationMs time from finalize to completion
 * @param timestamp  completion time
 */
public record SynthesisCompletedEvent(String contextId, String outcome, String agentType,
                                      long durationMs, Instant timestamp) {

    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";
    public static final String TIMEOUT = "timeout";

    public SynthesisCompletedEvent {
        Objects.requireNonNull(contextId, "contextId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public boolean isSuccess() {
        return SUCCESS.equals(outcome);
    }
}
