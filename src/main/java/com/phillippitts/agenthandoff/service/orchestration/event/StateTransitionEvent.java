package com.phillippitts.agenthandoff.service.orchestration.event;

import com.phillippitts.agenthandoff.domain.HandoffState;

import java.time.Instant;
import java.util.Objects;

/**
 * Published after a context's state changed.
 *
 * @param contextId conversation context
 * @param from      previous state
 * @param to        new state
 * @param reason    short reason tag, e.g. "finalize" or "synthesis-timeout"
 * @param timestamp when the transition was committed
 */
public record StateTransitionEvent(String contextId, HandoffState from, HandoffState to,
                                   String reason, Instant timestamp) {

    public StateTransitionEvent {
        Objects.requireNonNull(contextId, "contextId must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
