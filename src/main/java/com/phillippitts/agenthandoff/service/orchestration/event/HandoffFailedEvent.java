package com.phillippitts.agenthandoff.service.orchestration.event;

import com.phillippitts.agenthandoff.domain.HandoffDirection;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when a handoff could not construct or start its destination persona.
 *
 * @param contextId conversation context
 * @param direction attempted direction
 * @param reason    failure detail
 * @param restored  true when a live session remained or was restored afterwards
 * @param timestamp failure time
 */
public record HandoffFailedEvent(String contextId, HandoffDirection direction, String reason,
                                 boolean restored, Instant timestamp) {

    public HandoffFailedEvent {
        Objects.requireNonNull(contextId, "contextId must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }
}
