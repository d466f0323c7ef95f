package com.phillippitts.agenthandoff.exception;

import com.phillippitts.agenthandoff.domain.HandoffDirection;

/**
 * Thrown when a handoff cannot construct or start the destination persona.
 * Create instances through {@link HandoffExceptionBuilder}.
 */
public class HandoffException extends AgentHandoffException {

    private final HandoffDirection direction;
    private final String personaName;

    HandoffException(String message, HandoffDirection direction, String personaName, Throwable cause) {
        super(ErrorCode.HANDOFF_FAILED, message, cause);
        this.direction = direction;
        this.personaName = personaName;
    }

    public HandoffDirection getDirection() {
        return direction;
    }

    public String getPersonaName() {
        return personaName;
    }
}
