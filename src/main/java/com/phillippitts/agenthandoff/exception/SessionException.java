package com.phillippitts.agenthandoff.exception;

/**
 * Thrown by a session transport when a persona session cannot be started or addressed.
 */
public class SessionException extends AgentHandoffException {

    public SessionException(String message) {
        super(ErrorCode.HANDOFF_FAILED, message);
    }

    public SessionException(String message, Throwable cause) {
        super(ErrorCode.HANDOFF_FAILED, message, cause);
    }
}
