package com.phillippitts.agenthandoff.exception;

/**
 * Base exception for all agent-handoff application errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AgentHandoffException extends RuntimeException {

    private final ErrorCode errorCode;

    public AgentHandoffException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AgentHandoffException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
