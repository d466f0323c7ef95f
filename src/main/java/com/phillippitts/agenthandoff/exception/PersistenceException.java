package com.phillippitts.agenthandoff.exception;

/**
 * Thrown by a persistence adapter when saving or loading an agent configuration fails.
 * Always non-fatal for the conversation.
 */
public class PersistenceException extends AgentHandoffException {

    public PersistenceException(String message) {
        super(ErrorCode.PERSISTENCE_FAILED, message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILED, message, cause);
    }
}
