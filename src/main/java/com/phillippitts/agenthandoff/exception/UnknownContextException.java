package com.phillippitts.agenthandoff.exception;

/**
 * Thrown at the HTTP boundary when no live orchestrator exists for a context key.
 */
public class UnknownContextException extends AgentHandoffException {

    private final String contextId;

    public UnknownContextException(String contextId) {
        super(ErrorCode.NOT_READY, "No active conversation context: " + contextId);
        this.contextId = contextId;
    }

    public String getContextId() {
        return contextId;
    }
}
