package com.phillippitts.agenthandoff.exception;

/**
 * Thrown by an analytics adapter when call bookkeeping cannot be recorded.
 * Always non-fatal for the conversation.
 */
public class AnalyticsException extends AgentHandoffException {

    public AnalyticsException(String message) {
        super(ErrorCode.ANALYTICS_FAILED, message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(ErrorCode.ANALYTICS_FAILED, message, cause);
    }
}
