package com.phillippitts.agenthandoff.service.analytics;

/**
 * Outcome recorded when a call ends.
 */
public enum CallStatus {
    ACTIVE,
    COMPLETED,
    FAILED
}
