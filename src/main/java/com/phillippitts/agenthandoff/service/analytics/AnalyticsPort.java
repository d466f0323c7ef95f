package com.phillippitts.agenthandoff.service.analytics;

import com.phillippitts.agenthandoff.exception.ErrorCode;

/**
 * Call bookkeeping. Every method is best-effort: the orchestrator logs and ignores
 * {@link com.phillippitts.agenthandoff.exception.AnalyticsException} and any other runtime failure.
 */
public interface AnalyticsPort {

    void startCall(String contextId, String initialPersona);

    /**
     * Records a persona or state change.
     *
     * @param from   previous persona or state
     * @param to     new persona or state
     * @param reason short machine-friendly reason, e.g. "demo-start"
     */
    void logTransition(String contextId, String from, String to, String reason);

    /**
     * Records a background failure such as a failed handoff.
     */
    void recordError(String contextId, ErrorCode code, String detail);

    /**
     * @param rating optional 1-5 user rating, may be null
     */
    void endCall(String contextId, CallStatus status, Integer rating);
}
