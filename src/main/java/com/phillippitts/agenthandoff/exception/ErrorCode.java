package com.phillippitts.agenthandoff.exception;

/**
 * Error taxonomy shared by tool responses, exceptions and analytics.
 */
public enum ErrorCode {
    /** Requirements cannot change while synthesis is running. */
    LOCKED(true),
    /** Business name or type missing, too short, or filler. */
    INCOMPLETE_REQUIREMENTS(true),
    /** Finalize attempted without a prior confirmation. */
    NOT_CONFIRMED(true),
    /** Finalize raced with a synthesis already in flight. */
    ALREADY_PROCESSING(true),
    /** Demo or hand-back requested from the wrong state. */
    NOT_READY(true),
    SYNTHESIS_FAILED(false),
    SYNTHESIS_TIMEOUT(false),
    HANDOFF_FAILED(false),
    /** Non-fatal: the configuration was not saved. */
    PERSISTENCE_FAILED(false),
    /** Non-fatal: call bookkeeping was lost. */
    ANALYTICS_FAILED(false);

    private final boolean userFacing;

    ErrorCode(boolean userFacing) {
        this.userFacing = userFacing;
    }

    /**
     * User-facing codes are relayed conversationally by the live persona and never surface
     * as exceptions.
     */
    public boolean isUserFacing() {
        return userFacing;
    }
}
