package com.phillippitts.agenthandoff.exception;

/**
 * Thrown (or used to complete a future exceptionally) when deriving an agent specification
 * fails or exceeds the configured ceiling.
 */
public class SynthesisException extends AgentHandoffException {

    private final boolean timedOut;

    public SynthesisException(String message, Throwable cause) {
        super(ErrorCode.SYNTHESIS_FAILED, message, cause);
        this.timedOut = false;
    }

    private SynthesisException(String message, boolean timedOut) {
        super(timedOut ? ErrorCode.SYNTHESIS_TIMEOUT : ErrorCode.SYNTHESIS_FAILED, message);
        this.timedOut = timedOut;
    }

    public static SynthesisException timeout(long timeoutMs) {
        return new SynthesisException("Synthesis exceeded " + timeoutMs + " ms", true);
    }

    public static SynthesisException failed(String message) {
        return new SynthesisException(message, false);
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
