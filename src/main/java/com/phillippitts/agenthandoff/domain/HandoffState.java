package com.phillippitts.agenthandoff.domain;

/**
 * Lifecycle states of one conversation context.
 *
 * <pre>
 * GATHERING → CONFIRMING → PROCESSING → DEMO_READY → DEMO_ACTIVE → GATHERING (hand-back)
 * PROCESSING → GATHERING (synthesis failed or timed out)
 * any non-terminal → COMPLETED
 * </pre>
 */
public enum HandoffState {
    GATHERING,
    CONFIRMING,
    PROCESSING,
    DEMO_READY,
    DEMO_ACTIVE,
    COMPLETED;

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
