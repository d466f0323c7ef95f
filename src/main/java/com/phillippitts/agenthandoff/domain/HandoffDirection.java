package com.phillippitts.agenthandoff.domain;

/**
 * Direction of a persona handoff within one context.
 */
public enum HandoffDirection {
    /** Requirements-gathering creator hands the room to the synthesized task persona. */
    TO_TASK_AGENT("task-agent"),
    /** Task persona hands the room back to the creator. */
    TO_CREATOR("creator");

    private final String tag;

    HandoffDirection(String tag) {
        this.tag = tag;
    }

    /** Short lowercase label used in metrics tags and log lines. */
    public String tag() {
        return tag;
    }
}
