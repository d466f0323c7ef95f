package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.domain.HandoffState;
import com.phillippitts.agenthandoff.domain.RequirementsSnapshot;

/**
 * Point-in-time view of one context.
 *
 * @param contextId         conversation context
 * @param state             current state
 * @param demoCompleted     a demo was handed back at least once
 * @param handoffInProgress a handoff protocol is running
 * @param livePersona       persona of the current session, null when none is live
 * @param agentType         stored spec's agent type, null before synthesis
 * @param savedAgentId      persistence id of the stored spec, null if never saved
 * @param requirements      requirements gathered so far
 */
public record ContextStatus(
        String contextId,
        HandoffState state,
        boolean demoCompleted,
        boolean handoffInProgress,
        String livePersona,
        String agentType,
        String savedAgentId,
        RequirementsSnapshot requirements
) {

    /**
     * True when the context should have a live session but has none: it is neither closed nor
     * mid-handoff.
     */
    public boolean isOrphaned() {
        return livePersona == null
                && !handoffInProgress
                && !state.isTerminal();
    }
}
