package com.phillippitts.agenthandoff.service.synthesis;

import com.phillippitts.agenthandoff.domain.AgentSpec;
import com.phillippitts.agenthandoff.domain.RequirementsSnapshot;

/**
 * Derives a task persona specification from a requirements snapshot.
 *
 * <p>Invoked on the synthesis executor; implementations may block and should respond to
 * interruption, which is how a cancelled or timed-out synthesis is torn down.
 */
@FunctionalInterface
public interface SpecSynthesizer {

    /**
     * @param snapshot immutable requirements
     * @return a new specification, never null
     * @throws com.phillippitts.agenthandoff.exception.SynthesisException if no specification can be derived
     */
    AgentSpec synthesize(RequirementsSnapshot snapshot);
}
