package com.phillippitts.agenthandoff.service.persistence;

import com.phillippitts.agenthandoff.domain.AgentSpec;
import com.phillippitts.agenthandoff.domain.RequirementsSnapshot;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted agent configuration.
 *
 * @param id           persistence identifier
 * @param requirements requirements the spec was synthesized from
 * @param spec         synthesized specification
 * @param savedAt      save time
 */
public record SavedAgent(String id, RequirementsSnapshot requirements, AgentSpec spec, Instant savedAt) {

    public SavedAgent {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(requirements, "requirements must not be null");
        Objects.requireNonNull(spec, "spec must not be null");
    }
}
