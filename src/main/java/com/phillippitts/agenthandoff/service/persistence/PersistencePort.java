package com.phillippitts.agenthandoff.service.persistence;

import com.phillippitts.agenthandoff.domain.AgentSpec;
import com.phillippitts.agenthandoff.domain.RequirementsSnapshot;

import java.util.Optional;

/**
 * Store for synthesized agent configurations. Failures are never fatal to a conversation.
 */
public interface PersistencePort {

    /**
     * @return identifier of the saved configuration
     * @throws com.phillippitts.agenthandoff.exception.PersistenceException if the save failed
     */
    String save(RequirementsSnapshot requirements, AgentSpec spec);

    /**
     * @return the saved configuration, empty when the id is unknown
     * @throws com.phillippitts.agenthandoff.exception.PersistenceException if the store is unreachable
     */
    Optional<SavedAgent> load(String id);
}
