package com.phillippitts.agenthandoff.service.persistence;

import com.phillippitts.agenthandoff.domain.AgentSpec;
import com.phillippitts.agenthandoff.domain.RequirementsSnapshot;
import com.phillippitts.agenthandoff.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link PersistencePort}; configurations live as long as the application.
 */
public class InMemoryPersistenceAdapter implements PersistencePort {

    private static final Logger LOG = LogManager.getLogger(InMemoryPersistenceAdapter.class);

    private final Map<String, SavedAgent> agents = new ConcurrentHashMap<>();

    @Override
    public String save(RequirementsSnapshot requirements, AgentSpec spec) {
        if (requirements == null || spec == null) {
            throw new PersistenceException("Nothing to save: requirements and spec are required");
        }
        String id = UUID.randomUUID().toString();
        agents.put(id, new SavedAgent(id, requirements, spec, Instant.now()));
        LOG.info("Saved agent configuration id={}, agentType='{}'", id, spec.agentType());
        return id;
    }

    @Override
    public Optional<SavedAgent> load(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(agents.get(id.trim()));
    }

    public int size() {
        return agents.size();
    }
}
