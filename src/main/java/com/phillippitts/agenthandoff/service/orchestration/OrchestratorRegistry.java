package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.exception.HandoffException;
import com.phillippitts.agenthandoff.exception.UnknownContextException;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Live orchestrators keyed by context id.
 *
 * <p>Each context gets its own {@link HandoffOrchestrator}; the registry only maps ids to them
 * and shares nothing else between contexts. An orchestrator is removed only by its own teardown,
 * after close and the grace delay, and never while it is in a non-terminal state.
 */
public class OrchestratorRegistry {

    private static final Logger LOG = LogManager.getLogger(OrchestratorRegistry.class);

    /**
     * Creates the orchestrator for a new context.
     */
    @FunctionalInterface
    public interface OrchestratorFactory {
        HandoffOrchestrator create(String contextId, Consumer<HandoffOrchestrator> onTeardown);
    }

    private final ConcurrentMap<String, HandoffOrchestrator> contexts = new ConcurrentHashMap<>();
    private final OrchestratorFactory factory;

    public OrchestratorRegistry(OrchestratorFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    /**
     * Creates the context if needed and starts its creator session. A closed context still
     * waiting for teardown is replaced by a fresh one.
     *
     * @throws HandoffException if the creator session cannot be started; the context is discarded
     */
    public ToolResponse open(String contextId) {
        HandoffOrchestrator orchestrator = contexts.compute(contextId, (id, existing) ->
                existing == null || existing.isTerminal() ? factory.create(id, this::release) : existing);
        try {
            return orchestrator.startSession();
        } catch (HandoffException e) {
            contexts.remove(contextId, orchestrator);
            throw e;
        }
    }

    public Optional<HandoffOrchestrator> find(String contextId) {
        return Optional.ofNullable(contexts.get(contextId));
    }

    /**
     * @throws UnknownContextException if no orchestrator exists for the id
     */
    public HandoffOrchestrator require(String contextId) {
        HandoffOrchestrator orchestrator = contexts.get(contextId);
        if (orchestrator == null) {
            throw new UnknownContextException(contextId);
        }
        return orchestrator;
    }

    /**
     * Teardown callback. Refuses to drop a context that is not terminal.
     */
    void release(HandoffOrchestrator orchestrator) {
        if (!orchestrator.isTerminal()) {
            LOG.warn("Refusing to release non-terminal context {} ({})",
                    orchestrator.contextId(), orchestrator.state());
            return;
        }
        if (contexts.remove(orchestrator.contextId(), orchestrator)) {
            LOG.info("Context {} released", orchestrator.contextId());
        }
    }

    public List<ContextStatus> statuses() {
        List<ContextStatus> out = new ArrayList<>(contexts.size());
        for (HandoffOrchestrator orchestrator : contexts.values()) {
            out.add(orchestrator.status());
        }
        return out;
    }

    public int size() {
        return contexts.size();
    }

    /**
     * Closes every open context on shutdown so analytics sees the calls end.
     */
    @PreDestroy
    public void shutdown() {
        for (HandoffOrchestrator orchestrator : contexts.values()) {
            if (!orchestrator.isTerminal()) {
                orchestrator.closeSession(null);
            }
        }
        LOG.info("Orchestrator registry shut down ({} contexts)", contexts.size());
    }
}
