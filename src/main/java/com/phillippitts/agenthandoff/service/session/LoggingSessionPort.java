package com.phillippitts.agenthandoff.service.session;

import com.phillippitts.agenthandoff.domain.Persona;
import com.phillippitts.agenthandoff.exception.SessionException;
import com.phillippitts.agenthandoff.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link SessionPort} used when no live voice transport is bound.
 *
 * <p>Utterances are written to the log as truncated previews. Live handles are tracked so that
 * stop is idempotent and speaking on a stopped handle fails like a real transport would.
 */
public class LoggingSessionPort implements SessionPort {

    private static final Logger LOG = LogManager.getLogger(LoggingSessionPort.class);

    private final Map<String, SessionHandle> live = new ConcurrentHashMap<>();
    private final AtomicLong teardowns = new AtomicLong();

    @Override
    public SessionHandle start(String contextId, Persona persona) {
        SessionHandle handle = new SessionHandle(UUID.randomUUID().toString(), contextId,
                persona.name(), Instant.now());
        live.put(handle.id(), handle);
        LOG.info("Session started: id={}, persona='{}', voice={}", handle.id(), persona.name(), persona.voice());
        return handle;
    }

    @Override
    public void speak(SessionHandle handle, String text) {
        if (!live.containsKey(handle.id())) {
            throw new SessionException("Session is not live: " + handle.id());
        }
        LOG.info("[{}] {}", handle.personaName(), LogSanitizer.preview(text));
    }

    @Override
    public void stop(SessionHandle handle) {
        if (live.remove(handle.id()) == null) {
            LOG.debug("Session {} already stopped", handle.id());
            return;
        }
        teardowns.incrementAndGet();
        LOG.info("Session stopped: id={}, persona='{}'", handle.id(), handle.personaName());
    }

    public boolean isLive(SessionHandle handle) {
        return live.containsKey(handle.id());
    }

    public int liveCount() {
        return live.size();
    }

    /**
     * Number of stops that actually tore a session down.
     */
    public long teardownCount() {
        return teardowns.get();
    }
}
