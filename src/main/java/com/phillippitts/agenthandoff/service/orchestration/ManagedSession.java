package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.service.session.SessionHandle;
import com.phillippitts.agenthandoff.service.session.SessionPort;
import com.phillippitts.agenthandoff.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A live session handle bound to its transport.
 *
 * <p>{@link #stop()} reaches the transport at most once no matter how many callers race on it.
 * {@link #speak(String)} never throws: a failed utterance is logged and reported as {@code false}.
 */
public final class ManagedSession {

    private static final Logger LOG = LogManager.getLogger(ManagedSession.class);

    private final SessionPort port;
    private final SessionHandle handle;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    ManagedSession(SessionPort port, SessionHandle handle) {
        this.port = Objects.requireNonNull(port, "port must not be null");
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
    }

    /**
     * @return true if the utterance was delivered
     */
    public boolean speak(String text) {
        if (stopped.get()) {
            LOG.debug("Dropping utterance for stopped session {}: '{}'", handle.id(), LogSanitizer.preview(text));
            return false;
        }
        try {
            port.speak(handle, text);
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Session {} failed to speak '{}': {}", handle.id(), LogSanitizer.preview(text), e.toString());
            return false;
        }
    }

    /**
     * Stops the session once; later calls are no-ops.
     *
     * @return true if this call stopped the session
     */
    public boolean stop() {
        if (!stopped.compareAndSet(false, true)) {
            return false;
        }
        try {
            port.stop(handle);
        } catch (RuntimeException e) {
            LOG.warn("Session {} failed to stop cleanly: {}", handle.id(), e.toString());
        }
        return true;
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public SessionHandle handle() {
        return handle;
    }

    public String personaName() {
        return handle.personaName();
    }
}
