package com.phillippitts.agenthandoff.service.session;

import com.phillippitts.agenthandoff.domain.Persona;

/**
 * Live voice transport for one persona at a time per context.
 *
 * <p>The orchestrator guarantees it never starts a session for a context while another session of
 * that context is still live. Implementations must be safe to call from different threads for
 * different contexts.
 */
public interface SessionPort {

    /**
     * Starts a session driven by {@code persona} (its instructions and voice).
     *
     * @return handle of the live session
     * @throws com.phillippitts.agenthandoff.exception.SessionException if the session cannot start
     */
    SessionHandle start(String contextId, Persona persona);

    /**
     * Asks the session to speak. Failures are reported by exception; callers log and continue.
     *
     * @throws com.phillippitts.agenthandoff.exception.SessionException if the utterance was not delivered
     */
    void speak(SessionHandle handle, String text);

    /**
     * Stops the session. Stopping an already-stopped handle is a no-op and must not throw.
     */
    void stop(SessionHandle handle);
}
