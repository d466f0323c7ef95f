package com.phillippitts.agenthandoff.service.session;

import java.time.Instant;
import java.util.Objects;

/**
 * Opaque reference to a live persona session returned by {@link SessionPort#start}.
 *
 * @param id          transport-assigned identifier
 * @param contextId   conversation context the session belongs to
 * @param personaName persona driving the session
 * @param startedAt   start time
 */
public record SessionHandle(String id, String contextId, String personaName, Instant startedAt) {

    public SessionHandle {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(contextId, "contextId must not be null");
    }
}
