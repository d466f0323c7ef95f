package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.domain.HandoffDirection;
import com.phillippitts.agenthandoff.domain.Persona;
import com.phillippitts.agenthandoff.exception.HandoffException;
import com.phillippitts.agenthandoff.exception.HandoffExceptionBuilder;
import com.phillippitts.agenthandoff.service.session.SessionHandle;
import com.phillippitts.agenthandoff.service.session.SessionPort;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Symmetric persona handoff within one context, used in both directions.
 *
 * <p>Steps, executed sequentially on the calling thread:
 * <ol>
 *   <li>construct the destination persona; a failure here leaves the current session untouched</li>
 *   <li>current session (if any) speaks the farewell, then after the farewell delay is stopped
 *       and cleared</li>
 *   <li>start the destination session</li>
 *   <li>after the settle delay the new session speaks its introduction</li>
 *   <li>install the new session as current</li>
 * </ol>
 *
 * <p>Holds no lock: callers serialize handoffs per context; different contexts run concurrently.
 */
final class HandoffProtocol {

    private static final Logger LOG = LogManager.getLogger(HandoffProtocol.class);

    private final SessionPort sessionPort;
    private final Duration farewellDelay;
    private final Duration settleDelay;

    HandoffProtocol(SessionPort sessionPort, Duration farewellDelay, Duration settleDelay) {
        this.sessionPort = Objects.requireNonNull(sessionPort, "sessionPort must not be null");
        this.farewellDelay = Objects.requireNonNull(farewellDelay, "farewellDelay must not be null");
        this.settleDelay = Objects.requireNonNull(settleDelay, "settleDelay must not be null");
    }

    /**
     * Runs the full protocol.
     *
     * @param destination  builds the destination persona
     * @param farewell     spoken by the current session before it stops
     * @param introduction spoken by the new session once it settled
     * @return the new current session
     * @throws HandoffException if the destination cannot be constructed or started
     */
    ManagedSession execute(String contextId, HandoffDirection direction, SessionSlot slot,
                           Supplier<Persona> destination, String farewell, String introduction) {
        Persona persona;
        try {
            persona = destination.get();
        } catch (RuntimeException e) {
            throw HandoffExceptionBuilder.create("Destination persona could not be constructed")
                    .direction(direction)
                    .contextId(contextId)
                    .cause(e)
                    .build();
        }

        ManagedSession previous = slot.current();
        if (previous != null) {
            LOG.info("Handoff {}: '{}' -> '{}'", direction.tag(), previous.personaName(), persona.name());
            previous.speak(farewell);
            pause(farewellDelay, contextId, direction, persona);
            slot.release(previous);
            previous.stop();
        }

        ManagedSession next = start(contextId, direction, persona);
        try {
            pause(settleDelay, contextId, direction, persona);
        } catch (HandoffException e) {
            next.stop();
            throw e;
        }
        next.speak(introduction);
        install(slot, next, contextId, direction);
        return next;
    }

    /**
     * Starts a persona into an empty slot and has it speak once, without farewell or settle delay.
     * Used for the opening greeting and to restore the creator after a failed handoff.
     *
     * @throws HandoffException if the session cannot be started or the slot is occupied
     */
    ManagedSession open(String contextId, HandoffDirection direction, SessionSlot slot,
                        Persona persona, String utterance) {
        ManagedSession session = start(contextId, direction, persona);
        session.speak(utterance);
        install(slot, session, contextId, direction);
        return session;
    }

    private ManagedSession start(String contextId, HandoffDirection direction, Persona persona) {
        try {
            SessionHandle handle = sessionPort.start(contextId, persona);
            if (handle == null) {
                throw new IllegalStateException("Session transport returned no handle");
            }
            return new ManagedSession(sessionPort, handle);
        } catch (RuntimeException e) {
            throw HandoffExceptionBuilder.create("Destination session could not be started")
                    .direction(direction)
                    .persona(persona.name())
                    .contextId(contextId)
                    .metadata("voice", persona.voice())
                    .cause(e)
                    .build();
        }
    }

    private static void install(SessionSlot slot, ManagedSession session, String contextId,
                                HandoffDirection direction) {
        if (!slot.install(session)) {
            session.stop();
            throw HandoffExceptionBuilder.create("Another session is already current")
                    .direction(direction)
                    .persona(session.personaName())
                    .contextId(contextId)
                    .build();
        }
    }

    private static void pause(Duration delay, String contextId, HandoffDirection direction, Persona persona) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw HandoffExceptionBuilder.create("Handoff interrupted")
                    .direction(direction)
                    .persona(persona.name())
                    .contextId(contextId)
                    .cause(e)
                    .build();
        }
    }
}
