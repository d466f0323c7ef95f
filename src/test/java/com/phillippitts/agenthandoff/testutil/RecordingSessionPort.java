package com.phillippitts.agenthandoff.testutil;

import com.phillippitts.agenthandoff.domain.Persona;
import com.phillippitts.agenthandoff.exception.SessionException;
import com.phillippitts.agenthandoff.service.session.SessionHandle;
import com.phillippitts.agenthandoff.service.session.SessionPort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fake session transport that records every start, utterance and stop.
 *
 * <p>Tracks live sessions per context so tests can assert that at most one persona is ever live
 * in a context. Starts can be made to fail for a given persona name.
 */
public class RecordingSessionPort implements SessionPort {

    /** One spoken line. */
    public record Utterance(String sessionId, String personaName, String text) {}

    private final List<Persona> started = new CopyOnWriteArrayList<>();
    private final List<Utterance> utterances = new CopyOnWriteArrayList<>();
    private final Set<String> live = ConcurrentHashMap.newKeySet();
    private final Set<String> failingPersonas = ConcurrentHashMap.newKeySet();
    private final AtomicInteger stops = new AtomicInteger();
    private final AtomicInteger idSequence = new AtomicInteger();
    private final AtomicInteger maxLive = new AtomicInteger();
    private volatile boolean failAllStarts;

    @Override
    public SessionHandle start(String contextId, Persona persona) {
        if (failAllStarts || failingPersonas.contains(persona.name())) {
            throw new SessionException("Simulated start failure for " + persona.name());
        }
        started.add(persona);
        String id = "session-" + idSequence.incrementAndGet();
        live.add(id);
        maxLive.accumulateAndGet(live.size(), Math::max);
        return new SessionHandle(id, contextId, persona.name(), Instant.now());
    }

    @Override
    public void speak(SessionHandle handle, String text) {
        if (!live.contains(handle.id())) {
            throw new SessionException("Session is not live: " + handle.id());
        }
        utterances.add(new Utterance(handle.id(), handle.personaName(), text));
    }

    @Override
    public void stop(SessionHandle handle) {
        if (live.remove(handle.id())) {
            stops.incrementAndGet();
        }
    }

    public void failStartsFor(String personaName) {
        failingPersonas.add(personaName);
    }

    public void failAllStarts(boolean fail) {
        this.failAllStarts = fail;
    }

    public List<Persona> startedPersonas() {
        return new ArrayList<>(started);
    }

    public List<Utterance> utterances() {
        return new ArrayList<>(utterances);
    }

    public List<String> textsSpokenBy(String personaName) {
        return utterances.stream()
                .filter(u -> u.personaName().equals(personaName))
                .map(Utterance::text)
                .toList();
    }

    public boolean anySpoken(String text) {
        return utterances.stream().anyMatch(u -> u.text().equals(text));
    }

    public int liveCount() {
        return live.size();
    }

    /**
     * Highest number of simultaneously live sessions seen so far.
     */
    public int maxLiveCount() {
        return maxLive.get();
    }

    public int stopCount() {
        return stops.get();
    }
}
