package com.phillippitts.agenthandoff.domain;

import java.util.Objects;

/**
 * Named instruction set plus voice that drives one side of a live session.
 *
 * @param name         display name used in introductions and analytics
 * @param instructions full persona prompt
 * @param voice        voice identifier understood by the session transport
 */
public record Persona(String name, String instructions, String voice) {

    public Persona {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(instructions, "instructions must not be null");
        Objects.requireNonNull(voice, "voice must not be null");
    }

    /**
     * Derives the task persona from a synthesized specification.
     */
    public static Persona of(AgentSpec spec) {
        return new Persona(spec.agentType(), spec.instructions(), spec.voice());
    }
}
