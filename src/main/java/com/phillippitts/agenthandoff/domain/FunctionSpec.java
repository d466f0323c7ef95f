package com.phillippitts.agenthandoff.domain;

import java.util.List;
import java.util.Objects;

/**
 * A callable capability advertised by a synthesized task persona.
 *
 * @param name        function identifier, e.g. {@code take_reservation}
 * @param description one-line description shown to the model
 * @param parameters  parameter names in call order
 */
public record FunctionSpec(String name, String description, List<String> parameters) {

    public FunctionSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(description, "description must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
