package com.phillippitts.agenthandoff.exception;

import com.phillippitts.agenthandoff.domain.HandoffDirection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link HandoffException} with contextual details in the message.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw HandoffExceptionBuilder.create("Session start failed")
 *         .direction(HandoffDirection.TO_TASK_AGENT)
 *         .persona(persona.name())
 *         .contextId(contextId)
 *         .metadata("voice", persona.voice())
 *         .cause(e)
 *         .build();
 * </pre>
 *
 * <p>The final message format is
 * {@code {message} (direction={tag}, persona={name}, contextId={id}, {key}={value}, ...)}.
 */
public final class HandoffExceptionBuilder {

    private final String message;
    private HandoffDirection direction;
    private String personaName;
    private String contextId;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private HandoffExceptionBuilder(String message) {
        this.message = message;
    }

    public static HandoffExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new HandoffExceptionBuilder(message);
    }

    public HandoffExceptionBuilder direction(HandoffDirection direction) {
        this.direction = direction;
        return this;
    }

    public HandoffExceptionBuilder persona(String personaName) {
        this.personaName = personaName;
        return this;
    }

    public HandoffExceptionBuilder contextId(String contextId) {
        this.contextId = contextId;
        return this;
    }

    public HandoffExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a key-value pair to the message; null keys or values are ignored.
     */
    public HandoffExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public HandoffException build() {
        return new HandoffException(buildDetailedMessage(), direction, personaName, cause);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (direction != null) {
            details.put("direction", direction.tag());
        }
        if (personaName != null) {
            details.put("persona", personaName);
        }
        if (contextId != null) {
            details.put("contextId", contextId);
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
