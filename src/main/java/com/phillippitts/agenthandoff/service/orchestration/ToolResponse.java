package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.exception.ErrorCode;

import java.util.Objects;

/**
 * Result of a tool-facing orchestrator operation.
 *
 * <p>Rejections carry a user-facing {@link ErrorCode} and an advisory message the live persona
 * relays conversationally; they are never thrown.
 *
 * @param accepted  true when the operation took effect
 * @param errorCode rejection reason, null when accepted
 * @param message   advisory text for the live persona
 */
public record ToolResponse(boolean accepted, ErrorCode errorCode, String message) {

    public ToolResponse {
        Objects.requireNonNull(message, "message must not be null");
        if (accepted && errorCode != null) {
            throw new IllegalArgumentException("Accepted response cannot carry an error code");
        }
        if (!accepted && errorCode == null) {
            throw new IllegalArgumentException("Rejected response requires an error code");
        }
    }

    public static ToolResponse ok(String message) {
        return new ToolResponse(true, null, message);
    }

    public static ToolResponse rejected(ErrorCode errorCode, String message) {
        return new ToolResponse(false, errorCode, message);
    }
}
