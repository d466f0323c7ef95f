package com.phillippitts.agenthandoff.presentation.exception;

import com.phillippitts.agenthandoff.exception.AgentHandoffException;
import com.phillippitts.agenthandoff.exception.UnknownContextException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * User-facing orchestrator rejections never reach this class; they travel as tool responses.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - the context was never opened or was already torn down (HTTP 404).
     */
    @ExceptionHandler(UnknownContextException.class)
    ResponseEntity<ApiError> handleUnknownContext(UnknownContextException ex) {
        LOG.warn("Unknown context: {}", ex.getContextId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getErrorCode().name(),
                "Conversation context not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid request body (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidRequest(MethodArgumentNotValidException ex) {
        LOG.warn("Invalid request: {} field error(s)", ex.getBindingResult().getErrorCount());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidRequest",
                "Request validation failed",
                ex.getBindingResult().getFieldErrors().stream()
                    .map(e -> e.getField() + " " + e.getDefaultMessage())
                    .findFirst()
                    .orElse("Invalid request body"),
                Instant.now()
            ));
    }

    /**
     * Transient error - session transport or synthesis unavailable, retry possible (HTTP 503).
     */
    @ExceptionHandler(AgentHandoffException.class)
    ResponseEntity<ApiError> handleHandoffFailure(AgentHandoffException ex) {
        LOG.error("Orchestration failed: code={}", ex.getErrorCode(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getErrorCode().name(),
                "Voice session temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
