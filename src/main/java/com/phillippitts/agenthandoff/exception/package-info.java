/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.agenthandoff.exception.AgentHandoffException} - base for all
 *       application errors, carries an {@link com.phillippitts.agenthandoff.exception.ErrorCode}</li>
 *   <li>{@link com.phillippitts.agenthandoff.exception.SynthesisException} - spec synthesis failed
 *       or hit the ceiling</li>
 *   <li>{@link com.phillippitts.agenthandoff.exception.HandoffException} - destination persona could
 *       not be constructed or started</li>
 *   <li>{@link com.phillippitts.agenthandoff.exception.SessionException} - session transport error</li>
 *   <li>{@link com.phillippitts.agenthandoff.exception.PersistenceException} and
 *       {@link com.phillippitts.agenthandoff.exception.AnalyticsException} - non-fatal port errors</li>
 *   <li>{@link com.phillippitts.agenthandoff.exception.UnknownContextException} - HTTP boundary only</li>
 * </ul>
 *
 * <p>User-facing codes ({@code LOCKED}, {@code INCOMPLETE_REQUIREMENTS}, {@code NOT_CONFIRMED},
 * {@code ALREADY_PROCESSING}, {@code NOT_READY}) are never thrown by the orchestrator; they travel
 * inside a {@code ToolResponse} for the live persona to relay.
 *
 * @see com.phillippitts.agenthandoff.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.agenthandoff.exception;
