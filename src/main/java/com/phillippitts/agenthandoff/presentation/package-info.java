/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters over
 * {@link com.phillippitts.agenthandoff.service.orchestration.OrchestratorRegistry}; orchestrator
 * rejections are ordinary response bodies, only unknown contexts and transport failures map to
 * error statuses.
 *
 * @see com.phillippitts.agenthandoff.presentation.controller
 * @see com.phillippitts.agenthandoff.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.agenthandoff.presentation;
