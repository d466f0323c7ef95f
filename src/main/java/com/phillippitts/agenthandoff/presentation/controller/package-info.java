/**
 * REST endpoints under {@code /api/contexts/{contextId}}, one per orchestrator operation.
 */
package com.phillippitts.agenthandoff.presentation.controller;
