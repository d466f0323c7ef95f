package com.phillippitts.agenthandoff.presentation.controller;

import com.phillippitts.agenthandoff.service.orchestration.ContextStatus;
import com.phillippitts.agenthandoff.service.orchestration.HandoffOrchestrator;
import com.phillippitts.agenthandoff.service.orchestration.OrchestratorRegistry;
import com.phillippitts.agenthandoff.service.orchestration.ToolResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP binding of the orchestrator operations, for transports that relay tool calls over REST.
 *
 * <p>Every tool operation answers 200 with a {@link ToolResponse}; rejections are part of the
 * body, not the status. Unknown contexts answer 404.
 */
@RestController
@RequestMapping("/api/contexts/{contextId}")
class ConversationController {

    private static final Logger LOG = LogManager.getLogger(ConversationController.class);

    private final OrchestratorRegistry registry;

    ConversationController(OrchestratorRegistry registry) {
        this.registry = registry;
    }

    @PostMapping
    ResponseEntity<ToolResponse> start(@PathVariable String contextId) {
        LOG.info("Opening context {}", contextId);
        return ResponseEntity.ok(registry.open(contextId));
    }

    @GetMapping
    ResponseEntity<ContextStatus> status(@PathVariable String contextId) {
        return ResponseEntity.ok(orchestrator(contextId).status());
    }

    @PostMapping("/requirements")
    ResponseEntity<ToolResponse> storeRequirement(@PathVariable String contextId,
                                                  @RequestBody RequirementRequest request) {
        return ResponseEntity.ok(orchestrator(contextId).storeRequirement(request.field(), request.value()));
    }

    @GetMapping("/requirements/status")
    ResponseEntity<ToolResponse> requirementsStatus(@PathVariable String contextId) {
        return ResponseEntity.ok(orchestrator(contextId).checkRequirementsStatus());
    }

    @GetMapping("/requirements/summary")
    ResponseEntity<ToolResponse> requirementsSummary(@PathVariable String contextId) {
        return ResponseEntity.ok(orchestrator(contextId).showRequirementsSummary());
    }

    @PostMapping("/confirm")
    ResponseEntity<ToolResponse> confirm(@PathVariable String contextId) {
        return ResponseEntity.ok(orchestrator(contextId).confirmRequirements());
    }

    @PostMapping("/finalize")
    ResponseEntity<ToolResponse> finalizeRequirements(@PathVariable String contextId) {
        return ResponseEntity.ok(orchestrator(contextId).finalizeRequirements());
    }

    @GetMapping("/processing")
    ResponseEntity<ToolResponse> processingStatus(@PathVariable String contextId) {
        return ResponseEntity.ok(orchestrator(contextId).checkProcessingStatus());
    }

    @GetMapping("/demo/preference")
    ResponseEntity<ToolResponse> demoPreference(@PathVariable String contextId) {
        return ResponseEntity.ok(orchestrator(contextId).askDemoPreference());
    }

    @PostMapping("/demo")
    ResponseEntity<ToolResponse> startDemo(@PathVariable String contextId) {
        return ResponseEntity.ok(orchestrator(contextId).startDemo());
    }

    @PostMapping("/demo/retry")
    ResponseEntity<ToolResponse> tryDemoAgain(@PathVariable String contextId) {
        return ResponseEntity.ok(orchestrator(contextId).tryDemoAgain());
    }

    @PostMapping("/handback")
    ResponseEntity<ToolResponse> handBack(@PathVariable String contextId) {
        return ResponseEntity.ok(orchestrator(contextId).handoffBackToCreator());
    }

    @PostMapping("/load/{agentId}")
    ResponseEntity<ToolResponse> loadSavedAgent(@PathVariable String contextId, @PathVariable String agentId) {
        return ResponseEntity.ok(orchestrator(contextId).loadSavedAgent(agentId));
    }

    @PostMapping("/close")
    ResponseEntity<ToolResponse> close(@PathVariable String contextId,
                                       @Valid @RequestBody(required = false) CloseRequest request) {
        Integer rating = request == null ? null : request.rating();
        return ResponseEntity.ok(orchestrator(contextId).closeSession(rating));
    }

    private HandoffOrchestrator orchestrator(String contextId) {
        return registry.require(contextId);
    }

    record RequirementRequest(String field, String value) {}

    record CloseRequest(@Min(1) @Max(5) Integer rating) {}
}
