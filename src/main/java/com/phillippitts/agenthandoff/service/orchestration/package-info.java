/**
 * Per-context orchestration of requirements gathering, spec synthesis and persona handoffs.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.agenthandoff.service.orchestration.HandoffOrchestrator} - state
 *       machine for one conversation context; every tool operation answers with a
 *       {@link com.phillippitts.agenthandoff.service.orchestration.ToolResponse}</li>
 *   <li>{@link com.phillippitts.agenthandoff.service.orchestration.OrchestratorRegistry} - maps
 *       context keys to orchestrators and releases them after teardown</li>
 *   <li>{@link com.phillippitts.agenthandoff.service.orchestration.SynthesisTask} - background
 *       synthesis with a ceiling and an engagement loop in one cancellation scope</li>
 *   <li>{@link com.phillippitts.agenthandoff.service.orchestration.HandoffProtocol} - farewell,
 *       stop, start, settle, introduce; used in both directions</li>
 * </ul>
 *
 * <p>Threading:
 * <ul>
 *   <li>The context lock guards state checks and assignments only; session I/O and protocol
 *       delays run on the handoff executor without it</li>
 *   <li>At most one handoff per context runs at a time; different contexts never wait on each
 *       other</li>
 *   <li>Log lines carry the {@code contextId} MDC key on every thread</li>
 * </ul>
 *
 * @see com.phillippitts.agenthandoff.config.ThreadPoolConfig
 */
package com.phillippitts.agenthandoff.service.orchestration;
