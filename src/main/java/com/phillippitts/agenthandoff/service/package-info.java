/**
 * Service layer containing the orchestration logic and its ports.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.orchestration} - per-context state machine, synthesis task, engagement
 *       loop and the persona handoff protocol</li>
 *   <li>{@code service.requirements} - classification of spoken requirement keys</li>
 *   <li>{@code service.synthesis} - category table and the table-driven spec builder</li>
 *   <li>{@code service.session}, {@code service.persistence}, {@code service.analytics} - ports
 *       to the voice transport, configuration store and call bookkeeping, with in-process
 *       default adapters</li>
 *   <li>{@code service.events}, {@code service.metrics}, {@code service.health} - logging,
 *       Micrometer and actuator views of the orchestration</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services depend on domain models, not the presentation layer</li>
 *   <li>Contexts share only executors and stateless collaborators, never mutable state</li>
 *   <li>Services use constructor injection</li>
 * </ul>
 */
package com.phillippitts.agenthandoff.service;
