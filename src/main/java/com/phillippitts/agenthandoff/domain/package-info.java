/**
 * Domain model of a conversation context.
 *
 * <p>{@link com.phillippitts.agenthandoff.domain.RequirementsStore} is the only mutable type and is
 * confined to its owning orchestrator. Everything that crosses a thread or port boundary is an
 * immutable record: {@link com.phillippitts.agenthandoff.domain.RequirementsSnapshot},
 * {@link com.phillippitts.agenthandoff.domain.AgentSpec} and
 * {@link com.phillippitts.agenthandoff.domain.Persona}.
 */
package com.phillippitts.agenthandoff.domain;
