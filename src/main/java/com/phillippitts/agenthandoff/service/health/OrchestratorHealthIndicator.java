package com.phillippitts.agenthandoff.service.health;

import com.phillippitts.agenthandoff.domain.HandoffState;
import com.phillippitts.agenthandoff.service.orchestration.ContextStatus;
import com.phillippitts.agenthandoff.service.orchestration.OrchestratorRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for live conversation contexts.
 *
 * <ul>
 *   <li>UP: every open context has a live session (or is mid-handoff)</li>
 *   <li>DEGRADED: at least one open context lost its session and could not be restored</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health with per-state context counts.
 */
@Component
public class OrchestratorHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final OrchestratorRegistry registry;

    public OrchestratorHealthIndicator(OrchestratorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        Map<HandoffState, Integer> byState = new EnumMap<>(HandoffState.class);
        List<String> orphaned = new ArrayList<>();
        for (ContextStatus status : registry.statuses()) {
            byState.merge(status.state(), 1, Integer::sum);
            if (status.isOrphaned()) {
                orphaned.add(status.contextId());
            }
        }

        int total = byState.values().stream().mapToInt(Integer::intValue).sum();
        Health.Builder builder = orphaned.isEmpty() ? Health.up() : Health.status(DEGRADED);
        builder.withDetail("contexts", total)
                .withDetail("byState", byState);
        if (!orphaned.isEmpty()) {
            builder.withDetail("withoutLiveSession", orphaned);
        }
        return builder.build();
    }
}
