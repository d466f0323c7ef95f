package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.domain.HandoffDirection;
import com.phillippitts.agenthandoff.domain.HandoffState;
import com.phillippitts.agenthandoff.service.metrics.HandoffMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link HandoffMetrics} used by orchestrators.
 *
 * <p><b>Null Safety:</b> all methods are no-ops when constructed without metrics, so
 * orchestrators can run in unit tests without a meter registry.
 *
 * @see HandoffMetrics
 */
@Component
public final class OrchestrationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(OrchestrationMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and builder defaults.
     */
    public static final OrchestrationMetricsPublisher NOOP = new OrchestrationMetricsPublisher(null);

    private final HandoffMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public OrchestrationMetricsPublisher(HandoffMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("OrchestrationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordTransition(HandoffState from, HandoffState to) {
        if (metrics == null) {
            return;
        }
        metrics.recordTransition(from.name(), to.name());
    }

    public void recordSynthesis(String outcome, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordSynthesis(outcome, durationNanos);
    }

    public void recordHandoff(HandoffDirection direction, boolean success) {
        if (metrics == null) {
            return;
        }
        metrics.recordHandoff(direction.tag(), success ? "success" : "failure");
    }

    public void recordFiller() {
        if (metrics == null) {
            return;
        }
        metrics.incrementFillers();
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
