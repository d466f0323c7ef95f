package com.phillippitts.agenthandoff.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for context lifecycles, synthesis and handoffs.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>State transitions, tagged {@code from} / {@code to}</li>
 *   <li>Synthesis outcomes ({@code success}, {@code failed}, {@code timeout}) and latency</li>
 *   <li>Handoffs by direction and outcome</li>
 *   <li>Filler utterances emitted while synthesizing</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class HandoffMetrics {

    private static final String METRIC_PREFIX = "agenthandoff";

    private final MeterRegistry registry;

    public HandoffMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String from, String to) {
        Counter.builder(METRIC_PREFIX + ".state.transitions")
                .description("Number of context state transitions")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    /**
     * Records one finished synthesis.
     *
     * @param outcome       success, failed or timeout
     * @param durationNanos time from finalize to completion
     */
    public void recordSynthesis(String outcome, long durationNanos) {
        Counter.builder(METRIC_PREFIX + ".synthesis")
                .description("Number of finished syntheses by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".synthesis.latency")
                .description("Time from finalize to synthesis completion")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param direction task-agent or creator
     * @param outcome   success or failure
     */
    public void recordHandoff(String direction, String outcome) {
        Counter.builder(METRIC_PREFIX + ".handoffs")
                .description("Number of persona handoffs")
                .tag("direction", direction)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementFillers() {
        Counter.builder(METRIC_PREFIX + ".engagement.fillers")
                .description("Filler utterances spoken while a synthesis was pending")
                .register(registry)
                .increment();
    }
}
