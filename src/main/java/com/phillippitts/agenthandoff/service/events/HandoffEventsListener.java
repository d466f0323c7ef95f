package com.phillippitts.agenthandoff.service.events;

import com.phillippitts.agenthandoff.service.orchestration.event.HandoffFailedEvent;
import com.phillippitts.agenthandoff.service.orchestration.event.StateTransitionEvent;
import com.phillippitts.agenthandoff.service.orchestration.event.SynthesisCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for orchestration failure events. Throttled per context and failure kind
 * so a flapping transport cannot flood the log.
 */
@Component
class HandoffEventsListener {
    private static final Logger LOG = LogManager.getLogger(HandoffEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onHandoffFailed(HandoffFailedEvent e) {
        String key = "handoff-" + e.contextId() + '-' + e.direction().tag();
        if (shouldLog(key)) {
            if (e.restored()) {
                LOG.warn("Handoff to {} failed for context {}; a live session remains. reason={}",
                        e.direction().tag(), e.contextId(), e.reason());
            } else {
                LOG.error("Handoff to {} failed for context {} and no session could be restored. reason={}",
                        e.direction().tag(), e.contextId(), e.reason());
            }
        }
    }

    @EventListener
    void onSynthesisCompleted(SynthesisCompletedEvent e) {
        if (e.isSuccess()) {
            LOG.debug("Synthesis for context {} produced '{}' in {} ms", e.contextId(), e.agentType(), e.durationMs());
            return;
        }
        String key = "synthesis-" + e.contextId() + '-' + e.outcome();
        if (shouldLog(key)) {
            LOG.warn("Synthesis {} for context {} after {} ms. Check the synthesizer and handoff.synthesis-timeout.",
                    e.outcome(), e.contextId(), e.durationMs());
        }
    }

    @EventListener
    void onStateTransition(StateTransitionEvent e) {
        LOG.debug("Context {}: {} -> {} ({})", e.contextId(), e.from(), e.to(), e.reason());
        if (e.to().isTerminal()) {
            lastLog.keySet().removeIf(k -> k.contains('-' + e.contextId() + '-'));
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
