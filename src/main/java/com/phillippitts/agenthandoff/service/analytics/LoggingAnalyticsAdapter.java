package com.phillippitts.agenthandoff.service.analytics;

import com.phillippitts.agenthandoff.exception.AnalyticsException;
import com.phillippitts.agenthandoff.exception.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link AnalyticsPort} that keeps a {@link CallRecord} per context, logs every event
 * and counts ended calls by status in Micrometer ({@code handoff.calls.ended}).
 */
public class LoggingAnalyticsAdapter implements AnalyticsPort {

    private static final Logger LOG = LogManager.getLogger(LoggingAnalyticsAdapter.class);

    private final Map<String, CallRecord> calls = new ConcurrentHashMap<>();
    private final MeterRegistry registry;

    public LoggingAnalyticsAdapter(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public void startCall(String contextId, String initialPersona) {
        calls.put(contextId, new CallRecord(contextId, initialPersona, Instant.now()));
        LOG.info("Call started: contextId={}, persona='{}'", contextId, initialPersona);
    }

    @Override
    public void logTransition(String contextId, String from, String to, String reason) {
        record(contextId).addTransition(new CallRecord.Transition(Instant.now(), from, to, reason));
        LOG.info("Call transition: contextId={}, {} -> {} ({})", contextId, from, to, reason);
    }

    @Override
    public void recordError(String contextId, ErrorCode code, String detail) {
        record(contextId).addError(code);
        LOG.warn("Call error: contextId={}, code={}, detail={}", contextId, code, detail);
    }

    @Override
    public void endCall(String contextId, CallStatus status, Integer rating) {
        if (rating != null && (rating < 1 || rating > 5)) {
            throw new AnalyticsException("Rating must be between 1 and 5, got " + rating);
        }
        CallRecord call = record(contextId);
        call.end(status, rating, Instant.now());
        Counter.builder("handoff.calls.ended")
                .tag("status", status.name().toLowerCase())
                .description("Calls ended by final status")
                .register(registry)
                .increment();
        LOG.info("Call ended: contextId={}, status={}, rating={}, duration={}ms",
                contextId, status, rating, call.getDuration().toMillis());
    }

    public Optional<CallRecord> find(String contextId) {
        return Optional.ofNullable(calls.get(contextId));
    }

    private CallRecord record(String contextId) {
        CallRecord call = calls.get(contextId);
        if (call == null) {
            throw new AnalyticsException("No call started for context " + contextId);
        }
        return call;
    }
}
