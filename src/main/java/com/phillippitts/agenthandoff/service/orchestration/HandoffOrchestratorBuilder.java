package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.config.properties.HandoffProperties;
import com.phillippitts.agenthandoff.service.analytics.AnalyticsPort;
import com.phillippitts.agenthandoff.service.persistence.PersistencePort;
import com.phillippitts.agenthandoff.service.requirements.RequirementClassifier;
import com.phillippitts.agenthandoff.service.session.SessionPort;
import com.phillippitts.agenthandoff.service.synthesis.SpecSynthesizer;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Builder for {@link HandoffOrchestrator}, which has too many collaborators for a readable
 * constructor.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * HandoffOrchestrator orchestrator = HandoffOrchestratorBuilder.builder()
 *     .contextId("room-42")
 *     .properties(props)
 *     .synthesizer(specBuilder)
 *     .sessionPort(sessionPort)
 *     .persistence(persistence)
 *     .analytics(analytics)
 *     .publisher(publisher)
 *     .synthesisExecutor(synthesisExecutor)
 *     .handoffExecutor(handoffExecutor)
 *     .scheduler(scheduler)
 *     .onTeardown(registry::release)
 *     .build();
 * }</pre>
 *
 * <p>Optional: {@code classifier} (defaults to a new {@link RequirementClassifier}),
 * {@code metrics} (defaults to {@link OrchestrationMetricsPublisher#NOOP}) and
 * {@code onTeardown} (defaults to a no-op).
 */
public final class HandoffOrchestratorBuilder {

    // Required dependencies
    private String contextId;
    private HandoffProperties properties;
    private SpecSynthesizer synthesizer;
    private SessionPort sessionPort;
    private PersistencePort persistence;
    private AnalyticsPort analytics;
    private ApplicationEventPublisher publisher;
    private AsyncTaskExecutor synthesisExecutor;
    private AsyncTaskExecutor handoffExecutor;
    private TaskScheduler scheduler;

    // Optional dependencies
    private RequirementClassifier classifier;
    private OrchestrationMetricsPublisher metrics;
    private Consumer<HandoffOrchestrator> onTeardown;

    private HandoffOrchestratorBuilder() {
        // use builder()
    }

    public static HandoffOrchestratorBuilder builder() {
        return new HandoffOrchestratorBuilder();
    }

    public HandoffOrchestratorBuilder contextId(String contextId) {
        this.contextId = contextId;
        return this;
    }

    public HandoffOrchestratorBuilder properties(HandoffProperties properties) {
        this.properties = properties;
        return this;
    }

    public HandoffOrchestratorBuilder synthesizer(SpecSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
        return this;
    }

    public HandoffOrchestratorBuilder sessionPort(SessionPort sessionPort) {
        this.sessionPort = sessionPort;
        return this;
    }

    public HandoffOrchestratorBuilder persistence(PersistencePort persistence) {
        this.persistence = persistence;
        return this;
    }

    public HandoffOrchestratorBuilder analytics(AnalyticsPort analytics) {
        this.analytics = analytics;
        return this;
    }

    public HandoffOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public HandoffOrchestratorBuilder synthesisExecutor(AsyncTaskExecutor synthesisExecutor) {
        this.synthesisExecutor = synthesisExecutor;
        return this;
    }

    public HandoffOrchestratorBuilder handoffExecutor(AsyncTaskExecutor handoffExecutor) {
        this.handoffExecutor = handoffExecutor;
        return this;
    }

    public HandoffOrchestratorBuilder scheduler(TaskScheduler scheduler) {
        this.scheduler = scheduler;
        return this;
    }

    public HandoffOrchestratorBuilder classifier(RequirementClassifier classifier) {
        this.classifier = classifier;
        return this;
    }

    public HandoffOrchestratorBuilder metrics(OrchestrationMetricsPublisher metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * Callback run once the context has been torn down after close.
     */
    public HandoffOrchestratorBuilder onTeardown(Consumer<HandoffOrchestrator> onTeardown) {
        this.onTeardown = onTeardown;
        return this;
    }

    /**
     * @throws NullPointerException if any required dependency is missing
     * @throws IllegalArgumentException if the context id is blank
     */
    public HandoffOrchestrator build() {
        Objects.requireNonNull(contextId, "contextId is required");
        if (contextId.isBlank()) {
            throw new IllegalArgumentException("contextId must not be blank");
        }
        Objects.requireNonNull(properties, "properties is required");
        Objects.requireNonNull(synthesizer, "synthesizer is required");
        Objects.requireNonNull(sessionPort, "sessionPort is required");
        Objects.requireNonNull(persistence, "persistence is required");
        Objects.requireNonNull(analytics, "analytics is required");
        Objects.requireNonNull(publisher, "publisher is required");
        Objects.requireNonNull(synthesisExecutor, "synthesisExecutor is required");
        Objects.requireNonNull(handoffExecutor, "handoffExecutor is required");
        Objects.requireNonNull(scheduler, "scheduler is required");
        if (classifier == null) {
            classifier = new RequirementClassifier();
        }
        if (metrics == null) {
            metrics = OrchestrationMetricsPublisher.NOOP;
        }
        if (onTeardown == null) {
            onTeardown = o -> { };
        }
        return new HandoffOrchestrator(this);
    }

    String contextId() {
        return contextId;
    }

    HandoffProperties properties() {
        return properties;
    }

    SpecSynthesizer synthesizer() {
        return synthesizer;
    }

    SessionPort sessionPort() {
        return sessionPort;
    }

    PersistencePort persistence() {
        return persistence;
    }

    AnalyticsPort analytics() {
        return analytics;
    }

    ApplicationEventPublisher publisher() {
        return publisher;
    }

    AsyncTaskExecutor synthesisExecutor() {
        return synthesisExecutor;
    }

    AsyncTaskExecutor handoffExecutor() {
        return handoffExecutor;
    }

    TaskScheduler scheduler() {
        return scheduler;
    }

    RequirementClassifier classifier() {
        return classifier;
    }

    OrchestrationMetricsPublisher metrics() {
        return metrics;
    }

    Consumer<HandoffOrchestrator> onTeardown() {
        return onTeardown;
    }
}
