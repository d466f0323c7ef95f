package com.phillippitts.agenthandoff.config;

import com.phillippitts.agenthandoff.config.properties.HandoffProperties;
import com.phillippitts.agenthandoff.service.analytics.AnalyticsPort;
import com.phillippitts.agenthandoff.service.analytics.LoggingAnalyticsAdapter;
import com.phillippitts.agenthandoff.service.orchestration.HandoffOrchestratorBuilder;
import com.phillippitts.agenthandoff.service.orchestration.OrchestrationMetricsPublisher;
import com.phillippitts.agenthandoff.service.orchestration.OrchestratorRegistry;
import com.phillippitts.agenthandoff.service.persistence.InMemoryPersistenceAdapter;
import com.phillippitts.agenthandoff.service.persistence.PersistencePort;
import com.phillippitts.agenthandoff.service.requirements.RequirementClassifier;
import com.phillippitts.agenthandoff.service.session.LoggingSessionPort;
import com.phillippitts.agenthandoff.service.session.SessionPort;
import com.phillippitts.agenthandoff.service.synthesis.SpecSynthesizer;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

/**
 * Wires the orchestrator registry and the default in-process adapters.
 *
 * <p>Each adapter backs off when the application declares its own {@link SessionPort},
 * {@link PersistencePort} or {@link AnalyticsPort} bean.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    @ConditionalOnMissingBean(SessionPort.class)
    public SessionPort sessionPort() {
        return new LoggingSessionPort();
    }

    @Bean
    @ConditionalOnMissingBean(PersistencePort.class)
    public PersistencePort persistencePort() {
        return new InMemoryPersistenceAdapter();
    }

    @Bean
    @ConditionalOnMissingBean(AnalyticsPort.class)
    public AnalyticsPort analyticsPort(MeterRegistry meterRegistry) {
        return new LoggingAnalyticsAdapter(meterRegistry);
    }

    /**
     * One orchestrator per context, built on demand with the shared collaborators.
     */
    @Bean
    public OrchestratorRegistry orchestratorRegistry(HandoffProperties properties,
                                                     SpecSynthesizer synthesizer,
                                                     RequirementClassifier classifier,
                                                     SessionPort sessionPort,
                                                     PersistencePort persistencePort,
                                                     AnalyticsPort analyticsPort,
                                                     ApplicationEventPublisher publisher,
                                                     OrchestrationMetricsPublisher metricsPublisher,
                                                     @Qualifier("synthesisExecutor") AsyncTaskExecutor synthesisExecutor,
                                                     @Qualifier("handoffExecutor") AsyncTaskExecutor handoffExecutor,
                                                     @Qualifier("handoffScheduler") TaskScheduler scheduler) {
        return new OrchestratorRegistry((contextId, onTeardown) -> HandoffOrchestratorBuilder.builder()
                .contextId(contextId)
                .properties(properties)
                .synthesizer(synthesizer)
                .classifier(classifier)
                .sessionPort(sessionPort)
                .persistence(persistencePort)
                .analytics(analyticsPort)
                .publisher(publisher)
                .metrics(metricsPublisher)
                .synthesisExecutor(synthesisExecutor)
                .handoffExecutor(handoffExecutor)
                .scheduler(scheduler)
                .onTeardown(onTeardown)
                .build());
    }
}
