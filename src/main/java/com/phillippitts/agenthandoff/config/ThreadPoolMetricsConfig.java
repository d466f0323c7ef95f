package com.phillippitts.agenthandoff.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes synthesis and handoff pool metrics via Micrometer.
 *
 * <p>For each pool ({@code synthesis}, {@code handoff}):
 * <ul>
 *   <li>{@code <pool>.pool.size} - current number of threads</li>
 *   <li>{@code <pool>.pool.active} - threads actively executing tasks</li>
 *   <li>{@code <pool>.pool.queued} - tasks waiting in the queue</li>
 *   <li>{@code <pool>.pool.completed} - cumulative completed tasks</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> synthesisExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> handoffExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("synthesisExecutor") ObjectProvider<ThreadPoolTaskExecutor> synthesisExecutorProvider,
            @Qualifier("handoffExecutor") ObjectProvider<ThreadPoolTaskExecutor> handoffExecutorProvider) {
        this.synthesisExecutorProvider = synthesisExecutorProvider;
        this.handoffExecutorProvider = handoffExecutorProvider;
    }

    @Bean
    public MeterBinder handoffPoolMetrics() {
        return registry -> {
            bind(registry, "synthesis", synthesisExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "handoff", handoffExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: synthesis.pool.*, handoff.pool.*");
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder(pool + ".pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the " + pool + " pool")
                .register(registry);
        Gauge.builder(pool + ".pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Threads actively executing " + pool + " tasks")
                .register(registry);
        Gauge.builder(pool + ".pool.queued", executor, e -> e.getQueue().size())
                .description("Tasks waiting in the " + pool + " queue")
                .register(registry);
        Gauge.builder(pool + ".pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed " + pool + " tasks")
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor synthesis = synthesisExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor handoff = handoffExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Pool health: synthesis active={} queued={}, handoff active={} queued={}",
                synthesis.getActiveCount(), synthesis.getQueue().size(),
                handoff.getActiveCount(), handoff.getQueue().size());
    }
}
