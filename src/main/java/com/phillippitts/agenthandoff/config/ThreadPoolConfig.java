package com.phillippitts.agenthandoff.config;

import com.phillippitts.agenthandoff.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Executors shared by every conversation context.
 *
 * <p>Contexts never share mutable state; they only share these pools. Sizing is configured via
 * {@link ThreadPoolProperties} ({@code threadpool.synthesis.*}, {@code threadpool.handoff.*},
 * {@code threadpool.scheduler.*}).
 *
 * <p>MDC propagation: the executors and the scheduler copy the Log4j2 ThreadContext of the
 * submitting thread to the worker, so background work keeps the {@code contextId} of the
 * conversation that spawned it.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs spec synthesis. Workers are interrupted when a synthesis is cancelled or hits its
     * ceiling, so a slow synthesizer never pins a thread past the timeout.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected synthesis is
     * reported as a synthesis failure and rolls the context back to gathering, which is
     * preferable to running synthesis on the caller's tool-call thread.
     *
     * @return executor for synthesis tasks
     */
    @Bean(name = "synthesisExecutor")
    public ThreadPoolTaskExecutor synthesisExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getSynthesis());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Runs handoff protocol bodies and synthesis completion handlers. These block on session
     * I/O and the fixed protocol delays, so they must stay off tool-call threads.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}, providing backpressure
     * instead of dropping a handoff.
     *
     * @return executor for handoff work
     */
    @Bean(name = "handoffExecutor")
    public ThreadPoolTaskExecutor handoffExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getHandoff());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Drives engagement sampling, synthesis ceilings and delayed context teardown. Scheduled tasks
     * must stay short: anything that blocks on a session goes to the handoff executor.
     *
     * @return scheduler shared by all contexts
     */
    @Bean(name = "handoffScheduler")
    public ThreadPoolTaskScheduler handoffScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler() {
            @Override
            protected ScheduledExecutorService createExecutor(int poolSize, ThreadFactory threadFactory,
                                                              RejectedExecutionHandler rejectedExecutionHandler) {
                return new MdcScheduledExecutor(poolSize, threadFactory, rejectedExecutionHandler);
            }
        };
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }

    /**
     * Decorates every scheduled runnable at submission time, on the submitting thread.
     * {@code execute} and {@code submit} route through {@link #schedule(Runnable, long, TimeUnit)}.
     */
    static final class MdcScheduledExecutor extends ScheduledThreadPoolExecutor {

        private final TaskDecorator decorator = mdcPropagating();

        MdcScheduledExecutor(int poolSize, ThreadFactory threadFactory, RejectedExecutionHandler handler) {
            super(poolSize, threadFactory, handler);
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            return super.schedule(decorator.decorate(command), delay, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period,
                                                      TimeUnit unit) {
            return super.scheduleAtFixedRate(decorator.decorate(command), initialDelay, period, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay, long delay,
                                                         TimeUnit unit) {
            return super.scheduleWithFixedDelay(decorator.decorate(command), initialDelay, delay, unit);
        }
    }
}
