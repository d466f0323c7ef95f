package com.phillippitts.agenthandoff.service.orchestration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Keeps the live session occupied while a synthesis is pending.
 *
 * <p>Samples the task at a fixed interval. At each of the first {@code maxUtterances} samples
 * where the task is still pending it speaks the next filler line; after that it stays silent for
 * the rest of the run. Every utterance happens inside the shared {@link CancellationScope}, so
 * nothing is spoken once the task completes, fails, times out or the context closes.
 *
 * <p>Sampling runs on the shared scheduler; the utterance itself runs on the speech executor, so a
 * stalled session never holds a scheduler thread that other contexts' ceilings depend on. At most
 * one utterance per loop is in flight; samples taken while one is still speaking are skipped.
 */
final class EngagementLoop implements Runnable {

    private static final Logger LOG = LogManager.getLogger(EngagementLoop.class);

    private final SynthesisTask task;
    private final List<String> fillers;
    private final int maxUtterances;
    private final Consumer<String> speaker;
    private final Executor speechExecutor;
    private final Runnable onEmit;
    private final AtomicInteger emitted = new AtomicInteger();
    private final AtomicBoolean speaking = new AtomicBoolean();

    /**
     * @param task          synthesis being waited on; its scope bounds this loop
     * @param fillers       distinct lines, spoken in order
     * @param maxUtterances utterance budget, at most {@code fillers.size()} are used
     * @param speaker       speaks on the current session; must not throw
     * @param speechExecutor runs each utterance off the sampling thread
     * @param onEmit        callback after each utterance (metrics)
     */
    EngagementLoop(SynthesisTask task, List<String> fillers, int maxUtterances,
                   Consumer<String> speaker, Executor speechExecutor, Runnable onEmit) {
        this.task = Objects.requireNonNull(task, "task must not be null");
        this.fillers = List.copyOf(fillers);
        this.maxUtterances = Math.min(maxUtterances, this.fillers.size());
        this.speaker = Objects.requireNonNull(speaker, "speaker must not be null");
        this.speechExecutor = Objects.requireNonNull(speechExecutor, "speechExecutor must not be null");
        this.onEmit = onEmit == null ? () -> { } : onEmit;
    }

    /**
     * Schedules sampling at a fixed rate, first sample one interval from now.
     */
    void start(TaskScheduler scheduler, Duration interval) {
        if (maxUtterances <= 0) {
            return;
        }
        ScheduledFuture<?> sampling = scheduler.scheduleAtFixedRate(this, Instant.now().plus(interval), interval);
        task.scope().register(sampling);
    }

    /**
     * One sample: hands the next filler to the speech executor when the task is still pending.
     */
    @Override
    public void run() {
        if (task.isDone() || task.scope().isCancelled() || emitted.get() >= maxUtterances) {
            return;
        }
        if (!speaking.compareAndSet(false, true)) {
            LOG.debug("Previous filler still speaking; skipping sample");
            return;
        }
        try {
            speechExecutor.execute(this::speakNext);
        } catch (RejectedExecutionException e) {
            speaking.set(false);
            LOG.warn("Engagement filler could not be dispatched: {}", e.toString());
        }
    }

    private void speakNext() {
        try {
            task.scope().runIfActive(() -> {
                if (task.isDone()) {
                    return;
                }
                int index = emitted.getAndIncrement();
                if (index >= maxUtterances) {
                    return;
                }
                LOG.debug("Engagement filler {}/{}", index + 1, maxUtterances);
                speaker.accept(fillers.get(index));
                onEmit.run();
            });
        } finally {
            speaking.set(false);
        }
    }

    int emittedCount() {
        return Math.min(emitted.get(), maxUtterances);
    }
}
