package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.domain.AgentSpec;
import com.phillippitts.agenthandoff.domain.RequirementsSnapshot;
import com.phillippitts.agenthandoff.exception.SynthesisException;
import com.phillippitts.agenthandoff.service.synthesis.SpecSynthesizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * One cancellable synthesis run with a hard timeout ceiling.
 *
 * <p>The result future completes exactly once: with the spec, with the synthesizer's failure
 * wrapped in a {@link SynthesisException}, with {@link SynthesisException#timeout(long)} when the
 * ceiling fires first, or is cancelled when the owning context closes. The ceiling is enforced by
 * the scheduler, independently of whether the synthesizer honours interruption.
 */
final class SynthesisTask {

    private static final Logger LOG = LogManager.getLogger(SynthesisTask.class);

    private final RequirementsSnapshot snapshot;
    private final SpecSynthesizer synthesizer;
    private final CancellationScope scope;
    private final CompletableFuture<AgentSpec> result = new CompletableFuture<>();
    private final long startedNanos = System.nanoTime();

    SynthesisTask(RequirementsSnapshot snapshot, SpecSynthesizer synthesizer, CancellationScope scope) {
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot must not be null");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
    }

    /**
     * Submits the worker and arms the ceiling. Never throws: a rejected submission completes the
     * result exceptionally.
     */
    void start(AsyncTaskExecutor executor, TaskScheduler scheduler, Duration timeout) {
        long timeoutMs = timeout.toMillis();
        try {
            ScheduledFuture<?> ceiling = scheduler.schedule(() -> {
                if (result.completeExceptionally(SynthesisException.timeout(timeoutMs))) {
                    LOG.warn("Synthesis exceeded ceiling of {} ms; cancelling", timeoutMs);
                }
            }, Instant.now().plus(timeout));
            scope.register(ceiling);

            Future<?> worker = executor.submit(this::runWorker);
            scope.register(worker);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new SynthesisException("Synthesis could not be scheduled", e));
        }
    }

    private void runWorker() {
        try {
            AgentSpec spec = synthesizer.synthesize(snapshot);
            if (spec == null) {
                result.completeExceptionally(SynthesisException.failed("Synthesizer returned no spec"));
            } else {
                result.complete(spec);
            }
        } catch (SynthesisException e) {
            result.completeExceptionally(e);
        } catch (RuntimeException e) {
            result.completeExceptionally(new SynthesisException("Synthesis failed: " + e.getMessage(), e));
        }
    }

    /**
     * Cancels the run; the result future completes with a cancellation if still pending.
     */
    void cancel() {
        result.cancel(false);
        scope.cancel();
    }

    CompletableFuture<AgentSpec> result() {
        return result;
    }

    boolean isDone() {
        return result.isDone();
    }

    RequirementsSnapshot snapshot() {
        return snapshot;
    }

    CancellationScope scope() {
        return scope;
    }

    long elapsedNanos() {
        return System.nanoTime() - startedNanos;
    }
}
