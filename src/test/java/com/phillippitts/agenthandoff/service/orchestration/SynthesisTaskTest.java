package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.domain.AgentSpec;
import com.phillippitts.agenthandoff.domain.RequirementsSnapshot;
import com.phillippitts.agenthandoff.domain.RequirementsStore;
import com.phillippitts.agenthandoff.exception.SynthesisException;
import com.phillippitts.agenthandoff.service.orchestration.OrchestrationTestDoubles.BlockingSynthesizer;
import com.phillippitts.agenthandoff.testutil.TestExecutors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SynthesisTaskTest {

    private TestExecutors executors;

    @BeforeEach
    void setUp() {
        executors = new TestExecutors();
    }

    @AfterEach
    void tearDown() {
        executors.shutdown();
    }

    private static RequirementsSnapshot dental() {
        RequirementsStore store = new RequirementsStore();
        store.setBusinessName("Bright Smiles");
        store.setBusinessType("dental clinic");
        return store.snapshot();
    }

    @Test
    void completesWithSpec() throws Exception {
        SynthesisTask task = new SynthesisTask(dental(), OrchestrationTestDoubles.specBuilder(), new CancellationScope());

        task.start(executors.synthesis(), executors.scheduler(), Duration.ofSeconds(5));

        AgentSpec spec = task.result().get(5, TimeUnit.SECONDS);
        assertThat(spec.voice()).isEqualTo("nova");
        assertThat(task.snapshot().businessName()).isEqualTo("Bright Smiles");
    }

    @Test
    void failsWithTimeoutWhenCeilingFiresFirst() throws InterruptedException {
        BlockingSynthesizer synthesizer = new BlockingSynthesizer();
        SynthesisTask task = new SynthesisTask(dental(), synthesizer, new CancellationScope());

        task.start(executors.synthesis(), executors.scheduler(), Duration.ofMillis(100));

        assertThatThrownBy(() -> task.result().get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(SynthesisException.class)
                .satisfies(e -> assertThat(((SynthesisException) e).isTimedOut()).isTrue());

        // The worker keeps running until the scope is cancelled by the owner
        task.scope().cancel();
        await().atMost(Duration.ofSeconds(5)).until(() -> synthesizer.interrupted.get() == 1);
    }

    @Test
    void wrapsSynthesizerFailure() {
        SynthesisTask task = new SynthesisTask(dental(), snapshot -> {
            throw new IllegalStateException("boom");
        }, new CancellationScope());

        task.start(executors.synthesis(), executors.scheduler(), Duration.ofSeconds(5));

        assertThatThrownBy(() -> task.result().get(5, TimeUnit.SECONDS))
                .cause()
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("boom");
    }

    @Test
    void treatsMissingSpecAsFailure() {
        SynthesisTask task = new SynthesisTask(dental(), snapshot -> null, new CancellationScope());

        task.start(executors.synthesis(), executors.scheduler(), Duration.ofSeconds(5));

        assertThatThrownBy(() -> task.result().get(5, TimeUnit.SECONDS))
                .cause()
                .isInstanceOf(SynthesisException.class)
                .satisfies(e -> assertThat(((SynthesisException) e).isTimedOut()).isFalse());
    }

    @Test
    void cancelInterruptsWorkerAndCancelsResult() throws InterruptedException {
        BlockingSynthesizer synthesizer = new BlockingSynthesizer();
        SynthesisTask task = new SynthesisTask(dental(), synthesizer, new CancellationScope());
        task.start(executors.synthesis(), executors.scheduler(), Duration.ofSeconds(10));
        assertThat(synthesizer.entered.await(5, TimeUnit.SECONDS)).isTrue();

        task.cancel();

        assertThat(task.isDone()).isTrue();
        assertThatThrownBy(() -> task.result().get()).isInstanceOf(CancellationException.class);
        assertThat(task.scope().isCancelled()).isTrue();
        await().atMost(Duration.ofSeconds(5)).until(() -> synthesizer.interrupted.get() == 1);
    }

    @Test
    void reportsRejectedSubmissionAsFailure() {
        AsyncTaskExecutor saturated = mock(AsyncTaskExecutor.class);
        when(saturated.submit(any(Runnable.class))).thenThrow(new RejectedExecutionException("full"));
        SynthesisTask task = new SynthesisTask(dental(), OrchestrationTestDoubles.specBuilder(), new CancellationScope());

        task.start(saturated, executors.scheduler(), Duration.ofSeconds(5));

        assertThat(task.result()).isCompletedExceptionally();
        task.scope().cancel();
    }
}
