package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.config.properties.HandoffProperties;
import com.phillippitts.agenthandoff.domain.AgentSpec;
import com.phillippitts.agenthandoff.domain.HandoffDirection;
import com.phillippitts.agenthandoff.domain.HandoffState;
import com.phillippitts.agenthandoff.exception.ErrorCode;
import com.phillippitts.agenthandoff.service.analytics.CallRecord;
import com.phillippitts.agenthandoff.service.analytics.CallStatus;
import com.phillippitts.agenthandoff.service.orchestration.OrchestrationTestDoubles.BlockingSynthesizer;
import com.phillippitts.agenthandoff.service.orchestration.OrchestrationTestDoubles.CountingSynthesizer;
import com.phillippitts.agenthandoff.service.orchestration.OrchestrationTestDoubles.Fixture;
import com.phillippitts.agenthandoff.service.orchestration.event.HandoffFailedEvent;
import com.phillippitts.agenthandoff.service.orchestration.event.StateTransitionEvent;
import com.phillippitts.agenthandoff.service.orchestration.event.SynthesisCompletedEvent;
import com.phillippitts.agenthandoff.service.session.SessionHandle;
import com.phillippitts.agenthandoff.service.synthesis.SpecSynthesizer;
import com.phillippitts.agenthandoff.testutil.RecordingSessionPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.agenthandoff.service.orchestration.OrchestrationTestDoubles.BUSINESS_NAME;
import static com.phillippitts.agenthandoff.service.orchestration.OrchestrationTestDoubles.BUSINESS_TYPE;
import static com.phillippitts.agenthandoff.service.orchestration.OrchestrationTestDoubles.fastProperties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for {@link HandoffOrchestrator} on real pools with a recording session transport.
 */
class HandoffOrchestratorTest {

    private static final String CREATOR = HandoffProperties.Creator.DEFAULT_NAME;
    private static final String PIZZA_AGENT = "Tony's Pizza Pizza Assistant";
    private static final Duration WAIT = Duration.ofSeconds(5);

    private Fixture fixture;
    private RecordingSessionPort sessions;

    @BeforeEach
    void setUp() {
        fixture = new Fixture();
        sessions = fixture.sessions;
    }

    @AfterEach
    void tearDown() {
        fixture.shutdown();
    }

    @Test
    void shouldGreetWithCreatorPersonaOnStart() {
        // Arrange
        HandoffOrchestrator orchestrator = fixture.create("ctx-start", new CountingSynthesizer(), fastProperties());

        // Act
        ToolResponse first = orchestrator.startSession();
        ToolResponse second = orchestrator.startSession();

        // Assert
        assertThat(first.accepted()).isTrue();
        assertThat(second.accepted()).isTrue();
        assertThat(sessions.startedPersonas()).hasSize(1);
        assertThat(orchestrator.currentSession().personaName()).isEqualTo(CREATOR);
        assertThat(sessions.textsSpokenBy(CREATOR)).first().asString().startsWith("Hi, I'm " + CREATOR);
        assertThat(fixture.analytics.find("ctx-start")).isPresent();
        assertThat(orchestrator.state()).isEqualTo(HandoffState.GATHERING);
    }

    @Test
    void shouldLockRequirementsExactlyWhileProcessing() throws InterruptedException {
        // Arrange
        BlockingSynthesizer synthesizer = new BlockingSynthesizer();
        HandoffOrchestrator orchestrator = confirmed("ctx-lock", synthesizer, fastProperties());
        assertThat(orchestrator.storeRequirement("tone", "friendly").accepted()).isTrue();
        assertThat(orchestrator.confirmRequirements().accepted()).isTrue();

        // Act
        assertThat(orchestrator.finalizeRequirements().accepted()).isTrue();
        assertThat(synthesizer.entered.await(5, TimeUnit.SECONDS)).isTrue();
        ToolResponse whileProcessing = orchestrator.storeRequirement("target_audience", "families");
        ToolResponse loadWhileProcessing = orchestrator.loadSavedAgent("anything");

        synthesizer.release();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.DEMO_READY);
        ToolResponse afterProcessing = orchestrator.storeRequirement("target_audience", "families");

        // Assert
        assertThat(whileProcessing.accepted()).isFalse();
        assertThat(whileProcessing.errorCode()).isEqualTo(ErrorCode.LOCKED);
        assertThat(loadWhileProcessing.errorCode()).isEqualTo(ErrorCode.LOCKED);
        assertThat(afterProcessing.accepted()).isTrue();
        assertThat(orchestrator.status().requirements().targetAudience()).isEqualTo("families");
    }

    @Test
    void shouldRejectFillerAndTooShortValues() {
        // Arrange
        HandoffOrchestrator orchestrator = started("ctx-filler", new CountingSynthesizer(), fastProperties());
        orchestrator.storeRequirement("business_type", BUSINESS_TYPE);

        // Act & Assert
        for (String value : List.of("", "   ", "a", "um", "uh", "Not sure", " I don't know ")) {
            ToolResponse stored = orchestrator.storeRequirement("business_name", value);
            assertThat(stored.accepted()).as("value '%s'", value).isFalse();
            assertThat(stored.errorCode()).isEqualTo(ErrorCode.INCOMPLETE_REQUIREMENTS);
        }

        ToolResponse confirm = orchestrator.confirmRequirements();
        assertThat(confirm.errorCode()).isEqualTo(ErrorCode.INCOMPLETE_REQUIREMENTS);
        assertThat(confirm.message()).contains("business name");
        assertThat(orchestrator.state()).isEqualTo(HandoffState.GATHERING);
    }

    @Test
    void shouldRequireBusinessTypeBeforeConfirming() {
        // Arrange
        HandoffOrchestrator orchestrator = started("ctx-type", new CountingSynthesizer(), fastProperties());
        orchestrator.storeRequirement("business_name", BUSINESS_NAME);

        // Act
        ToolResponse confirm = orchestrator.confirmRequirements();

        // Assert
        assertThat(confirm.errorCode()).isEqualTo(ErrorCode.INCOMPLETE_REQUIREMENTS);
        assertThat(confirm.message()).contains("business type").doesNotContain("business name");
    }

    @Test
    void shouldRejectFinalizeWithoutConfirmation() {
        // Arrange
        CountingSynthesizer synthesizer = new CountingSynthesizer();
        HandoffOrchestrator orchestrator = started("ctx-b", synthesizer, fastProperties());
        orchestrator.storeRequirement("business_name", BUSINESS_NAME);
        orchestrator.storeRequirement("business_type", BUSINESS_TYPE);

        // Act
        ToolResponse response = orchestrator.finalizeRequirements();

        // Assert
        assertThat(response.errorCode()).isEqualTo(ErrorCode.NOT_CONFIRMED);
        assertThat(orchestrator.state()).isEqualTo(HandoffState.GATHERING);
        assertThat(synthesizer.calls.get()).isZero();
        assertThat(fixture.publisher.eventsOf(StateTransitionEvent.class)).isEmpty();
    }

    @Test
    void shouldReturnToGatheringWhenRequirementChangesDuringConfirmation() {
        // Arrange
        HandoffOrchestrator orchestrator = confirmed("ctx-reopen", new CountingSynthesizer(), fastProperties());

        // Act
        orchestrator.storeRequirement("tone", "warm and chatty");
        ToolResponse finalize = orchestrator.finalizeRequirements();

        // Assert
        assertThat(orchestrator.state()).isEqualTo(HandoffState.GATHERING);
        assertThat(finalize.errorCode()).isEqualTo(ErrorCode.NOT_CONFIRMED);
        assertThat(fixture.publisher.eventsOf(StateTransitionEvent.class))
                .extracting(StateTransitionEvent::reason)
                .containsExactly("confirm", "requirements-changed");
    }

    @Test
    void shouldStartExactlyOneSynthesisWhenFinalizeRaces() throws Exception {
        // Arrange
        BlockingSynthesizer synthesizer = new BlockingSynthesizer();
        HandoffOrchestrator orchestrator = confirmed("ctx-race", synthesizer, fastProperties());
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<ToolResponse>> futures = new ArrayList<>();

        // Act
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return orchestrator.finalizeRequirements();
                }));
            }
            go.countDown();
            List<ToolResponse> responses = new ArrayList<>();
            for (Future<ToolResponse> f : futures) {
                responses.add(f.get(5, TimeUnit.SECONDS));
            }

            // Assert
            assertThat(responses).filteredOn(ToolResponse::accepted).hasSize(1);
            assertThat(responses).filteredOn(r -> !r.accepted())
                    .hasSize(callers - 1)
                    .allMatch(r -> r.errorCode() == ErrorCode.ALREADY_PROCESSING);
            assertThat(synthesizer.entered.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(synthesizer.calls.get()).isEqualTo(1);
        } finally {
            synthesizer.release();
            pool.shutdownNow();
        }
    }

    @Test
    void shouldSynthesizePizzaAgentWithPizzaVoice() {
        // Arrange
        HandoffOrchestrator orchestrator = confirmed("ctx-a", new CountingSynthesizer(), fastProperties());

        // Act
        ToolResponse finalize = orchestrator.finalizeRequirements();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.DEMO_READY);

        // Assert
        assertThat(finalize.accepted()).isTrue();
        AgentSpec spec = orchestrator.agentSpec().orElseThrow();
        assertThat(spec.voice()).isEqualTo("echo");
        assertThat(spec.agentType()).isEqualTo(PIZZA_AGENT);
        assertThat(spec.businessContext()).containsEntry(AgentSpec.BUSINESS_TYPE, "pizza");
        assertThat(fixture.persistence.size()).isEqualTo(1);
        assertThat(orchestrator.status().savedAgentId()).isNotNull();
        await().atMost(WAIT).until(() -> sessions.anySpoken(ConversationScripts.ready(spec)));
        assertThat(fixture.publisher.eventsOf(SynthesisCompletedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.isSuccess()).isTrue());
    }

    @Test
    void shouldAllowOnlyOneOfTwoBackToBackDemoStarts() {
        // Arrange
        HandoffOrchestrator orchestrator = demoReady("ctx-c", new CountingSynthesizer());

        // Act
        ToolResponse first = orchestrator.startDemo();
        ToolResponse second = orchestrator.startDemo();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.DEMO_ACTIVE);

        // Assert
        assertThat(first.accepted()).isTrue();
        assertThat(second.accepted()).isFalse();
        assertThat(second.errorCode()).isEqualTo(ErrorCode.NOT_READY);
        assertThat(orchestrator.currentSession().personaName()).isEqualTo(PIZZA_AGENT);
        assertThat(sessions.startedPersonas()).extracting(p -> p.name()).containsExactly(CREATOR, PIZZA_AGENT);
        assertThat(sessions.maxLiveCount()).isEqualTo(1);
        assertThat(sessions.liveCount()).isEqualTo(1);
    }

    @Test
    void shouldSpeakFarewellBeforeIntroductionDuringHandoff() {
        // Arrange
        HandoffOrchestrator orchestrator = demoReady("ctx-order", new CountingSynthesizer());
        AgentSpec spec = orchestrator.agentSpec().orElseThrow();

        // Act
        orchestrator.startDemo();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.DEMO_ACTIVE);

        // Assert
        List<String> spoken = sessions.utterances().stream().map(RecordingSessionPort.Utterance::text).toList();
        int farewell = spoken.indexOf(ConversationScripts.farewellToTaskAgent(spec, CREATOR));
        int intro = spoken.indexOf(ConversationScripts.taskAgentIntroduction(spec, CREATOR));
        assertThat(farewell).isNotNegative();
        assertThat(intro).isGreaterThan(farewell);
        assertThat(sessions.textsSpokenBy(PIZZA_AGENT)).first().isEqualTo(spoken.get(intro));
    }

    @Test
    void shouldReuseStoredSpecWhenTryingDemoAgain() {
        // Arrange
        CountingSynthesizer synthesizer = new CountingSynthesizer();
        HandoffOrchestrator orchestrator = demoReady("ctx-d", synthesizer);
        AgentSpec spec = orchestrator.agentSpec().orElseThrow();
        orchestrator.startDemo();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.DEMO_ACTIVE);

        // Act
        ToolResponse back = orchestrator.handoffBackToCreator();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.GATHERING
                && !orchestrator.status().handoffInProgress());
        ToolResponse again = orchestrator.tryDemoAgain();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.DEMO_ACTIVE
                && !orchestrator.status().handoffInProgress());

        // Assert
        assertThat(back.accepted()).isTrue();
        assertThat(again.accepted()).isTrue();
        assertThat(orchestrator.status().demoCompleted()).isTrue();
        assertThat(synthesizer.calls.get()).isEqualTo(1);
        assertThat(orchestrator.agentSpec()).containsSame(spec);
        assertThat(orchestrator.currentSession().personaName()).isEqualTo(PIZZA_AGENT);
        assertThat(sessions.startedPersonas()).extracting(p -> p.name())
                .containsExactly(CREATOR, PIZZA_AGENT, CREATOR, PIZZA_AGENT);
        assertThat(sessions.maxLiveCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectRequirementChangesWhileDemoHandoffIsRunning() {
        // Arrange
        CountingSynthesizer synthesizer = new CountingSynthesizer();
        HandoffProperties slowFarewell = new HandoffProperties(Duration.ofSeconds(5), Duration.ofSeconds(10), 2,
                Duration.ofMillis(800), Duration.ZERO, Duration.ZERO, null, null);
        HandoffOrchestrator orchestrator = confirmed("ctx-handoff-guard", synthesizer, slowFarewell);
        orchestrator.finalizeRequirements();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.DEMO_READY);

        // Act
        ToolResponse demo = orchestrator.startDemo();
        ToolResponse confirm = orchestrator.confirmRequirements();
        ToolResponse finalize = orchestrator.finalizeRequirements();
        ToolResponse store = orchestrator.storeRequirement("tone", "playful");
        ToolResponse start = orchestrator.startSession();
        HandoffState duringHandoff = orchestrator.state();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.DEMO_ACTIVE
                && !orchestrator.status().handoffInProgress());

        // Assert
        assertThat(demo.accepted()).isTrue();
        assertThat(duringHandoff).isEqualTo(HandoffState.DEMO_READY);
        assertThat(List.of(confirm, finalize, store))
                .allSatisfy(r -> {
                    assertThat(r.accepted()).isFalse();
                    assertThat(r.errorCode()).isEqualTo(ErrorCode.NOT_READY);
                    assertThat(r.message()).isEqualTo(HandoffOrchestrator.HANDOFF_MESSAGE);
                });
        assertThat(start.accepted()).isTrue();
        assertThat(start.message()).isEqualTo(HandoffOrchestrator.HANDOFF_MESSAGE);
        assertThat(synthesizer.calls.get()).isEqualTo(1);
        assertThat(orchestrator.status().requirements().tone()).isNull();
        assertThat(orchestrator.currentSession().personaName()).isEqualTo(PIZZA_AGENT);
        assertThat(sessions.startedPersonas()).extracting(p -> p.name()).containsExactly(CREATOR, PIZZA_AGENT);
        assertThat(fixture.publisher.eventsOf(StateTransitionEvent.class))
                .extracting(StateTransitionEvent::reason)
                .containsExactly("confirm", "finalize", "synthesis-complete", "demo-start");
    }

    @Test
    void shouldEnforceCeilingWhileOtherContextsStallOnFillers() throws InterruptedException {
        // Arrange
        StallingSessionPort stalling = new StallingSessionPort();
        HandoffProperties chatty = fastProperties(Duration.ofSeconds(30), Duration.ofMillis(20), 2);
        try {
            for (String contextId : List.of("ctx-stall-a", "ctx-stall-b")) {
                HandoffOrchestrator busy = confirmedOn(stalling, contextId, new BlockingSynthesizer(), chatty);
                assertThat(busy.finalizeRequirements().accepted()).isTrue();
            }
            await().atMost(WAIT).until(() -> stalling.stalledCount() == 2);

            HandoffOrchestrator bounded = confirmedOn(stalling, "ctx-bounded", new BlockingSynthesizer(),
                    fastProperties(Duration.ofMillis(300), Duration.ofSeconds(10), 2));

            // Act
            bounded.finalizeRequirements();

            // Assert
            await().atMost(Duration.ofSeconds(3)).until(() -> bounded.state() == HandoffState.GATHERING);
            await().atMost(WAIT).until(() -> stalling.anySpoken(ConversationScripts.synthesisApology(true)));
        } finally {
            stalling.release();
        }
    }

    @Test
    void shouldRejectDemoRetryAndHandbackOutOfOrder() {
        // Arrange
        HandoffOrchestrator orchestrator = started("ctx-order-reject", new CountingSynthesizer(), fastProperties());

        // Act
        ToolResponse retry = orchestrator.tryDemoAgain();
        ToolResponse back = orchestrator.handoffBackToCreator();
        ToolResponse demo = orchestrator.startDemo();

        // Assert
        assertThat(retry.errorCode()).isEqualTo(ErrorCode.NOT_READY);
        assertThat(back.errorCode()).isEqualTo(ErrorCode.NOT_READY);
        assertThat(demo.errorCode()).isEqualTo(ErrorCode.NOT_READY);
        assertThat(orchestrator.state()).isEqualTo(HandoffState.GATHERING);
    }

    @Test
    void shouldReturnToGatheringWhenSynthesisTimesOut() throws InterruptedException {
        // Arrange
        BlockingSynthesizer synthesizer = new BlockingSynthesizer();
        HandoffProperties props = fastProperties(Duration.ofMillis(150), Duration.ofSeconds(10), 2);
        HandoffOrchestrator orchestrator = confirmed("ctx-timeout", synthesizer, props);

        // Act
        orchestrator.finalizeRequirements();
        assertThat(synthesizer.entered.await(5, TimeUnit.SECONDS)).isTrue();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.GATHERING);

        // Assert
        await().atMost(WAIT).until(() -> sessions.anySpoken(ConversationScripts.synthesisApology(true)));
        await().atMost(WAIT).until(() -> synthesizer.interrupted.get() == 1);
        assertThat(fixture.publisher.eventsOf(SynthesisCompletedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.outcome()).isEqualTo(SynthesisCompletedEvent.TIMEOUT));
        assertThat(orchestrator.agentSpec()).isEmpty();
        assertThat(orchestrator.status().requirements().businessName()).isEqualTo(BUSINESS_NAME);
        assertThat(fixture.analytics.find("ctx-timeout").orElseThrow().getErrors())
                .contains(ErrorCode.SYNTHESIS_TIMEOUT);
    }

    @Test
    void shouldReturnToGatheringWhenSynthesisFails() {
        // Arrange
        SpecSynthesizer failing = snapshot -> {
            throw new IllegalStateException("catalog unavailable");
        };
        HandoffOrchestrator orchestrator = confirmed("ctx-fail", failing, fastProperties());

        // Act
        orchestrator.finalizeRequirements();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.GATHERING);

        // Assert
        await().atMost(WAIT).until(() -> sessions.anySpoken(ConversationScripts.synthesisApology(false)));
        assertThat(fixture.publisher.eventsOf(SynthesisCompletedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.outcome()).isEqualTo(SynthesisCompletedEvent.FAILED));
        assertThat(fixture.analytics.find("ctx-fail").orElseThrow().getErrors())
                .contains(ErrorCode.SYNTHESIS_FAILED);

        // A failed synthesis can be retried after confirming again
        assertThat(orchestrator.confirmRequirements().accepted()).isTrue();
    }

    @Test
    void shouldSpeakExactlyTwoFillersWhileSynthesisIsPending() throws InterruptedException {
        // Arrange
        BlockingSynthesizer synthesizer = new BlockingSynthesizer();
        HandoffProperties props = fastProperties(Duration.ofSeconds(10), Duration.ofMillis(40), 5);
        HandoffOrchestrator orchestrator = confirmed("ctx-fillers", synthesizer, props);

        // Act
        orchestrator.finalizeRequirements();
        assertThat(synthesizer.entered.await(5, TimeUnit.SECONDS)).isTrue();

        // Assert
        await().atMost(WAIT).until(() -> fillerCount() == 2);
        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2)).until(() -> fillerCount() == 2);
        assertThat(sessions.textsSpokenBy(CREATOR)).containsSubsequence(ConversationScripts.FILLERS);
        synthesizer.release();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.DEMO_READY);
    }

    @Test
    void shouldNotSpeakFillersAfterSynthesisCompletes() {
        // Arrange
        HandoffProperties props = fastProperties(Duration.ofSeconds(5), Duration.ofMillis(30), 2);
        HandoffOrchestrator orchestrator = confirmed("ctx-late-filler", new CountingSynthesizer(), props);

        // Act
        orchestrator.finalizeRequirements();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.DEMO_READY);
        AgentSpec spec = orchestrator.agentSpec().orElseThrow();
        await().atMost(WAIT).until(() -> sessions.anySpoken(ConversationScripts.ready(spec)));

        // Assert
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> {
            List<String> spoken = sessions.textsSpokenBy(CREATOR);
            int ready = spoken.indexOf(ConversationScripts.ready(spec));
            return spoken.subList(ready, spoken.size()).stream().noneMatch(ConversationScripts.FILLERS::contains);
        });
    }

    @Test
    void shouldCancelSynthesisAndSilenceFillersOnClose() throws InterruptedException {
        // Arrange
        BlockingSynthesizer synthesizer = new BlockingSynthesizer();
        HandoffProperties props = new HandoffProperties(Duration.ofSeconds(10), Duration.ofMillis(40), 2,
                Duration.ZERO, Duration.ZERO, Duration.ofSeconds(30), null, null);
        HandoffOrchestrator orchestrator = confirmed("ctx-close-processing", synthesizer, props);
        orchestrator.finalizeRequirements();
        assertThat(synthesizer.entered.await(5, TimeUnit.SECONDS)).isTrue();

        // Act
        ToolResponse close = orchestrator.closeSession(5);
        int spokenAtClose = sessions.utterances().size();

        // Assert
        assertThat(close.accepted()).isTrue();
        assertThat(orchestrator.state()).isEqualTo(HandoffState.COMPLETED);
        await().atMost(WAIT).until(() -> synthesizer.interrupted.get() == 1);
        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2))
                .until(() -> sessions.utterances().size() == spokenAtClose);
        assertThat(sessions.utterances()).last()
                .satisfies(u -> assertThat(u.text()).isEqualTo(ConversationScripts.goodbye(null)));
        assertThat(fixture.publisher.eventsOf(SynthesisCompletedEvent.class)).isEmpty();
        assertThat(fixture.publisher.eventsOf(StateTransitionEvent.class))
                .extracting(StateTransitionEvent::to)
                .doesNotContain(HandoffState.DEMO_READY, HandoffState.GATHERING);
        CallRecord call = fixture.analytics.find("ctx-close-processing").orElseThrow();
        assertThat(call.getStatus()).isEqualTo(CallStatus.COMPLETED);
        assertThat(call.getRating()).isEqualTo(5);
    }

    @Test
    void shouldRestoreCreatorWhenTaskAgentCannotStart() {
        // Arrange
        HandoffOrchestrator orchestrator = demoReady("ctx-restore", new CountingSynthesizer());
        sessions.failStartsFor(PIZZA_AGENT);

        // Act
        ToolResponse demo = orchestrator.startDemo();
        await().atMost(WAIT).until(() -> !fixture.publisher.eventsOf(HandoffFailedEvent.class).isEmpty());

        // Assert
        assertThat(demo.accepted()).isTrue();
        assertThat(orchestrator.state()).isEqualTo(HandoffState.GATHERING);
        assertThat(orchestrator.status().handoffInProgress()).isFalse();
        assertThat(orchestrator.currentSession().personaName()).isEqualTo(CREATOR);
        assertThat(sessions.liveCount()).isEqualTo(1);
        assertThat(sessions.anySpoken(ConversationScripts.handoffApology())).isTrue();
        HandoffFailedEvent failed = fixture.publisher.eventsOf(HandoffFailedEvent.class).get(0);
        assertThat(failed.direction()).isEqualTo(HandoffDirection.TO_TASK_AGENT);
        assertThat(failed.restored()).isTrue();
        assertThat(fixture.analytics.find("ctx-restore").orElseThrow().getErrors())
                .contains(ErrorCode.HANDOFF_FAILED);
        // The stored spec survives, so the demo can be retried once the transport recovers
        assertThat(orchestrator.agentSpec()).isPresent();
    }

    @Test
    void shouldReportOrphanedContextWhenNoPersonaCanBeRestored() {
        // Arrange
        HandoffOrchestrator orchestrator = demoReady("ctx-orphan", new CountingSynthesizer());
        sessions.failAllStarts(true);

        // Act
        orchestrator.startDemo();
        await().atMost(WAIT).until(() -> !fixture.publisher.eventsOf(HandoffFailedEvent.class).isEmpty());

        // Assert
        assertThat(fixture.publisher.eventsOf(HandoffFailedEvent.class).get(0).restored()).isFalse();
        assertThat(orchestrator.currentSession()).isNull();
        assertThat(orchestrator.state()).isEqualTo(HandoffState.GATHERING);
        assertThat(orchestrator.status().isOrphaned()).isTrue();
    }

    @Test
    void shouldLoadSavedAgentIntoAnotherContext() {
        // Arrange
        HandoffOrchestrator original = demoReady("ctx-save", new CountingSynthesizer());
        String savedId = original.status().savedAgentId();
        CountingSynthesizer unused = new CountingSynthesizer();
        HandoffOrchestrator other = started("ctx-load", unused, fastProperties());

        // Act
        ToolResponse unknown = other.loadSavedAgent("no-such-agent");
        ToolResponse loaded = other.loadSavedAgent(savedId);
        ToolResponse reload = other.loadSavedAgent(savedId);

        // Assert
        assertThat(unknown.errorCode()).isEqualTo(ErrorCode.NOT_READY);
        assertThat(loaded.accepted()).isTrue();
        assertThat(reload.errorCode()).isEqualTo(ErrorCode.NOT_READY);
        assertThat(other.state()).isEqualTo(HandoffState.DEMO_READY);
        assertThat(other.agentSpec()).contains(original.agentSpec().orElseThrow());
        assertThat(other.status().requirements().businessName()).isEqualTo(BUSINESS_NAME);
        assertThat(other.status().savedAgentId()).isEqualTo(savedId);

        assertThat(other.startDemo().accepted()).isTrue();
        await().atMost(WAIT).until(() -> other.state() == HandoffState.DEMO_ACTIVE);
        assertThat(unused.calls.get()).isZero();
    }

    @Test
    void shouldTearDownAfterCloseAndRejectFurtherOperations() throws InterruptedException {
        // Arrange
        CountDownLatch tornDown = new CountDownLatch(1);
        AtomicInteger teardownCalls = new AtomicInteger();
        HandoffOrchestrator orchestrator = fixture.create("ctx-close", new CountingSynthesizer(), fastProperties(),
                o -> {
                    teardownCalls.incrementAndGet();
                    tornDown.countDown();
                });
        orchestrator.startSession();

        // Act
        ToolResponse close = orchestrator.closeSession(null);
        ToolResponse secondClose = orchestrator.closeSession(null);

        // Assert
        assertThat(close.accepted()).isTrue();
        assertThat(secondClose.errorCode()).isEqualTo(ErrorCode.NOT_READY);
        assertThat(tornDown.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(teardownCalls.get()).isEqualTo(1);
        assertThat(sessions.liveCount()).isZero();
        assertThat(orchestrator.currentSession()).isNull();
        assertThat(orchestrator.isTerminal()).isTrue();
        assertThat(orchestrator.storeRequirement("business_name", BUSINESS_NAME).errorCode())
                .isEqualTo(ErrorCode.NOT_READY);
        assertThat(orchestrator.startSession().accepted()).isFalse();
        assertThat(orchestrator.status().isOrphaned()).isFalse();
    }

    @Test
    void shouldAnswerAdvisoryQueries() {
        // Arrange
        HandoffOrchestrator orchestrator = started("ctx-advice", new CountingSynthesizer(), fastProperties());

        // Act & Assert
        assertThat(orchestrator.checkRequirementsStatus().message()).contains("business name", "business type");
        assertThat(orchestrator.showRequirementsSummary().errorCode()).isEqualTo(ErrorCode.INCOMPLETE_REQUIREMENTS);

        orchestrator.storeRequirement("business_name", BUSINESS_NAME);
        orchestrator.storeRequirement("business_type", BUSINESS_TYPE);
        assertThat(orchestrator.checkRequirementsStatus().message()).contains("main functions");
        assertThat(orchestrator.showRequirementsSummary().message()).contains("Business: " + BUSINESS_NAME);
        assertThat(orchestrator.checkProcessingStatus().message()).contains("gathering");
        assertThat(orchestrator.askDemoPreference().message()).contains("Once your agent is ready");
    }

    private HandoffOrchestrator started(String contextId, SpecSynthesizer synthesizer, HandoffProperties props) {
        HandoffOrchestrator orchestrator = fixture.create(contextId, synthesizer, props);
        assertThat(orchestrator.startSession().accepted()).isTrue();
        return orchestrator;
    }

    private HandoffOrchestrator confirmed(String contextId, SpecSynthesizer synthesizer, HandoffProperties props) {
        HandoffOrchestrator orchestrator = started(contextId, synthesizer, props);
        assertThat(orchestrator.storeRequirement("business_name", BUSINESS_NAME).accepted()).isTrue();
        assertThat(orchestrator.storeRequirement("business_type", BUSINESS_TYPE).accepted()).isTrue();
        assertThat(orchestrator.confirmRequirements().accepted()).isTrue();
        return orchestrator;
    }

    private HandoffOrchestrator confirmedOn(RecordingSessionPort port, String contextId,
                                            SpecSynthesizer synthesizer, HandoffProperties props) {
        HandoffOrchestrator orchestrator = fixture.create(contextId, synthesizer, props, port);
        assertThat(orchestrator.startSession().accepted()).isTrue();
        assertThat(orchestrator.storeRequirement("business_name", BUSINESS_NAME).accepted()).isTrue();
        assertThat(orchestrator.storeRequirement("business_type", BUSINESS_TYPE).accepted()).isTrue();
        assertThat(orchestrator.confirmRequirements().accepted()).isTrue();
        return orchestrator;
    }

    private HandoffOrchestrator demoReady(String contextId, SpecSynthesizer synthesizer) {
        HandoffOrchestrator orchestrator = confirmed(contextId, synthesizer, fastProperties());
        assertThat(orchestrator.finalizeRequirements().accepted()).isTrue();
        await().atMost(WAIT).until(() -> orchestrator.state() == HandoffState.DEMO_READY);
        return orchestrator;
    }

    private long fillerCount() {
        return sessions.textsSpokenBy(CREATOR).stream().filter(ConversationScripts.FILLERS::contains).count();
    }

    /**
     * Session transport whose filler lines hang in every {@code ctx-stall-*} context until
     * {@link #release()}.
     */
    private static final class StallingSessionPort extends RecordingSessionPort {
        private final CountDownLatch gate = new CountDownLatch(1);
        private final AtomicInteger stalled = new AtomicInteger();

        @Override
        public void speak(SessionHandle handle, String text) {
            if (handle.contextId().startsWith("ctx-stall-") && ConversationScripts.FILLERS.contains(text)) {
                stalled.incrementAndGet();
                try {
                    gate.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            super.speak(handle, text);
        }

        int stalledCount() {
            return stalled.get();
        }

        void release() {
            gate.countDown();
        }
    }
}
