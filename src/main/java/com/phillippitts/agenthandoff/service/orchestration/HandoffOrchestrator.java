package com.phillippitts.agenthandoff.service.orchestration;

import com.phillippitts.agenthandoff.config.properties.HandoffProperties;
import com.phillippitts.agenthandoff.domain.AgentSpec;
import com.phillippitts.agenthandoff.domain.HandoffDirection;
import com.phillippitts.agenthandoff.domain.HandoffState;
import com.phillippitts.agenthandoff.domain.Persona;
import com.phillippitts.agenthandoff.domain.RequirementsSnapshot;
import com.phillippitts.agenthandoff.domain.RequirementsStore;
import com.phillippitts.agenthandoff.exception.ErrorCode;
import com.phillippitts.agenthandoff.exception.HandoffException;
import com.phillippitts.agenthandoff.exception.HandoffExceptionBuilder;
import com.phillippitts.agenthandoff.exception.SynthesisException;
import com.phillippitts.agenthandoff.service.analytics.AnalyticsPort;
import com.phillippitts.agenthandoff.service.analytics.CallStatus;
import com.phillippitts.agenthandoff.service.orchestration.event.HandoffFailedEvent;
import com.phillippitts.agenthandoff.service.orchestration.event.StateTransitionEvent;
import com.phillippitts.agenthandoff.service.orchestration.event.SynthesisCompletedEvent;
import com.phillippitts.agenthandoff.service.persistence.PersistencePort;
import com.phillippitts.agenthandoff.service.persistence.SavedAgent;
import com.phillippitts.agenthandoff.service.requirements.RequirementClassifier;
import com.phillippitts.agenthandoff.service.requirements.RequirementField;
import com.phillippitts.agenthandoff.service.synthesis.SpecSynthesizer;
import com.phillippitts.agenthandoff.util.LogSanitizer;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * State machine for one conversation context.
 *
 * <p>Owns the context's {@link RequirementsStore}, its current state, the stored
 * {@link AgentSpec}, the current live session and the in-flight {@link SynthesisTask}. Tool-facing
 * operations are invoked by whichever persona is live and answer with a {@link ToolResponse};
 * user-facing rejections are never thrown.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * GATHERING → CONFIRMING (confirmRequirements)
 * CONFIRMING → PROCESSING (finalizeRequirements)
 * PROCESSING → DEMO_READY (synthesis succeeded) | GATHERING (synthesis failed or timed out)
 * DEMO_READY → DEMO_ACTIVE (startDemo / tryDemoAgain handoff)
 * DEMO_ACTIVE → GATHERING (handoffBackToCreator)
 * GATHERING | CONFIRMING → DEMO_READY (loadSavedAgent, tryDemoAgain)
 * any non-terminal → COMPLETED (closeSession)
 * </pre>
 *
 * <p><b>Thread Safety:</b> one {@link ReentrantLock} guards the state, the requirements and the
 * stored spec. It is held only for the guard check plus assignment; session I/O, protocol delays
 * and port calls run outside it, so a stalled transport never blocks other operations on the same
 * context. Handoffs are serialized by a {@code handoffInProgress} flag claimed under the lock, and
 * run on the handoff executor so demo operations return immediately. While the flag is set,
 * requirement changes, confirmation and finalization are rejected, and a finished handoff only
 * commits its state change if the state is still the one it started from.
 */
public final class HandoffOrchestrator {

    private static final Logger LOG = LogManager.getLogger(HandoffOrchestrator.class);

    static final String MDC_CONTEXT_ID = "contextId";
    static final String CLOSED_MESSAGE = "This conversation has already ended.";
    static final String HANDOFF_MESSAGE = "I'm connecting you right now. One moment.";

    private final String contextId;
    private final HandoffProperties properties;
    private final SpecSynthesizer synthesizer;
    private final RequirementClassifier classifier;
    private final PersistencePort persistence;
    private final AnalyticsPort analytics;
    private final ApplicationEventPublisher publisher;
    private final OrchestrationMetricsPublisher metrics;
    private final AsyncTaskExecutor synthesisExecutor;
    private final AsyncTaskExecutor handoffExecutor;
    private final TaskScheduler scheduler;
    private final Consumer<HandoffOrchestrator> onTeardown;
    private final HandoffProtocol protocol;
    private final Persona creator;
    private final SessionSlot sessions = new SessionSlot();

    private final ReentrantLock lock = new ReentrantLock();
    private final RequirementsStore requirements = new RequirementsStore();
    private HandoffState state = HandoffState.GATHERING;
    private AgentSpec agentSpec;
    private SynthesisTask synthesisTask;
    private String savedAgentId;
    private boolean demoCompleted;
    private boolean handoffInProgress;

    HandoffOrchestrator(HandoffOrchestratorBuilder builder) {
        this.contextId = builder.contextId();
        this.properties = builder.properties();
        this.synthesizer = builder.synthesizer();
        this.classifier = builder.classifier();
        this.persistence = builder.persistence();
        this.analytics = builder.analytics();
        this.publisher = builder.publisher();
        this.metrics = builder.metrics();
        this.synthesisExecutor = builder.synthesisExecutor();
        this.handoffExecutor = builder.handoffExecutor();
        this.scheduler = builder.scheduler();
        this.onTeardown = builder.onTeardown();
        this.protocol = new HandoffProtocol(builder.sessionPort(),
                properties.getFarewellDelay(), properties.getSettleDelay());
        HandoffProperties.Creator c = properties.getCreator();
        this.creator = new Persona(c.name(), c.instructions(), c.voice());
    }

    /**
     * Starts the creator persona and greets the user. Called once when the context is created.
     *
     * @return accepted response, also when the session was already live or is still connecting
     * @throws HandoffException if the creator session cannot be started
     */
    public ToolResponse startSession() {
        try (CloseableThreadContext.Instance ignored = mdc()) {
            lock.lock();
            try {
                if (state.isTerminal()) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY, CLOSED_MESSAGE);
                }
                if (handoffInProgress) {
                    return ToolResponse.ok(HANDOFF_MESSAGE);
                }
                if (sessions.isOccupied()) {
                    return ToolResponse.ok(creator.name() + " is already live.");
                }
                handoffInProgress = true;
            } finally {
                lock.unlock();
            }

            bestEffort("startCall", () -> analytics.startCall(contextId, creator.name()));
            ManagedSession opened;
            try {
                opened = protocol.open(contextId, HandoffDirection.TO_CREATOR, sessions, creator,
                        ConversationScripts.greeting(creator.name()));
            } catch (HandoffException e) {
                endHandoff();
                metrics.recordHandoff(HandoffDirection.TO_CREATOR, false);
                bestEffort("recordError", () -> analytics.recordError(contextId, ErrorCode.HANDOFF_FAILED, e.getMessage()));
                throw e;
            }

            boolean closed = endHandoff();
            if (closed) {
                sessions.release(opened);
                opened.stop();
                return ToolResponse.rejected(ErrorCode.NOT_READY, CLOSED_MESSAGE);
            }
            metrics.recordHandoff(HandoffDirection.TO_CREATOR, true);
            LOG.info("Context started with persona '{}'", creator.name());
            return ToolResponse.ok(creator.name() + " is live.");
        }
    }

    /**
     * Records one requirement. Rejected with {@code LOCKED} exactly while a synthesis is running.
     *
     * @param field free-form requirement key, classified by {@link RequirementClassifier}
     * @param value spoken value
     */
    public ToolResponse storeRequirement(String field, String value) {
        try (CloseableThreadContext.Instance ignored = mdc()) {
            RequirementField recorded;
            boolean reopened = false;
            lock.lock();
            try {
                if (state == HandoffState.PROCESSING) {
                    return ToolResponse.rejected(ErrorCode.LOCKED,
                            "I'm creating your agent right now, so the requirements are locked. "
                                    + "You can make changes after the demo.");
                }
                if (state.isTerminal()) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY, CLOSED_MESSAGE);
                }
                if (handoffInProgress) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY, HANDOFF_MESSAGE);
                }
                if (field == null || field.isBlank()) {
                    return ToolResponse.rejected(ErrorCode.INCOMPLETE_REQUIREMENTS,
                            "Which detail is that? Tell me what the value describes.");
                }
                if (!RequirementsSnapshot.isMeaningful(value)) {
                    return ToolResponse.rejected(ErrorCode.INCOMPLETE_REQUIREMENTS,
                            "I didn't quite catch the " + field.trim() + ". Could you say that again?");
                }
                recorded = classifier.record(requirements, field, value);
                if (state == HandoffState.CONFIRMING) {
                    state = HandoffState.GATHERING;
                    reopened = true;
                }
            } finally {
                lock.unlock();
            }

            LOG.info("Stored requirement '{}' as {}: '{}'", field, recorded, LogSanitizer.preview(value));
            if (reopened) {
                announce(HandoffState.CONFIRMING, HandoffState.GATHERING, "requirements-changed");
            }
            return ToolResponse.ok("Got it, I've noted that.");
        }
    }

    /**
     * Moves to confirmation once the business name and type are usable.
     */
    public ToolResponse confirmRequirements() {
        try (CloseableThreadContext.Instance ignored = mdc()) {
            HandoffState from;
            RequirementsSnapshot snapshot;
            lock.lock();
            try {
                if (state == HandoffState.PROCESSING) {
                    return ToolResponse.rejected(ErrorCode.ALREADY_PROCESSING,
                            "I'm already creating your agent with the confirmed requirements.");
                }
                if (state.isTerminal()) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY, CLOSED_MESSAGE);
                }
                if (handoffInProgress) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY, HANDOFF_MESSAGE);
                }
                if (state == HandoffState.DEMO_ACTIVE) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY,
                            "The demo is running. Come back to " + creator.name() + " to change requirements.");
                }
                snapshot = requirements.snapshot();
                List<String> missing = snapshot.missingRequired();
                if (!missing.isEmpty()) {
                    return ToolResponse.rejected(ErrorCode.INCOMPLETE_REQUIREMENTS,
                            "I still need your " + String.join(" and ", missing) + " before we can continue.");
                }
                from = state;
                state = HandoffState.CONFIRMING;
            } finally {
                lock.unlock();
            }

            if (from != HandoffState.CONFIRMING) {
                announce(from, HandoffState.CONFIRMING, "confirm");
            }
            return ToolResponse.ok("Here's what I have:\n" + snapshot.summary()
                    + "Does that look right? Say yes and I'll create your agent.");
        }
    }

    /**
     * Locks the requirements and starts synthesis in the background. Returns without waiting.
     */
    public ToolResponse finalizeRequirements() {
        try (CloseableThreadContext.Instance ignored = mdc()) {
            SynthesisTask task;
            RequirementsSnapshot snapshot;
            lock.lock();
            try {
                if (state == HandoffState.PROCESSING) {
                    return ToolResponse.rejected(ErrorCode.ALREADY_PROCESSING,
                            "I'm already creating your agent. It will be ready in a moment.");
                }
                if (handoffInProgress) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY, HANDOFF_MESSAGE);
                }
                if (state != HandoffState.CONFIRMING) {
                    return ToolResponse.rejected(ErrorCode.NOT_CONFIRMED,
                            "Let's confirm the requirements summary first.");
                }
                snapshot = requirements.snapshot();
                task = new SynthesisTask(snapshot, synthesizer, new CancellationScope());
                synthesisTask = task;
                state = HandoffState.PROCESSING;
            } finally {
                lock.unlock();
            }

            announce(HandoffState.CONFIRMING, HandoffState.PROCESSING, "finalize");
            launch(task);
            return ToolResponse.ok("Perfect! I'm creating the agent for " + snapshot.businessName()
                    + " now. This will only take a few moments.");
        }
    }

    private void launch(SynthesisTask task) {
        task.result().whenCompleteAsync((spec, error) -> onSynthesisComplete(task, spec, error), handoffExecutor);
        EngagementLoop loop = new EngagementLoop(task, ConversationScripts.FILLERS,
                properties.getMaxFillerUtterances(), this::speakOnCurrent, handoffExecutor, metrics::recordFiller);
        try {
            loop.start(scheduler, properties.getEngagementInterval());
        } catch (RejectedExecutionException e) {
            LOG.warn("Engagement loop could not be scheduled: {}", e.toString());
        }
        task.start(synthesisExecutor, scheduler, properties.getSynthesisTimeout());
        LOG.info("Synthesis started (ceiling {} ms)", properties.getSynthesisTimeout().toMillis());
    }

    private void onSynthesisComplete(SynthesisTask task, AgentSpec spec, Throwable error) {
        try (CloseableThreadContext.Instance ignored = mdc()) {
            task.scope().cancel();
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof CancellationException) {
                LOG.debug("Synthesis cancelled");
                return;
            }
            if (cause == null) {
                onSynthesisSucceeded(task, spec);
            } else {
                onSynthesisFailed(task, cause);
            }
        } catch (RuntimeException e) {
            LOG.error("Synthesis completion handling failed for context {}", contextId, e);
        }
    }

    private void onSynthesisSucceeded(SynthesisTask task, AgentSpec spec) {
        lock.lock();
        try {
            if (synthesisTask != task || state != HandoffState.PROCESSING) {
                LOG.debug("Ignoring stale synthesis result");
                return;
            }
            agentSpec = spec;
        } finally {
            lock.unlock();
        }

        String savedId = persist(task.snapshot(), spec);

        lock.lock();
        try {
            if (synthesisTask != task || state != HandoffState.PROCESSING) {
                return;
            }
            synthesisTask = null;
            state = HandoffState.DEMO_READY;
            if (savedId != null) {
                savedAgentId = savedId;
            }
        } finally {
            lock.unlock();
        }

        long nanos = task.elapsedNanos();
        LOG.info("Synthesis succeeded in {} ms: '{}' (voice={})",
                TimeUnit.NANOSECONDS.toMillis(nanos), spec.agentType(), spec.voice());
        metrics.recordSynthesis(SynthesisCompletedEvent.SUCCESS, nanos);
        publish(new SynthesisCompletedEvent(contextId, SynthesisCompletedEvent.SUCCESS, spec.agentType(),
                TimeUnit.NANOSECONDS.toMillis(nanos), Instant.now()));
        announce(HandoffState.PROCESSING, HandoffState.DEMO_READY, "synthesis-complete");
        speakOnCurrent(ConversationScripts.ready(spec));
    }

    private void onSynthesisFailed(SynthesisTask task, Throwable cause) {
        boolean timedOut = cause instanceof SynthesisException se && se.isTimedOut();
        lock.lock();
        try {
            if (synthesisTask != task || state != HandoffState.PROCESSING) {
                return;
            }
            synthesisTask = null;
            state = HandoffState.GATHERING;
        } finally {
            lock.unlock();
        }

        long nanos = task.elapsedNanos();
        String outcome = timedOut ? SynthesisCompletedEvent.TIMEOUT : SynthesisCompletedEvent.FAILED;
        ErrorCode code = timedOut ? ErrorCode.SYNTHESIS_TIMEOUT : ErrorCode.SYNTHESIS_FAILED;
        if (timedOut) {
            LOG.warn("Synthesis timed out after {} ms; back to gathering", TimeUnit.NANOSECONDS.toMillis(nanos));
        } else {
            LOG.error("Synthesis failed; back to gathering", cause);
        }
        metrics.recordSynthesis(outcome, nanos);
        publish(new SynthesisCompletedEvent(contextId, outcome, null,
                TimeUnit.NANOSECONDS.toMillis(nanos), Instant.now()));
        bestEffort("recordError", () -> analytics.recordError(contextId, code, cause.getMessage()));
        announce(HandoffState.PROCESSING, HandoffState.GATHERING, "synthesis-" + outcome);
        speakOnCurrent(ConversationScripts.synthesisApology(timedOut));
    }

    private String persist(RequirementsSnapshot snapshot, AgentSpec spec) {
        try {
            String id = persistence.save(snapshot, spec);
            LOG.info("Agent configuration saved as {}", id);
            return id;
        } catch (RuntimeException e) {
            LOG.warn("Agent configuration not saved (non-fatal): {}", e.toString());
            bestEffort("recordError", () -> analytics.recordError(contextId, ErrorCode.PERSISTENCE_FAILED, e.getMessage()));
            return null;
        }
    }

    /**
     * Hands the room to the synthesized task persona. Returns immediately; the protocol runs in
     * the background.
     */
    public ToolResponse startDemo() {
        try (CloseableThreadContext.Instance ignored = mdc()) {
            AgentSpec spec;
            lock.lock();
            try {
                if (handoffInProgress) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY, "I'm already connecting you.");
                }
                if (state != HandoffState.DEMO_READY || agentSpec == null) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY, notReadyMessage(state));
                }
                handoffInProgress = true;
                spec = agentSpec;
            } finally {
                lock.unlock();
            }

            submitHandoff(HandoffDirection.TO_TASK_AGENT, spec, "demo-start");
            return ToolResponse.ok("Great! I'm connecting you to your " + spec.agentType() + " now.");
        }
    }

    /**
     * Starts another demo with the stored spec after a completed demo, without re-synthesis.
     */
    public ToolResponse tryDemoAgain() {
        try (CloseableThreadContext.Instance ignored = mdc()) {
            AgentSpec spec;
            HandoffState from;
            lock.lock();
            try {
                if (handoffInProgress) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY, "I'm already connecting you.");
                }
                if (!demoCompleted || agentSpec == null) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY,
                            "There's no earlier demo to repeat yet. Let's finish your requirements first.");
                }
                if (state != HandoffState.GATHERING && state != HandoffState.CONFIRMING
                        && state != HandoffState.DEMO_READY) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY, notReadyMessage(state));
                }
                from = state;
                state = HandoffState.DEMO_READY;
                handoffInProgress = true;
                spec = agentSpec;
            } finally {
                lock.unlock();
            }

            if (from != HandoffState.DEMO_READY) {
                announce(from, HandoffState.DEMO_READY, "demo-retry");
            }
            submitHandoff(HandoffDirection.TO_TASK_AGENT, spec, "demo-retry");
            return ToolResponse.ok("Sure! Connecting you to your " + spec.agentType() + " again.");
        }
    }

    /**
     * Ends the demo and hands the room back to the creator persona.
     */
    public ToolResponse handoffBackToCreator() {
        try (CloseableThreadContext.Instance ignored = mdc()) {
            AgentSpec spec;
            lock.lock();
            try {
                if (handoffInProgress || state != HandoffState.DEMO_ACTIVE) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY,
                            "There's no demo running to hand back from.");
                }
                handoffInProgress = true;
                demoCompleted = true;
                spec = agentSpec;
            } finally {
                lock.unlock();
            }

            submitHandoff(HandoffDirection.TO_CREATOR, spec, "demo-end");
            return ToolResponse.ok("Let me connect you back to " + creator.name() + " now.");
        }
    }

    private void submitHandoff(HandoffDirection direction, AgentSpec spec, String reason) {
        try {
            handoffExecutor.execute(() -> runHandoff(direction, spec, reason));
        } catch (RejectedExecutionException e) {
            onHandoffFailed(direction, HandoffExceptionBuilder.create("Handoff could not be scheduled")
                    .direction(direction)
                    .contextId(contextId)
                    .cause(e)
                    .build());
        }
    }

    private void runHandoff(HandoffDirection direction, AgentSpec spec, String reason) {
        try (CloseableThreadContext.Instance ignored = mdc()) {
            ManagedSession next;
            try {
                if (direction == HandoffDirection.TO_TASK_AGENT) {
                    next = protocol.execute(contextId, direction, sessions, () -> Persona.of(spec),
                            ConversationScripts.farewellToTaskAgent(spec, creator.name()),
                            ConversationScripts.taskAgentIntroduction(spec, creator.name()));
                } else {
                    next = protocol.execute(contextId, direction, sessions, () -> creator,
                            ConversationScripts.farewellToCreator(creator.name()),
                            ConversationScripts.creatorReturn(creator.name(), spec));
                }
            } catch (RuntimeException e) {
                onHandoffFailed(direction, e);
                return;
            }

            HandoffState expected = direction == HandoffDirection.TO_TASK_AGENT
                    ? HandoffState.DEMO_READY : HandoffState.DEMO_ACTIVE;
            HandoffState to = direction == HandoffDirection.TO_TASK_AGENT
                    ? HandoffState.DEMO_ACTIVE : HandoffState.GATHERING;
            HandoffState from;
            boolean committed;
            lock.lock();
            try {
                handoffInProgress = false;
                from = state;
                committed = state == expected;
                if (committed) {
                    state = to;
                }
            } finally {
                lock.unlock();
            }

            if (from.isTerminal()) {
                LOG.info("Context closed during handoff; stopping '{}'", next.personaName());
                sessions.release(next);
                next.stop();
                return;
            }
            if (!committed) {
                LOG.warn("State moved to {} during handoff {}; keeping it, '{}' is live",
                        from, direction.tag(), next.personaName());
                metrics.recordHandoff(direction, true);
                return;
            }
            metrics.recordHandoff(direction, true);
            announce(from, to, reason);
        }
    }

    private void onHandoffFailed(HandoffDirection direction, RuntimeException e) {
        LOG.error("Handoff {} failed: {}", direction.tag(), e.getMessage(), e);
        metrics.recordHandoff(direction, false);

        HandoffState from;
        boolean closed;
        lock.lock();
        try {
            closed = state.isTerminal();
            from = state;
            if (!closed) {
                state = HandoffState.GATHERING;
            }
        } finally {
            lock.unlock();
        }

        boolean restored = false;
        boolean reopened = false;
        if (!closed) {
            ManagedSession live = sessions.current();
            if (live != null) {
                live.speak(ConversationScripts.handoffApology());
                restored = true;
            } else {
                restored = restoreCreator();
                reopened = restored;
            }
        }
        if (endHandoff() && reopened) {
            ManagedSession orphan = sessions.detach();
            if (orphan != null) {
                orphan.stop();
            }
        }

        bestEffort("recordError", () -> analytics.recordError(contextId, ErrorCode.HANDOFF_FAILED, e.getMessage()));
        publish(new HandoffFailedEvent(contextId, direction, e.getMessage(), restored, Instant.now()));
        if (!closed && from != HandoffState.GATHERING) {
            announce(from, HandoffState.GATHERING, "handoff-failed");
        }
    }

    private boolean restoreCreator() {
        try {
            protocol.open(contextId, HandoffDirection.TO_CREATOR, sessions, creator,
                    ConversationScripts.handoffApology());
            LOG.info("Creator persona restored after failed handoff");
            return true;
        } catch (HandoffException e) {
            LOG.error("Creator persona could not be restored; context has no live session", e);
            bestEffort("recordError", () -> analytics.recordError(contextId, ErrorCode.HANDOFF_FAILED, e.getMessage()));
            return false;
        }
    }

    /**
     * Clears the handoff flag.
     *
     * @return true if the context was closed meanwhile
     */
    private boolean endHandoff() {
        lock.lock();
        try {
            handoffInProgress = false;
            return state.isTerminal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the conversation. A running synthesis is cancelled before this returns, and no filler
     * is spoken afterwards. The context is torn down after the configured grace delay.
     *
     * @param rating optional 1-5 rating, may be null
     */
    public ToolResponse closeSession(Integer rating) {
        try (CloseableThreadContext.Instance ignored = mdc()) {
            HandoffState from;
            SynthesisTask task;
            AgentSpec spec;
            lock.lock();
            try {
                if (state.isTerminal()) {
                    return ToolResponse.rejected(ErrorCode.NOT_READY, CLOSED_MESSAGE);
                }
                from = state;
                state = HandoffState.COMPLETED;
                task = synthesisTask;
                synthesisTask = null;
                spec = agentSpec;
            } finally {
                lock.unlock();
            }

            if (task != null) {
                task.cancel();
                LOG.info("In-flight synthesis cancelled by close");
            }
            announce(from, HandoffState.COMPLETED, "close");
            bestEffort("endCall", () -> analytics.endCall(contextId, CallStatus.COMPLETED, rating));
            String goodbye = ConversationScripts.goodbye(spec);
            speakOnCurrent(goodbye);
            scheduleTeardown();
            return ToolResponse.ok(goodbye);
        }
    }

    private void scheduleTeardown() {
        try {
            scheduler.schedule(this::teardown, Instant.now().plus(properties.getTeardownGrace()));
        } catch (RejectedExecutionException e) {
            LOG.warn("Teardown could not be scheduled, tearing down now: {}", e.toString());
            teardown();
        }
    }

    private void teardown() {
        try (CloseableThreadContext.Instance ignored = mdc()) {
            ManagedSession session = sessions.detach();
            if (session != null) {
                session.stop();
            }
            LOG.info("Context torn down");
            onTeardown.accept(this);
        }
    }

    /**
     * Restores a saved configuration as the current spec and makes it ready to demo.
     *
     * @param agentId persistence identifier
     */
    public ToolResponse loadSavedAgent(String agentId) {
        try (CloseableThreadContext.Instance ignored = mdc()) {
            ToolResponse guard = loadGuard();
            if (guard != null) {
                return guard;
            }
            if (agentId == null || agentId.isBlank()) {
                return ToolResponse.rejected(ErrorCode.NOT_READY, "Which saved agent should I load?");
            }

            Optional<SavedAgent> found;
            try {
                found = persistence.load(agentId);
            } catch (RuntimeException e) {
                LOG.warn("Saved agent {} could not be loaded: {}", agentId, e.toString());
                return ToolResponse.rejected(ErrorCode.NOT_READY, "I can't reach the saved agents right now.");
            }
            if (found.isEmpty()) {
                return ToolResponse.rejected(ErrorCode.NOT_READY, "I couldn't find a saved agent with that code.");
            }
            SavedAgent saved = found.get();

            HandoffState from;
            lock.lock();
            try {
                guard = loadGuard();
                if (guard != null) {
                    return guard;
                }
                from = state;
                requirements.restore(saved.requirements());
                agentSpec = saved.spec();
                savedAgentId = saved.id();
                state = HandoffState.DEMO_READY;
            } finally {
                lock.unlock();
            }

            LOG.info("Loaded saved agent {} ('{}')", saved.id(), saved.spec().agentType());
            announce(from, HandoffState.DEMO_READY, "load-saved-agent");
            return ToolResponse.ok("I've loaded your " + saved.spec().agentType()
                    + ". Would you like to try it now?");
        }
    }

    private ToolResponse loadGuard() {
        lock.lock();
        try {
            if (state == HandoffState.PROCESSING) {
                return ToolResponse.rejected(ErrorCode.LOCKED,
                        "I'm creating an agent right now. Let's load a saved one afterwards.");
            }
            if (handoffInProgress || (state != HandoffState.GATHERING && state != HandoffState.CONFIRMING)) {
                return ToolResponse.rejected(ErrorCode.NOT_READY, notReadyMessage(state));
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Advisory: which required or recommended details are still missing.
     */
    public ToolResponse checkRequirementsStatus() {
        RequirementsSnapshot snapshot = snapshot();
        List<String> required = snapshot.missingRequired();
        if (!required.isEmpty()) {
            return ToolResponse.ok("I still need: " + String.join(", ", required) + ".");
        }
        List<String> recommended = snapshot.missingRecommended();
        if (!recommended.isEmpty()) {
            return ToolResponse.ok("I have the essentials. It would also help to know your "
                    + String.join(", ", recommended) + ".");
        }
        return ToolResponse.ok("I have everything I need. Shall I read back the summary?");
    }

    /**
     * Summary read back before confirmation. Rejected while required details are missing.
     */
    public ToolResponse showRequirementsSummary() {
        RequirementsSnapshot snapshot = snapshot();
        List<String> missing = snapshot.missingRequired();
        if (!missing.isEmpty()) {
            return ToolResponse.rejected(ErrorCode.INCOMPLETE_REQUIREMENTS,
                    "I still need your " + String.join(" and ", missing) + ".");
        }
        return ToolResponse.ok(snapshot.summary());
    }

    /**
     * Advisory describing where the context stands.
     */
    public ToolResponse checkProcessingStatus() {
        HandoffState current = state();
        String message = switch (current) {
            case GATHERING -> "We're still gathering your requirements.";
            case CONFIRMING -> "Your requirements are ready to confirm. Shall I create your agent?";
            case PROCESSING -> "I'm still creating your agent. It will be ready in a moment.";
            case DEMO_READY -> "Your agent is ready! Would you like to try a live demo?";
            case DEMO_ACTIVE -> "The demo is running right now.";
            case COMPLETED -> CLOSED_MESSAGE;
        };
        return ToolResponse.ok(message);
    }

    /**
     * Advisory question about the next demo.
     */
    public ToolResponse askDemoPreference() {
        lock.lock();
        try {
            if (demoCompleted && agentSpec != null) {
                return ToolResponse.ok("Would you like to try the demo again, or make some changes first?");
            }
            return ToolResponse.ok("Once your agent is ready, would you like to try a live demo?");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Consistent view of the context for status endpoints and health checks.
     */
    public ContextStatus status() {
        lock.lock();
        try {
            ManagedSession live = sessions.current();
            return new ContextStatus(contextId, state, demoCompleted, handoffInProgress,
                    live == null ? null : live.personaName(),
                    agentSpec == null ? null : agentSpec.agentType(),
                    savedAgentId, requirements.snapshot());
        } finally {
            lock.unlock();
        }
    }

    public String contextId() {
        return contextId;
    }

    public HandoffState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminal() {
        return state().isTerminal();
    }

    /**
     * Stored spec, empty until a synthesis succeeded or a saved agent was loaded.
     */
    public Optional<AgentSpec> agentSpec() {
        lock.lock();
        try {
            return Optional.ofNullable(agentSpec);
        } finally {
            lock.unlock();
        }
    }

    ManagedSession currentSession() {
        return sessions.current();
    }

    private RequirementsSnapshot snapshot() {
        lock.lock();
        try {
            return requirements.snapshot();
        } finally {
            lock.unlock();
        }
    }

    private void speakOnCurrent(String text) {
        ManagedSession session = sessions.current();
        if (session == null) {
            LOG.debug("No live session to speak '{}'", LogSanitizer.preview(text));
            return;
        }
        session.speak(text);
    }

    private void announce(HandoffState from, HandoffState to, String reason) {
        LOG.info("State {} -> {} ({})", from, to, reason);
        metrics.recordTransition(from, to);
        publish(new StateTransitionEvent(contextId, from, to, reason, Instant.now()));
        bestEffort("logTransition", () -> analytics.logTransition(contextId, from.name(), to.name(), reason));
    }

    private void publish(Object event) {
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Event listener failed for {}: {}", event.getClass().getSimpleName(), e.toString());
        }
    }

    private void bestEffort(String action, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            LOG.warn("Analytics {} failed (non-fatal): {}", action, e.toString());
        }
    }

    private static String notReadyMessage(HandoffState state) {
        return switch (state) {
            case GATHERING, CONFIRMING -> "Your agent isn't ready yet. Let's finish the requirements first.";
            case PROCESSING -> "I'm still creating your agent. It will be ready in a moment.";
            case DEMO_READY -> "Your agent is ready for a demo.";
            case DEMO_ACTIVE -> "The demo is already running.";
            case COMPLETED -> CLOSED_MESSAGE;
        };
    }

    private CloseableThreadContext.Instance mdc() {
        return CloseableThreadContext.put(MDC_CONTEXT_ID, contextId);
    }
}
