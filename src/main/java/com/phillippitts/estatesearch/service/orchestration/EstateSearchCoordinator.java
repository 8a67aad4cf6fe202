package com.phillippitts.estatesearch.service.orchestration;

import com.phillippitts.estatesearch.config.properties.OrchestrationProperties;
import com.phillippitts.estatesearch.domain.CompositeResponse;
import com.phillippitts.estatesearch.domain.ResponseKind;
import com.phillippitts.estatesearch.exception.UnknownSessionException;
import com.phillippitts.estatesearch.service.channel.UserChannel;
import com.phillippitts.estatesearch.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.estatesearch.service.orchestration.event.DispatchFailedEvent;
import com.phillippitts.estatesearch.service.orchestration.event.SessionEvictedEvent;
import com.phillippitts.estatesearch.service.orchestration.event.TurnCompletedEvent;
import com.phillippitts.estatesearch.service.session.OutstandingRequest;
import com.phillippitts.estatesearch.service.session.Session;
import com.phillippitts.estatesearch.service.session.SessionPhase;
import com.phillippitts.estatesearch.service.session.SessionSnapshot;
import com.phillippitts.estatesearch.service.session.SessionStore;
import com.phillippitts.estatesearch.service.worker.message.ScopingVerdict;
import com.phillippitts.estatesearch.service.worker.message.WorkerReply;
import com.phillippitts.estatesearch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the orchestration engine.
 *
 * <p>Every input (user message, worker reply, dispatch failure, timeout sweep) is turned into
 * a task on the target session's mailbox, so a session's state is only ever touched by one
 * task at a time while different sessions progress in parallel. Within a task the
 * {@link Dispatcher} decides what to send next, the {@link Aggregator} commits results and
 * judges completion, and the {@link ResponseAssembler} builds the one response per turn.
 *
 * <p><b>Turn lifecycle:</b>
 * <pre>
 * user message → Scoping → (clarify | Intern answer | Research → enrichment fan-out → response)
 * </pre>
 * User messages that arrive while a turn is in flight are queued and acknowledged; the queue
 * drains once the turn ends.
 */
public class EstateSearchCoordinator {

    private static final Logger LOG = LogManager.getLogger(EstateSearchCoordinator.class);

    static final String PROCESSING = "Processing your request";
    static final String STILL_PROCESSING = "Still working on your previous request. Your message is queued.";
    static final String SCOPING_FAILED = "Sorry, I could not process your message right now. Please try again.";
    static final String ANSWER_FAILED = "Sorry, I could not find an answer to that right now.";

    private final SessionStore store;
    private final Dispatcher dispatcher;
    private final Aggregator aggregator;
    private final ResponseAssembler assembler;
    private final SessionStateMachine stateMachine;
    private final UserChannel channel;
    private final RetryScheduler retryScheduler;
    private final OrchestrationProperties properties;
    private final ApplicationEventPublisher publisher;
    private final OrchestrationMetricsPublisher metrics;
    private final Clock clock;

    private EstateSearchCoordinator(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
        this.aggregator = Objects.requireNonNull(builder.aggregator, "aggregator");
        this.assembler = Objects.requireNonNull(builder.assembler, "assembler");
        this.stateMachine = Objects.requireNonNull(builder.stateMachine, "stateMachine");
        this.channel = Objects.requireNonNull(builder.channel, "channel");
        this.retryScheduler = Objects.requireNonNull(builder.retryScheduler, "retryScheduler");
        this.properties = Objects.requireNonNull(builder.properties, "properties");
        this.publisher = Objects.requireNonNull(builder.publisher, "publisher");
        this.metrics = builder.metrics == null ? OrchestrationMetricsPublisher.NOOP : builder.metrics;
        this.clock = Objects.requireNonNull(builder.clock, "clock");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accepts a user message for the session, creating the session on first contact.
     *
     * @return {@link SubmissionStatus#QUEUED} if a turn appeared to be in flight
     * @throws IllegalArgumentException if the text is blank
     */
    public SubmissionStatus submitUserMessage(String sessionId, String text) {
        Objects.requireNonNull(sessionId, "sessionId");
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Message text must not be blank");
        }
        boolean busy = store.peek(sessionId).map(Session::isBusy).orElse(false);
        LOG.info("User message for session {}: {}", sessionId, LogSanitizer.preview(text));
        store.submitOrCreate(sessionId, session -> handleUserMessage(session, text));
        return busy ? SubmissionStatus.QUEUED : SubmissionStatus.ACCEPTED;
    }

    /**
     * Accepts a worker reply.
     *
     * @throws com.phillippitts.estatesearch.exception.InvalidWorkerReplyException if the reply is malformed
     * @throws UnknownSessionException if the reply names a session the store does not hold
     */
    public void onWorkerReply(WorkerReply reply) {
        reply.validate();
        if (!store.contains(reply.sessionId())) {
            LOG.error("Correlated {} reply {} references unknown session {}",
                    reply.kind(), reply.correlationId(), reply.sessionId());
            throw new UnknownSessionException(reply.sessionId(), reply.correlationId());
        }
        store.submit(reply.sessionId(), session -> handleReply(session, reply));
    }

    @EventListener
    public void onDispatchFailed(DispatchFailedEvent event) {
        boolean routed = store.submitIfPresent(event.sessionId(), session -> handleDispatchFailure(session, event));
        if (!routed) {
            LOG.warn("Dispatch failure {} for evicted session {} ignored", event.correlationId(), event.sessionId());
        }
    }

    /**
     * Times out overdue requests, closes expired enrichment windows and evicts idle sessions.
     */
    public void sweep() {
        for (Session session : store.sessions()) {
            if (session.needsSweep()) {
                store.submitIfPresent(session.id(), this::handleSweep);
            }
        }
        Instant now = clock.instant();
        List<String> evicted = store.evictIdle(now.minus(properties.getSessionIdleTimeout()));
        for (String sessionId : evicted) {
            publisher.publishEvent(new SessionEvictedEvent(sessionId, now));
        }
        if (!evicted.isEmpty()) {
            LOG.info("Evicted {} idle sessions", evicted.size());
        }
    }

    public Optional<SessionSnapshot> snapshot(String sessionId) {
        return store.peek(sessionId).map(Session::snapshot);
    }

    void handleUserMessage(Session session, String text) {
        Instant now = clock.instant();
        session.touch(now);
        if (session.isBusy()) {
            session.enqueueMessage(text);
            channel.acknowledge(session.id(), STILL_PROCESSING);
            LOG.info("Session busy in {}, queued message ({} pending)", session.phase(),
                    session.pendingMessageCount());
            return;
        }
        session.beginTurn(now, text);
        channel.acknowledge(session.id(), PROCESSING);
        dispatcher.dispatchScoping(session, text);
    }

    void handleReply(Session session, WorkerReply reply) {
        session.touch(clock.instant());
        aggregator.apply(session, reply).ifPresent(resolution -> onResolved(session, resolution));
    }

    void handleDispatchFailure(Session session, DispatchFailedEvent event) {
        Optional<OutstandingRequest> pending = session.outstanding(event.correlationId());
        if (pending.isEmpty()) {
            LOG.debug("Dispatch failure for {} ignored, no longer outstanding", event.correlationId());
            return;
        }
        OutstandingRequest request = pending.get();
        if (dispatcher.shouldRetry(request)) {
            Duration delay = dispatcher.retryDelay(request);
            String sessionId = session.id();
            String correlationId = request.correlationId();
            LOG.info("Scheduling retry of {} {} in {} ms", request.kind(), correlationId, delay.toMillis());
            retryScheduler.schedule(
                    () -> store.submitIfPresent(sessionId, s -> dispatcher.redispatch(s, correlationId)), delay);
            return;
        }
        aggregator.recordFailure(session, request.correlationId(), FailureReason.DISPATCH, event.message())
                .ifPresent(resolution -> onResolved(session, resolution));
    }

    void handleSweep(Session session) {
        Instant now = clock.instant();
        for (Resolution expired : aggregator.expireOverdue(session, now)) {
            onResolved(session, expired);
        }
        maybeFinalize(session);
    }

    private void onResolved(Session session, Resolution resolution) {
        switch (resolution.kind()) {
            case SCOPING -> onScopingResolved(session, resolution);
            case RESEARCH -> onResearchResolved(session, resolution);
            case INTERN -> onAnswerResolved(session, resolution);
            case GEOCODING -> {
                if (resolution.isSuccess()) {
                    session.property(resolution.propertyIndex())
                            .ifPresent(record -> dispatcher.chainDiscovery(session, record));
                }
                maybeFinalize(session);
            }
            default -> maybeFinalize(session);
        }
    }

    private void onScopingResolved(Session session, Resolution resolution) {
        if (!resolution.isSuccess()) {
            channel.clarify(session.id(), SCOPING_FAILED);
            drainPending(session);
            return;
        }
        RoutingDecision decision = dispatcher.route(session, (ScopingVerdict) resolution.payload());
        LOG.info("Scoping verdict routed to {}", decision.route());
        switch (decision.route()) {
            case CLARIFY -> {
                channel.clarify(session.id(), decision.message());
                drainPending(session);
            }
            case SEARCH, ANSWER -> acknowledgeIfPresent(session, decision.message());
            case FOLLOW_UP -> {
                acknowledgeIfPresent(session, decision.message());
                maybeFinalize(session);
            }
        }
    }

    private void onResearchResolved(Session session, Resolution resolution) {
        if (!resolution.isSuccess() || !session.hasResultSet()) {
            finalizeNoMatches(session, !resolution.isSuccess());
            return;
        }
        int found = session.totalFound();
        channel.acknowledge(session.id(),
                "Found " + found + (found == 1 ? " property" : " properties") + "! Gathering location details");
        dispatcher.beginEnrichment(session);
        maybeFinalize(session);
    }

    private void onAnswerResolved(Session session, Resolution resolution) {
        if (session.phase() == SessionPhase.ENRICHING) {
            maybeFinalize(session);
            return;
        }
        if (resolution.isSuccess() && session.generalAnswer() != null) {
            deliver(session, ResponseKind.ANSWER, false);
        } else {
            channel.clarify(session.id(), ANSWER_FAILED);
        }
        drainPending(session);
    }

    private void maybeFinalize(Session session) {
        if (!aggregator.isComplete(session, clock.instant())) {
            return;
        }
        List<Resolution> unresolved = aggregator.expireRemaining(session);
        if (!unresolved.isEmpty()) {
            LOG.info("Enrichment window closed with {} requests unresolved", unresolved.size());
        }
        stateMachine.transition(session, SessionPhase.FINALIZED);
        deliver(session, ResponseKind.RESULTS, false);
        drainPending(session);
    }

    private void finalizeNoMatches(Session session, boolean searchFailed) {
        List<OutstandingRequest> dropped = session.dropOutstanding();
        if (!dropped.isEmpty()) {
            LOG.debug("Dropped {} session-level requests with the empty search", dropped.size());
        }
        stateMachine.transition(session, SessionPhase.FINALIZED);
        deliver(session, ResponseKind.NO_MATCHES, searchFailed);
        drainPending(session);
    }

    private void deliver(Session session, ResponseKind kind, boolean searchFailed) {
        int turn = session.completeTurn();
        CompositeResponse response = switch (kind) {
            case RESULTS -> assembler.assembleResults(session, turn);
            case NO_MATCHES -> assembler.assembleNoMatches(session, turn, searchFailed);
            case ANSWER -> assembler.assembleAnswer(session, turn);
        };
        channel.deliver(response);
        Duration latency = session.turnStartedAt() == null
                ? Duration.ZERO
                : Duration.between(session.turnStartedAt(), clock.instant());
        metrics.recordTurn(kind, latency);
        publisher.publishEvent(new TurnCompletedEvent(response, latency));
        LOG.info("Turn {} completed: {} with {} properties, map={}, latency={} ms",
                turn, kind, response.properties().size(), response.hasMap(), latency.toMillis());
    }

    private void drainPending(Session session) {
        if (session.isBusy()) {
            return;
        }
        session.pollPendingMessage().ifPresent(text -> {
            LOG.info("Processing queued message for session {}", session.id());
            handleUserMessage(session, text);
        });
    }

    private void acknowledgeIfPresent(Session session, String message) {
        if (message != null && !message.isBlank()) {
            channel.acknowledge(session.id(), message);
        }
    }

    /**
     * Builder for {@link EstateSearchCoordinator}. Metrics default to
     * {@link OrchestrationMetricsPublisher#NOOP}.
     */
    public static final class Builder {
        private SessionStore store;
        private Dispatcher dispatcher;
        private Aggregator aggregator;
        private ResponseAssembler assembler;
        private SessionStateMachine stateMachine;
        private UserChannel channel;
        private RetryScheduler retryScheduler;
        private OrchestrationProperties properties;
        private ApplicationEventPublisher publisher;
        private OrchestrationMetricsPublisher metrics;
        private Clock clock;

        private Builder() {
        }

        public Builder sessionStore(SessionStore store) {
            this.store = store;
            return this;
        }

        public Builder dispatcher(Dispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder aggregator(Aggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder responseAssembler(ResponseAssembler assembler) {
            this.assembler = assembler;
            return this;
        }

        public Builder stateMachine(SessionStateMachine stateMachine) {
            this.stateMachine = stateMachine;
            return this;
        }

        public Builder userChannel(UserChannel channel) {
            this.channel = channel;
            return this;
        }

        public Builder retryScheduler(RetryScheduler retryScheduler) {
            this.retryScheduler = retryScheduler;
            return this;
        }

        public Builder properties(OrchestrationProperties properties) {
            this.properties = properties;
            return this;
        }

        public Builder publisher(ApplicationEventPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder metrics(OrchestrationMetricsPublisher metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public EstateSearchCoordinator build() {
            return new EstateSearchCoordinator(this);
        }
    }
}
