package com.phillippitts.estatesearch.service.orchestration;

import com.phillippitts.estatesearch.config.properties.OrchestrationProperties;
import com.phillippitts.estatesearch.domain.SearchRequirements;
import com.phillippitts.estatesearch.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.estatesearch.service.orchestration.RoutingDecision.Route;
import com.phillippitts.estatesearch.service.orchestration.event.DispatchFailedEvent;
import com.phillippitts.estatesearch.service.session.OutstandingRequest;
import com.phillippitts.estatesearch.service.session.PropertyRecord;
import com.phillippitts.estatesearch.service.session.Session;
import com.phillippitts.estatesearch.service.session.SessionPhase;
import com.phillippitts.estatesearch.service.worker.WorkerDirectory;
import com.phillippitts.estatesearch.service.worker.WorkerKind;
import com.phillippitts.estatesearch.service.worker.message.CommunityQuery;
import com.phillippitts.estatesearch.service.worker.message.DiscoveryQuery;
import com.phillippitts.estatesearch.service.worker.message.GeneralQuestion;
import com.phillippitts.estatesearch.service.worker.message.GeocodingQuery;
import com.phillippitts.estatesearch.service.worker.message.NegotiationBrief;
import com.phillippitts.estatesearch.service.worker.message.ProbeQuery;
import com.phillippitts.estatesearch.service.worker.message.RequestPayload;
import com.phillippitts.estatesearch.service.worker.message.ResearchQuery;
import com.phillippitts.estatesearch.service.worker.message.ScopingQuery;
import com.phillippitts.estatesearch.service.worker.message.ScopingVerdict;
import com.phillippitts.estatesearch.service.worker.message.WorkerRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Decides which workers to invoke next and sends their requests.
 *
 * <p><b>Idempotent dispatch:</b> a request is never sent while an unresolved request of the
 * same kind for the same property (or the same session-level slot) is outstanding.
 *
 * <p><b>Fire-and-forget:</b> requests are tracked as {@link OutstandingRequest}s before they
 * are handed to the endpoint, and the dispatcher never waits for an answer. Endpoints that
 * refuse a request surface as a {@link DispatchFailedEvent}, which the coordinator feeds back
 * through the session's mailbox to {@link #shouldRetry(OutstandingRequest)} and
 * {@link #redispatch(Session, String)}.
 *
 * <p>All methods except event publication run on the owning session's mailbox.
 */
public class Dispatcher {

    private static final Logger LOG = LogManager.getLogger(Dispatcher.class);

    private final WorkerDirectory directory;
    private final SessionStateMachine stateMachine;
    private final OrchestrationProperties properties;
    private final ApplicationEventPublisher publisher;
    private final OrchestrationMetricsPublisher metrics;
    private final Clock clock;
    private final Supplier<String> correlationIds;

    public Dispatcher(WorkerDirectory directory,
                      SessionStateMachine stateMachine,
                      OrchestrationProperties properties,
                      ApplicationEventPublisher publisher,
                      OrchestrationMetricsPublisher metrics,
                      Clock clock) {
        this(directory, stateMachine, properties, publisher, metrics, clock, () -> UUID.randomUUID().toString());
    }

    public Dispatcher(WorkerDirectory directory,
                      SessionStateMachine stateMachine,
                      OrchestrationProperties properties,
                      ApplicationEventPublisher publisher,
                      OrchestrationMetricsPublisher metrics,
                      Clock clock,
                      Supplier<String> correlationIds) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? OrchestrationMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.correlationIds = Objects.requireNonNull(correlationIds, "correlationIds");
    }

    /** Sends the user's message to the Scoping worker. */
    public Optional<OutstandingRequest> dispatchScoping(Session session, String userMessage) {
        return dispatch(session, WorkerKind.SCOPING, null, new ScopingQuery(userMessage));
    }

    /**
     * Routes a Scoping verdict: clarify, start a new search, answer a general question, or
     * follow up on the current result set.
     *
     * <p>Leaving FINALIZED is decided here. A follow-up (question or negotiation) on an existing
     * result set re-enters ENRICHING; a new search reopens requirement collection and moves on
     * to SEARCHING. Complete requirements identical to the ones the current results were
     * searched with do not trigger a second search.
     */
    public RoutingDecision route(Session session, ScopingVerdict verdict) {
        if (verdict.requirements() != null) {
            session.setRequirements(verdict.requirements());
        }
        if (verdict.negotiatePropertyNumber() != null) {
            return routeNegotiation(session, verdict.negotiatePropertyNumber());
        }
        if (verdict.generalQuestion()) {
            return routeQuestion(session, verdict);
        }
        SearchRequirements requirements = session.requirements();
        if (requirements != null && requirements.isComplete() && !alreadySearched(session, requirements)) {
            return startSearch(session, requirements, verdict.communityName());
        }
        return clarify(session, verdict.agentMessage());
    }

    /**
     * Moves SEARCHING → ENRICHING and fans out enrichment for every property: geocoding always,
     * community analysis and leverage probing when enabled. Local discovery follows each
     * successful geocode (see {@link #chainDiscovery(Session, PropertyRecord)}).
     *
     * @return number of requests dispatched
     */
    public int beginEnrichment(Session session) {
        stateMachine.transition(session, SessionPhase.ENRICHING);
        session.setEnrichmentDeadline(clock.instant().plus(properties.getEnrichmentWindow()));
        int dispatched = 0;
        for (PropertyRecord record : session.properties()) {
            String location = record.listing().locationQuery();
            dispatched += count(dispatch(session, WorkerKind.GEOCODING, record.index(), new GeocodingQuery(location)));
            if (properties.isEnabled(WorkerKind.COMMUNITY_ANALYSIS)) {
                dispatched += count(dispatch(session, WorkerKind.COMMUNITY_ANALYSIS, record.index(),
                        new CommunityQuery(location)));
            }
            if (properties.isEnabled(WorkerKind.PROBER)) {
                dispatched += count(dispatch(session, WorkerKind.PROBER, record.index(), new ProbeQuery(location)));
            }
        }
        LOG.info("Enriching {} properties with {} requests (window {})",
                session.propertyCount(), dispatched, properties.getEnrichmentWindow());
        return dispatched;
    }

    /**
     * Dispatches point-of-interest discovery for a freshly geocoded property.
     */
    public Optional<OutstandingRequest> chainDiscovery(Session session, PropertyRecord record) {
        if (!properties.isEnabled(WorkerKind.LOCAL_DISCOVERY)
                || record.coordinates() == null
                || session.phase() != SessionPhase.ENRICHING
                || session.isFinalizedThisTurn()) {
            return Optional.empty();
        }
        return dispatch(session, WorkerKind.LOCAL_DISCOVERY, record.index(),
                new DiscoveryQuery(record.coordinates().latitude(), record.coordinates().longitude()));
    }

    /** Whether a request that failed to dispatch still has retries left. */
    public boolean shouldRetry(OutstandingRequest request) {
        return request.attempt() <= properties.getMaxRetries();
    }

    /** Backoff before re-dispatching a request that failed on the given attempt. */
    public Duration retryDelay(OutstandingRequest request) {
        long factor = 1L << Math.min(request.attempt() - 1, 10);
        return properties.getRetryBackoff().multipliedBy(factor);
    }

    /**
     * Re-sends a request under a fresh correlation id. A no-op when the request resolved in the
     * meantime (timed out or dropped with its result set).
     */
    public Optional<OutstandingRequest> redispatch(Session session, String correlationId) {
        Optional<OutstandingRequest> previous = session.resolve(correlationId);
        if (previous.isEmpty()) {
            LOG.debug("Retry skipped, {} no longer outstanding", correlationId);
            return Optional.empty();
        }
        OutstandingRequest failed = previous.get();
        WorkerRequest retry = failed.request().withCorrelationId(correlationIds.get(), clock.instant());
        LOG.info("Retrying {} for property {} (attempt {})", failed.kind(), failed.propertyIndex(),
                failed.attempt() + 1);
        return Optional.of(send(session, retry, failed.attempt() + 1));
    }

    /**
     * Dispatches one request unless an equivalent one is still outstanding.
     *
     * @param propertyIndex target property, {@code null} for session-level requests
     * @return the tracked request, or empty when suppressed as a duplicate
     */
    public Optional<OutstandingRequest> dispatch(Session session, WorkerKind kind, Integer propertyIndex,
                                                 RequestPayload payload) {
        Optional<OutstandingRequest> existing = session.findOutstanding(kind, propertyIndex);
        if (existing.isPresent()) {
            LOG.debug("Suppressed duplicate {} for property {} ({} still outstanding)",
                    kind, propertyIndex, existing.get().correlationId());
            return Optional.empty();
        }
        WorkerRequest request = new WorkerRequest(correlationIds.get(), session.id(), kind, propertyIndex,
                payload, clock.instant());
        return Optional.of(send(session, request, 1));
    }

    private OutstandingRequest send(Session session, WorkerRequest request, int attempt) {
        Instant deadline = request.issuedAt().plus(properties.getRequestTimeout());
        OutstandingRequest outstanding = new OutstandingRequest(request, deadline, attempt);
        session.track(outstanding);
        metrics.recordDispatch(request.kind(), attempt);
        LOG.debug("Dispatching {} {} (property={}, attempt={})",
                request.kind(), request.correlationId(), request.propertyIndex(), attempt);
        try {
            directory.endpointFor(request.kind())
                    .send(request)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            reportDispatchFailure(request, unwrap(error));
                        }
                    });
        } catch (RuntimeException e) {
            reportDispatchFailure(request, e);
        }
        return outstanding;
    }

    private void reportDispatchFailure(WorkerRequest request, Throwable error) {
        LOG.warn("Dispatch of {} {} failed: {}", request.kind(), request.correlationId(), error.getMessage());
        publisher.publishEvent(new DispatchFailedEvent(request.sessionId(), request.correlationId(),
                request.kind(), String.valueOf(error.getMessage()), clock.instant()));
    }

    private RoutingDecision routeNegotiation(Session session, int propertyNumber) {
        if (!canFollowUp(session)) {
            return clarify(session, "There are no search results to negotiate on yet. "
                    + "Tell me what you are looking for first.");
        }
        Optional<PropertyRecord> target = session.property(propertyNumber - 1);
        if (target.isEmpty()) {
            return clarify(session, "Property #" + propertyNumber + " is not in the current results. "
                    + "Choose a number between 1 and " + session.propertyCount() + ".");
        }
        PropertyRecord record = target.get();
        enterFollowUp(session);
        dispatch(session, WorkerKind.NEGOTIATOR, record.index(),
                new NegotiationBrief(record.listing(), record.leverage(), session.requirements()));
        return new RoutingDecision(Route.FOLLOW_UP,
                "Contacting the listing agent about property #" + propertyNumber);
    }

    private RoutingDecision routeQuestion(Session session, ScopingVerdict verdict) {
        String question = firstNonBlank(verdict.question(), session.currentMessage());
        if (canFollowUp(session)) {
            enterFollowUp(session);
            dispatch(session, WorkerKind.INTERN, null, new GeneralQuestion(question));
            return new RoutingDecision(Route.FOLLOW_UP, verdict.agentMessage());
        }
        stateMachine.reopen(session);
        dispatch(session, WorkerKind.INTERN, null, new GeneralQuestion(question));
        return new RoutingDecision(Route.ANSWER, verdict.agentMessage());
    }

    private RoutingDecision startSearch(Session session, SearchRequirements requirements, String communityName) {
        stateMachine.reopen(session);
        stateMachine.transition(session, SessionPhase.SEARCHING);
        List<OutstandingRequest> dropped = session.startNewResultSet(requirements);
        if (!dropped.isEmpty()) {
            LOG.info("New search dropped {} outstanding requests of the previous result set", dropped.size());
        }
        dispatch(session, WorkerKind.RESEARCH, null, new ResearchQuery(requirements, properties.getMaxProperties()));
        if (communityName != null && !communityName.isBlank()) {
            dispatch(session, WorkerKind.COMMUNITY_ANALYSIS, null, new CommunityQuery(communityName));
        }
        return new RoutingDecision(Route.SEARCH, "Searching for properties");
    }

    private RoutingDecision clarify(Session session, String agentMessage) {
        if (session.phase() == SessionPhase.COLLECTING_REQUIREMENTS
                || (session.phase() == SessionPhase.FINALIZED && !session.hasResultSet())) {
            stateMachine.reopen(session);
        }
        String message = agentMessage;
        if (message == null || message.isBlank()) {
            message = defaultClarification(session.requirements());
        }
        return new RoutingDecision(Route.CLARIFY, message);
    }

    private void enterFollowUp(Session session) {
        stateMachine.transition(session, SessionPhase.ENRICHING);
        session.setEnrichmentDeadline(clock.instant().plus(properties.getEnrichmentWindow()));
    }

    private static boolean canFollowUp(Session session) {
        return session.phase() == SessionPhase.FINALIZED && session.hasResultSet();
    }

    private static boolean alreadySearched(Session session, SearchRequirements requirements) {
        return session.hasResultSet() && requirements.equals(session.searchedRequirements());
    }

    static String defaultClarification(SearchRequirements requirements) {
        SearchRequirements current = requirements != null
                ? requirements
                : new SearchRequirements(null, null, null, null, null, null);
        List<String> missing = current.missingFields();
        if (missing.isEmpty()) {
            return "Is there anything else you would like to know about these properties?";
        }
        return "To start searching I still need your " + String.join(", ", missing) + ".";
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }

    private static int count(Optional<OutstandingRequest> dispatched) {
        return dispatched.isPresent() ? 1 : 0;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
