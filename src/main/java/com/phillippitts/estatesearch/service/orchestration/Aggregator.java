package com.phillippitts.estatesearch.service.orchestration;

import com.phillippitts.estatesearch.config.properties.OrchestrationProperties;
import com.phillippitts.estatesearch.domain.Listing;
import com.phillippitts.estatesearch.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.estatesearch.service.orchestration.event.EnrichmentFailedEvent;
import com.phillippitts.estatesearch.service.session.OutstandingRequest;
import com.phillippitts.estatesearch.service.session.PropertyRecord;
import com.phillippitts.estatesearch.service.session.Session;
import com.phillippitts.estatesearch.service.session.SessionPhase;
import com.phillippitts.estatesearch.service.worker.message.CommunityResult;
import com.phillippitts.estatesearch.service.worker.message.DiscoveryResult;
import com.phillippitts.estatesearch.service.worker.message.GeneralAnswer;
import com.phillippitts.estatesearch.service.worker.message.GeocodingResult;
import com.phillippitts.estatesearch.service.worker.message.NegotiationResult;
import com.phillippitts.estatesearch.service.worker.message.ProbeResult;
import com.phillippitts.estatesearch.service.worker.message.ReplyPayload;
import com.phillippitts.estatesearch.service.worker.message.ResearchResult;
import com.phillippitts.estatesearch.service.worker.message.WorkerReply;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Merges worker replies into session state and decides when a turn is complete.
 *
 * <p>Each reply is matched to its {@link OutstandingRequest} by correlation id. A reply whose
 * request is no longer outstanding (a duplicate delivery, or a late reply after a timeout or a
 * new search) is a no-op. Failures of any kind resolve the request permanently and leave the
 * corresponding field absent; they never fail the turn.
 *
 * <p><b>Completion predicate:</b> the session is ENRICHING, has not been finalized this turn,
 * and either nothing is outstanding or the enrichment window has closed. Because it depends
 * only on the set of unresolved requests and the clock, it holds regardless of the order in
 * which replies arrived.
 */
public class Aggregator {

    private static final Logger LOG = LogManager.getLogger(Aggregator.class);

    private final OrchestrationProperties properties;
    private final ApplicationEventPublisher publisher;
    private final OrchestrationMetricsPublisher metrics;
    private final Clock clock;

    public Aggregator(OrchestrationProperties properties,
                      ApplicationEventPublisher publisher,
                      OrchestrationMetricsPublisher metrics,
                      Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? OrchestrationMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Applies a worker reply.
     *
     * @return the resolution, or empty when the reply did not correlate with an outstanding request
     */
    public Optional<Resolution> apply(Session session, WorkerReply reply) {
        Optional<OutstandingRequest> pending = session.outstanding(reply.correlationId());
        if (pending.isEmpty()) {
            LOG.debug("Ignoring {} reply {}: not outstanding (duplicate or late)", reply.kind(), reply.correlationId());
            return Optional.empty();
        }
        OutstandingRequest request = pending.get();
        if (request.kind() != reply.kind()) {
            LOG.warn("Ignoring reply {}: expected {} but {} replied", reply.correlationId(), request.kind(), reply.kind());
            return Optional.empty();
        }
        session.resolve(reply.correlationId());
        if (!reply.success()) {
            return Optional.of(fail(session, request, FailureReason.WORKER, reply.errorOrDefault()));
        }
        commit(session, request, reply.result());
        LOG.debug("Committed {} for property {}", request.kind(), request.propertyIndex());
        return Optional.of(Resolution.succeeded(request, reply.result()));
    }

    /**
     * Resolves an outstanding request as a permanent failure.
     *
     * @return the resolution, or empty if the request was already resolved
     */
    public Optional<Resolution> recordFailure(Session session, String correlationId, FailureReason reason,
                                              String detail) {
        return session.resolve(correlationId).map(request -> fail(session, request, reason, detail));
    }

    /**
     * Times out every outstanding request whose deadline has passed.
     */
    public List<Resolution> expireOverdue(Session session, Instant now) {
        List<Resolution> expired = new ArrayList<>();
        for (OutstandingRequest request : session.outstandingRequests()) {
            if (request.isExpired(now)) {
                session.resolve(request.correlationId());
                expired.add(fail(session, request, FailureReason.TIMEOUT, "no reply by " + request.deadline()));
            }
        }
        return expired;
    }

    /**
     * Times out everything still outstanding. Used when the enrichment window forces the turn
     * to finalize.
     */
    public List<Resolution> expireRemaining(Session session) {
        List<Resolution> expired = new ArrayList<>();
        for (OutstandingRequest request : session.outstandingRequests()) {
            session.resolve(request.correlationId());
            expired.add(fail(session, request, FailureReason.TIMEOUT, "enrichment window closed"));
        }
        return expired;
    }

    public boolean isComplete(Session session, Instant now) {
        if (session.phase() != SessionPhase.ENRICHING || session.isFinalizedThisTurn()) {
            return false;
        }
        if (session.outstandingCount() == 0) {
            return true;
        }
        Instant deadline = session.enrichmentDeadline();
        return deadline != null && !now.isBefore(deadline);
    }

    private void commit(Session session, OutstandingRequest request, ReplyPayload payload) {
        if (payload instanceof ResearchResult research) {
            commitResearch(session, research);
            return;
        }
        if (payload instanceof GeneralAnswer answer) {
            session.setGeneralAnswer(answer.answer());
            return;
        }
        if (payload instanceof NegotiationResult negotiation) {
            session.setNegotiationSummary(negotiation.outcome() == null ? null : negotiation.outcome().summaryText());
            return;
        }
        if (request.isSessionLevel()) {
            if (payload instanceof CommunityResult community) {
                session.setCommunity(community.analysis());
            }
            // Scoping verdicts carry no state to merge; the dispatcher routes them
            return;
        }
        Optional<PropertyRecord> target = session.property(request.propertyIndex());
        if (target.isEmpty()) {
            LOG.error("Reply {} targets property {} which session {} does not hold",
                    request.correlationId(), request.propertyIndex(), session.id());
            return;
        }
        PropertyRecord record = target.get();
        if (payload instanceof GeocodingResult geocoding) {
            record.setCoordinates(geocoding.coordinates());
        } else if (payload instanceof DiscoveryResult discovery) {
            record.setPointsOfInterest(discovery.pointsOfInterest());
        } else if (payload instanceof CommunityResult community) {
            record.setCommunity(community.analysis());
        } else if (payload instanceof ProbeResult probe) {
            record.setLeverage(probe.report());
        }
    }

    private void commitResearch(Session session, ResearchResult research) {
        List<Listing> listings = research.listings();
        int kept = Math.min(listings.size(), properties.getMaxProperties());
        session.createPropertyRecords(listings.subList(0, kept));
        session.setSearchOutcome(research.searchSummary(), Math.max(research.totalFound(), listings.size()));
        LOG.info("Research returned {} candidates, tracking {}", listings.size(), kept);
    }

    private Resolution fail(Session session, OutstandingRequest request, FailureReason reason, String detail) {
        if (!request.isSessionLevel()) {
            session.property(request.propertyIndex()).ifPresent(record -> record.markFailed(request.kind()));
        }
        LOG.warn("{} for property {} failed permanently ({}): {}",
                request.kind(), request.propertyIndex(), reason.tag(), detail);
        metrics.recordFailure(request.kind(), reason);
        publisher.publishEvent(new EnrichmentFailedEvent(session.id(), request.kind(), request.propertyIndex(),
                reason, detail, clock.instant()));
        return Resolution.failed(request, reason);
    }
}
