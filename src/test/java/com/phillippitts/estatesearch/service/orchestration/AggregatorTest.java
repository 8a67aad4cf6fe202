package com.phillippitts.estatesearch.service.orchestration;

import com.phillippitts.estatesearch.config.properties.OrchestrationProperties;
import com.phillippitts.estatesearch.service.orchestration.event.EnrichmentFailedEvent;
import com.phillippitts.estatesearch.service.session.OutstandingRequest;
import com.phillippitts.estatesearch.service.session.Session;
import com.phillippitts.estatesearch.service.session.SessionPhase;
import com.phillippitts.estatesearch.service.worker.WorkerKind;
import com.phillippitts.estatesearch.service.worker.message.CommunityQuery;
import com.phillippitts.estatesearch.service.worker.message.CommunityResult;
import com.phillippitts.estatesearch.service.worker.message.GeocodingQuery;
import com.phillippitts.estatesearch.service.worker.message.GeocodingResult;
import com.phillippitts.estatesearch.service.worker.message.ProbeQuery;
import com.phillippitts.estatesearch.service.worker.message.ProbeResult;
import com.phillippitts.estatesearch.service.worker.message.RequestPayload;
import com.phillippitts.estatesearch.service.worker.message.ResearchQuery;
import com.phillippitts.estatesearch.service.worker.message.ResearchResult;
import com.phillippitts.estatesearch.service.worker.message.WorkerReply;
import com.phillippitts.estatesearch.service.worker.message.WorkerRequest;
import com.phillippitts.estatesearch.testutil.Fixtures;
import com.phillippitts.estatesearch.testutil.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AggregatorTest {

    private final MutableClock clock = MutableClock.startingAt("2025-03-01T12:00:00Z");
    private final List<Object> events = new ArrayList<>();
    private final ApplicationEventPublisher publisher = events::add;
    private final SessionStateMachine stateMachine = new SessionStateMachine();
    private final Aggregator aggregator = new Aggregator(OrchestrationProperties.defaults(), publisher, null, clock);

    private int nextId;

    private Session enrichingSession(int listings) {
        Session session = new Session("s1", clock.instant());
        stateMachine.transition(session, SessionPhase.SEARCHING);
        session.startNewResultSet(Fixtures.completeRequirements());
        session.createPropertyRecords(Fixtures.listings(listings));
        stateMachine.transition(session, SessionPhase.ENRICHING);
        session.setEnrichmentDeadline(clock.instant().plusSeconds(30));
        return session;
    }

    private WorkerRequest track(Session session, WorkerKind kind, Integer propertyIndex, RequestPayload payload) {
        WorkerRequest request = new WorkerRequest("c" + (++nextId), session.id(), kind, propertyIndex, payload,
                clock.instant());
        session.track(new OutstandingRequest(request, clock.instant().plusSeconds(10), 1));
        return request;
    }

    @Test
    void commitsPropertyEnrichmentToItsRecord() {
        Session session = enrichingSession(2);
        WorkerRequest geocode = track(session, WorkerKind.GEOCODING, 1, new GeocodingQuery("a"));
        WorkerRequest probe = track(session, WorkerKind.PROBER, 0, new ProbeQuery("b"));

        aggregator.apply(session, WorkerReply.success(geocode, new GeocodingResult(Fixtures.coordinates(2))));
        aggregator.apply(session, WorkerReply.success(probe, new ProbeResult(Fixtures.leverage())));

        assertThat(session.property(1).orElseThrow().coordinates()).isEqualTo(Fixtures.coordinates(2));
        assertThat(session.property(0).orElseThrow().leverage()).isEqualTo(Fixtures.leverage());
        assertThat(session.property(0).orElseThrow().coordinates()).isNull();
        assertThat(session.outstandingCount()).isZero();
    }

    @Test
    void sessionLevelCommunityGoesToSession() {
        Session session = enrichingSession(1);
        WorkerRequest community = track(session, WorkerKind.COMMUNITY_ANALYSIS, null, new CommunityQuery("Mission"));

        aggregator.apply(session, WorkerReply.success(community, new CommunityResult(Fixtures.community("Mission"))));

        assertThat(session.community().location()).isEqualTo("Mission");
        assertThat(session.property(0).orElseThrow().community()).isNull();
    }

    @Test
    void secondReplyForSameRequestIsNoOp() {
        Session session = enrichingSession(1);
        WorkerRequest geocode = track(session, WorkerKind.GEOCODING, 0, new GeocodingQuery("a"));

        Optional<Resolution> first = aggregator.apply(session,
                WorkerReply.success(geocode, new GeocodingResult(Fixtures.coordinates(1))));
        Optional<Resolution> second = aggregator.apply(session,
                WorkerReply.success(geocode, new GeocodingResult(Fixtures.coordinates(5))));

        assertThat(first).hasValueSatisfying(r -> assertThat(r.isSuccess()).isTrue());
        assertThat(second).isEmpty();
        assertThat(session.property(0).orElseThrow().coordinates()).isEqualTo(Fixtures.coordinates(1));
    }

    @Test
    void failedReplyMarksPropertyAndPublishesEvent() {
        Session session = enrichingSession(1);
        WorkerRequest geocode = track(session, WorkerKind.GEOCODING, 0, new GeocodingQuery("a"));

        Optional<Resolution> resolution = aggregator.apply(session, WorkerReply.failure(geocode, "no match"));

        assertThat(resolution).hasValueSatisfying(r -> assertThat(r.reason()).isEqualTo(FailureReason.WORKER));
        assertThat(session.property(0).orElseThrow().failedKinds()).containsExactly(WorkerKind.GEOCODING);
        assertThat(events).singleElement().isInstanceOfSatisfying(EnrichmentFailedEvent.class, e -> {
            assertThat(e.detail()).isEqualTo("no match");
            assertThat(e.propertyIndex()).isZero();
        });
    }

    @Test
    void researchResultIsCappedAndCreatesRecords() {
        Session session = new Session("s1", clock.instant());
        stateMachine.transition(session, SessionPhase.SEARCHING);
        session.startNewResultSet(Fixtures.completeRequirements());
        WorkerRequest research = track(session, WorkerKind.RESEARCH, null,
                new ResearchQuery(Fixtures.completeRequirements(), 5));

        aggregator.apply(session, WorkerReply.success(research, new ResearchResult("Eight homes", 3,
                Fixtures.listings(8))));

        assertThat(session.propertyCount()).isEqualTo(5);
        assertThat(session.totalFound()).isEqualTo(8);
        assertThat(session.searchSummary()).isEqualTo("Eight homes");
        assertThat(session.properties()).extracting(r -> r.index()).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    void recordFailureResolvesOnlyOnce() {
        Session session = enrichingSession(1);
        WorkerRequest geocode = track(session, WorkerKind.GEOCODING, 0, new GeocodingQuery("a"));

        assertThat(aggregator.recordFailure(session, geocode.correlationId(), FailureReason.DISPATCH, "refused"))
                .isPresent();
        assertThat(aggregator.recordFailure(session, geocode.correlationId(), FailureReason.DISPATCH, "refused"))
                .isEmpty();
        assertThat(events).hasSize(1);
    }

    @Test
    void expireOverdueOnlyTouchesPastDeadlines() {
        Session session = enrichingSession(2);
        track(session, WorkerKind.GEOCODING, 0, new GeocodingQuery("a"));
        clock.advance(Duration.ofSeconds(5));
        track(session, WorkerKind.GEOCODING, 1, new GeocodingQuery("b"));

        clock.advance(Duration.ofSeconds(5));
        List<Resolution> expired = aggregator.expireOverdue(session, clock.instant());

        assertThat(expired).extracting(Resolution::propertyIndex).containsExactly(0);
        assertThat(expired).extracting(Resolution::reason).containsExactly(FailureReason.TIMEOUT);
        assertThat(session.outstandingCount()).isEqualTo(1);
    }

    @Test
    void completeWhenNothingOutstandingOrWindowClosed() {
        Session session = enrichingSession(1);
        track(session, WorkerKind.GEOCODING, 0, new GeocodingQuery("a"));

        assertThat(aggregator.isComplete(session, clock.instant())).isFalse();
        assertThat(aggregator.isComplete(session, clock.instant().plusSeconds(30))).isTrue();

        assertThat(aggregator.expireRemaining(session)).hasSize(1);
        assertThat(aggregator.isComplete(session, clock.instant())).isTrue();

        stateMachine.transition(session, SessionPhase.FINALIZED);
        assertThat(aggregator.isComplete(session, clock.instant())).isFalse();
    }

    @Test
    void searchingSessionIsNeverComplete() {
        Session session = new Session("s1", clock.instant());
        stateMachine.transition(session, SessionPhase.SEARCHING);

        assertThat(aggregator.isComplete(session, clock.instant().plusSeconds(3600))).isFalse();
    }
}
