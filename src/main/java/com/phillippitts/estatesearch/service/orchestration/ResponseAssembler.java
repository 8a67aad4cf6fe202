package com.phillippitts.estatesearch.service.orchestration;

import com.phillippitts.estatesearch.domain.CompositeResponse;
import com.phillippitts.estatesearch.domain.PropertySummary;
import com.phillippitts.estatesearch.domain.ResponseKind;
import com.phillippitts.estatesearch.domain.StaticMap;
import com.phillippitts.estatesearch.service.session.PropertyRecord;
import com.phillippitts.estatesearch.service.session.Session;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the {@link CompositeResponse} for a finished turn from what the aggregator has
 * already committed. Never waits for data.
 */
public class ResponseAssembler {

    static final String NO_MATCHES_HEADLINE = "No properties matched your requirements.";
    static final String SEARCH_FAILED_HEADLINE = "The property search could not be completed. Please try again.";

    private final MapComposer mapComposer;
    private final Clock clock;

    public ResponseAssembler(MapComposer mapComposer, Clock clock) {
        this.mapComposer = Objects.requireNonNull(mapComposer, "mapComposer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Full results: every property in index order with whatever enrichment arrived, the map
     * and the session-level commentary.
     */
    public CompositeResponse assembleResults(Session session, int turn) {
        List<PropertySummary> summaries = new ArrayList<>(session.propertyCount());
        for (PropertyRecord record : session.properties()) {
            summaries.add(record.toSummary());
        }
        StaticMap map = mapComposer.compose(summaries).orElse(null);
        String headline = session.searchSummary();
        if (headline == null || headline.isBlank()) {
            headline = "Found " + summaries.size() + (summaries.size() == 1 ? " property" : " properties");
        }
        return new CompositeResponse(session.id(), turn, ResponseKind.RESULTS, headline,
                session.totalFound(), summaries, map, session.community(),
                session.generalAnswer(), session.negotiationSummary(), clock.instant());
    }

    /**
     * Terminal no-match response for an empty or failed search.
     *
     * @param searchFailed {@code true} when Research failed rather than returning nothing
     */
    public CompositeResponse assembleNoMatches(Session session, int turn, boolean searchFailed) {
        String headline = searchFailed ? SEARCH_FAILED_HEADLINE : NO_MATCHES_HEADLINE;
        return new CompositeResponse(session.id(), turn, ResponseKind.NO_MATCHES, headline,
                0, List.of(), null, session.community(), null, null, clock.instant());
    }

    /**
     * Standalone answer to a general question asked outside a result set.
     */
    public CompositeResponse assembleAnswer(Session session, int turn) {
        return new CompositeResponse(session.id(), turn, ResponseKind.ANSWER, null,
                0, List.of(), null, null, session.generalAnswer(), null, clock.instant());
    }
}
