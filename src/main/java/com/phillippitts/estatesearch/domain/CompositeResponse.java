package com.phillippitts.estatesearch.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Final assembled answer for one session turn. Immutable once built.
 *
 * @param sessionId          session the response belongs to
 * @param turn               1-based turn number within the session
 * @param kind               response kind
 * @param headline           search summary or no-match explanation (nullable for answers)
 * @param totalFound         number of candidates Research reported (may exceed listed properties)
 * @param properties         property summaries in index order
 * @param map                composed static map, {@code null} when no property was geocoded
 * @param community          session-level community analysis (nullable)
 * @param generalAnswer      answer to a general question asked this turn (nullable)
 * @param negotiationSummary negotiation outcome for this turn (nullable)
 * @param assembledAt        assembly time
 */
public record CompositeResponse(
        String sessionId,
        int turn,
        ResponseKind kind,
        String headline,
        int totalFound,
        List<PropertySummary> properties,
        StaticMap map,
        CommunityAnalysis community,
        String generalAnswer,
        String negotiationSummary,
        Instant assembledAt
) {

    public CompositeResponse {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(assembledAt, "assembledAt must not be null");
        properties = properties == null ? List.of() : List.copyOf(properties);
        for (int i = 1; i < properties.size(); i++) {
            if (properties.get(i - 1).index() >= properties.get(i).index()) {
                throw new IllegalArgumentException("Properties must be in strictly increasing index order");
            }
        }
    }

    public boolean hasMap() {
        return map != null;
    }
}
