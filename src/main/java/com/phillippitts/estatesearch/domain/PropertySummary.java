package com.phillippitts.estatesearch.domain;

import java.util.List;

/**
 * Immutable view of one property in a {@link CompositeResponse}.
 *
 * <p>Enrichment fields are {@code null} when the corresponding worker failed, timed out or
 * was not asked. An empty {@code pointsOfInterest} list means discovery succeeded but found
 * nothing; {@code null} means discovery data is absent.
 *
 * @param index            stable index within the result set
 * @param listing          source listing, always present
 * @param coordinates      geocoded position (nullable)
 * @param pointsOfInterest nearby places (nullable)
 * @param community        community analysis for this listing (nullable)
 * @param leverage         negotiation-leverage report (nullable)
 */
public record PropertySummary(
        int index,
        Listing listing,
        Coordinates coordinates,
        List<PointOfInterest> pointsOfInterest,
        CommunityAnalysis community,
        LeverageReport leverage
) {

    public PropertySummary {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative, got: " + index);
        }
        if (listing == null) {
            throw new NullPointerException("listing must not be null");
        }
        pointsOfInterest = pointsOfInterest == null ? null : List.copyOf(pointsOfInterest);
    }

    /** 1-based number shown to the user and on the map marker. */
    public int number() {
        return index + 1;
    }
}
