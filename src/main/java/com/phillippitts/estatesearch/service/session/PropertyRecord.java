package com.phillippitts.estatesearch.service.session;

import com.phillippitts.estatesearch.domain.CommunityAnalysis;
import com.phillippitts.estatesearch.domain.Coordinates;
import com.phillippitts.estatesearch.domain.LeverageReport;
import com.phillippitts.estatesearch.domain.Listing;
import com.phillippitts.estatesearch.domain.PointOfInterest;
import com.phillippitts.estatesearch.domain.PropertySummary;
import com.phillippitts.estatesearch.service.worker.WorkerKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One candidate property accumulating enrichment data within a session.
 *
 * <p>The index is fixed at construction and doubles as the 1-based map marker number
 * ({@code index + 1}). Enrichment fields start absent and are filled by the aggregator.
 * Not thread-safe: only touched from the owning session's mailbox.
 */
public final class PropertyRecord {

    private final int index;
    private final Listing listing;
    private final Set<WorkerKind> failedKinds = EnumSet.noneOf(WorkerKind.class);

    private Coordinates coordinates;
    private List<PointOfInterest> pointsOfInterest;
    private CommunityAnalysis community;
    private LeverageReport leverage;

    PropertyRecord(int index, Listing listing) {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative, got: " + index);
        }
        this.index = index;
        this.listing = Objects.requireNonNull(listing, "listing");
    }

    public int index() {
        return index;
    }

    public Listing listing() {
        return listing;
    }

    public Coordinates coordinates() {
        return coordinates;
    }

    public void setCoordinates(Coordinates coordinates) {
        this.coordinates = coordinates;
    }

    public List<PointOfInterest> pointsOfInterest() {
        return pointsOfInterest;
    }

    public void setPointsOfInterest(List<PointOfInterest> pointsOfInterest) {
        this.pointsOfInterest = pointsOfInterest == null ? null : List.copyOf(pointsOfInterest);
    }

    public CommunityAnalysis community() {
        return community;
    }

    public void setCommunity(CommunityAnalysis community) {
        this.community = community;
    }

    public LeverageReport leverage() {
        return leverage;
    }

    public void setLeverage(LeverageReport leverage) {
        this.leverage = leverage;
    }

    public void markFailed(WorkerKind kind) {
        failedKinds.add(kind);
    }

    public Set<WorkerKind> failedKinds() {
        return Collections.unmodifiableSet(failedKinds);
    }

    public PropertySummary toSummary() {
        return new PropertySummary(index, listing, coordinates, pointsOfInterest, community, leverage);
    }
}
