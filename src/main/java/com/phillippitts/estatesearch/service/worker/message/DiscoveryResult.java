package com.phillippitts.estatesearch.service.worker.message;

import com.phillippitts.estatesearch.domain.PointOfInterest;

import java.util.List;

public record DiscoveryResult(List<PointOfInterest> pointsOfInterest) implements ReplyPayload {

    public DiscoveryResult {
        pointsOfInterest = pointsOfInterest == null ? List.of() : List.copyOf(pointsOfInterest);
    }
}
