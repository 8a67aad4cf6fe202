package com.phillippitts.estatesearch.service.worker.message;

public record CommunityQuery(String locationName) implements RequestPayload {
}
