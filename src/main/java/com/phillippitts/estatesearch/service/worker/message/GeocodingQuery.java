package com.phillippitts.estatesearch.service.worker.message;

public record GeocodingQuery(String address) implements RequestPayload {
}
