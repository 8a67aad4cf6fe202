package com.phillippitts.estatesearch.service.worker.message;

/** Nearby-place lookup around a geocoded property. */
public record DiscoveryQuery(double latitude, double longitude) implements RequestPayload {
}
