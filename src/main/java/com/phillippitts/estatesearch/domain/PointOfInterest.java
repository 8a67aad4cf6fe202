package com.phillippitts.estatesearch.domain;

/**
 * A nearby place found by the Local-Discovery worker.
 *
 * @param name           display name
 * @param category       discovery category (school, grocery, park, ...)
 * @param address        street address (nullable)
 * @param distanceMeters distance from the property (nullable)
 */
public record PointOfInterest(String name, String category, String address, Integer distanceMeters) {
}
