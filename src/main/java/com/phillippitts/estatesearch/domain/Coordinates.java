package com.phillippitts.estatesearch.domain;

/**
 * Geocoded position of a property.
 *
 * @param latitude        WGS84 latitude in degrees
 * @param longitude       WGS84 longitude in degrees
 * @param resolvedAddress full address reported by the geocoder (nullable)
 */
public record Coordinates(double latitude, double longitude, String resolvedAddress) {

    public Coordinates {
        if (latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90, got: " + latitude);
        }
        if (longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180, got: " + longitude);
        }
    }
}
