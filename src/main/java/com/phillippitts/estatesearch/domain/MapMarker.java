package com.phillippitts.estatesearch.domain;

/**
 * One numbered pin on the composed static map.
 *
 * @param index       stable property index within the session's result set
 * @param label       1-based label shown on the pin, equal to {@code index + 1}
 * @param color       hex colour without leading '#'
 * @param coordinates pin position
 */
public record MapMarker(int index, String label, String color, Coordinates coordinates) {
}
