package com.phillippitts.estatesearch.domain;

import java.util.List;

/**
 * Static map image reference with its markers, ordered by property index.
 */
public record StaticMap(String url, List<MapMarker> markers) {

    public StaticMap {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Map url must not be blank");
        }
        markers = List.copyOf(markers);
    }

    public List<String> labels() {
        return markers.stream().map(MapMarker::label).toList();
    }
}
