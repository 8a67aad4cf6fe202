package com.phillippitts.estatesearch.service.orchestration;

import com.phillippitts.estatesearch.config.properties.MapProperties;
import com.phillippitts.estatesearch.domain.Coordinates;
import com.phillippitts.estatesearch.domain.MapMarker;
import com.phillippitts.estatesearch.domain.PropertySummary;
import com.phillippitts.estatesearch.domain.StaticMap;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Composes one static map image with a numbered pin per geocoded property.
 *
 * <p>Pin labels are the properties' 1-based numbers ({@code index + 1}) and colours cycle
 * through the configured palette by index, so the output depends only on the set of
 * (index, coordinates) pairs. Properties without coordinates are left off the map.
 *
 * <p>URL format (Mapbox static images):
 * <pre>
 * {base}/styles/v1/{style}/static/pin-s-1+e74c3c(-122.4,37.7),pin-s-3+2ecc71(...)/auto/1000x600@2x?access_token=...
 * </pre>
 */
public class MapComposer {

    private final MapProperties properties;

    public MapComposer(MapProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * @return the composed map, or empty when no property has coordinates
     */
    public Optional<StaticMap> compose(List<PropertySummary> summaries) {
        List<PropertySummary> located = new ArrayList<>();
        for (PropertySummary summary : summaries) {
            if (summary.coordinates() != null) {
                located.add(summary);
            }
        }
        if (located.isEmpty()) {
            return Optional.empty();
        }
        located.sort(Comparator.comparingInt(PropertySummary::index));

        List<String> palette = properties.getMarkerColors();
        List<MapMarker> markers = new ArrayList<>(located.size());
        List<String> overlays = new ArrayList<>(located.size());
        for (PropertySummary summary : located) {
            String label = String.valueOf(summary.number());
            String color = palette.get(summary.index() % palette.size());
            markers.add(new MapMarker(summary.index(), label, color, summary.coordinates()));
            overlays.add("pin-s-" + label + "+" + color + "(" + lonLat(summary.coordinates()) + ")");
        }
        return Optional.of(new StaticMap(buildUrl(overlays), markers));
    }

    private String buildUrl(List<String> overlays) {
        StringBuilder url = new StringBuilder(stripTrailingSlash(properties.getBaseUrl()))
                .append("/styles/v1/")
                .append(properties.getStyle())
                .append("/static/")
                .append(String.join(",", overlays))
                .append("/auto/")
                .append(properties.getWidth()).append('x').append(properties.getHeight());
        if (properties.isRetina()) {
            url.append("@2x");
        }
        String token = properties.getAccessToken();
        if (token != null && !token.isBlank()) {
            url.append("?access_token=").append(token);
        }
        return url.toString();
    }

    private static String lonLat(Coordinates coordinates) {
        return plain(coordinates.longitude()) + "," + plain(coordinates.latitude());
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String stripTrailingSlash(String base) {
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
