package com.phillippitts.estatesearch.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Static map image settings (Mapbox static images API).
 */
@Validated
@ConfigurationProperties(prefix = "estate.map")
public class MapProperties {

    @NotBlank
    private String baseUrl = "https://api.mapbox.com";

    @NotBlank
    private String style = "mapbox/streets-v12";

    @Min(1)
    @Max(1280)
    private int width = 1000;

    @Min(1)
    @Max(1280)
    private int height = 600;

    private boolean retina = true;

    /** Blank disables the access_token query parameter. */
    private String accessToken = "";

    /** Hex marker colours without '#', assigned by index modulo palette size. */
    @NotEmpty
    private List<String> markerColors = new ArrayList<>(List.of("e74c3c", "3498db", "2ecc71", "f39c12", "9b59b6"));

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getStyle() {
        return style;
    }

    public void setStyle(String style) {
        this.style = style;
    }

    public int getWidth() {
        return width;
    }

    public void setWidth(int width) {
        this.width = width;
    }

    public int getHeight() {
        return height;
    }

    public void setHeight(int height) {
        this.height = height;
    }

    public boolean isRetina() {
        return retina;
    }

    public void setRetina(boolean retina) {
        this.retina = retina;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    public List<String> getMarkerColors() {
        return markerColors;
    }

    public void setMarkerColors(List<String> markerColors) {
        this.markerColors = markerColors;
    }
}
