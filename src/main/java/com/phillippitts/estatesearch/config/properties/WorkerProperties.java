package com.phillippitts.estatesearch.config.properties;

import com.phillippitts.estatesearch.service.worker.WorkerKind;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.util.EnumMap;
import java.util.Map;

/**
 * HTTP inbox addresses of the worker agents.
 *
 * <p>Example:
 * <pre>
 * estate.workers.endpoints.GEOCODING=http://localhost:8101/requests
 * estate.workers.connect-timeout-ms=2000
 * </pre>
 * Kinds without an entry have no transport and fail every dispatch.
 */
@Validated
@ConfigurationProperties(prefix = "estate.workers")
public class WorkerProperties {

    private Map<WorkerKind, URI> endpoints = new EnumMap<>(WorkerKind.class);

    @Positive
    private int connectTimeoutMs = 2000;

    /** Bounds only the acceptance handshake; replies arrive asynchronously. */
    @Positive
    private int readTimeoutMs = 5000;

    public Map<WorkerKind, URI> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(Map<WorkerKind, URI> endpoints) {
        this.endpoints = endpoints;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }
}
