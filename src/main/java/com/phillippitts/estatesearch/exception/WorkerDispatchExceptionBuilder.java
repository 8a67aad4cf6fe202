package com.phillippitts.estatesearch.exception;

import com.phillippitts.estatesearch.service.worker.WorkerKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link WorkerUnavailableException} with contextual details.
 *
 * <p><b>Usage Example:</b>
 * <pre>
 * throw WorkerDispatchExceptionBuilder.create("Worker rejected request")
 *         .worker(WorkerKind.GEOCODING)
 *         .endpoint(uri)
 *         .statusCode(503)
 *         .durationMs(120)
 *         .metadata("correlationId", request.correlationId())
 *         .build();
 * </pre>
 */
public final class WorkerDispatchExceptionBuilder {

    private final String message;
    private WorkerKind workerKind;
    private Throwable cause;
    private Object endpoint;
    private Integer statusCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private WorkerDispatchExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static WorkerDispatchExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new WorkerDispatchExceptionBuilder(message);
    }

    public WorkerDispatchExceptionBuilder worker(WorkerKind workerKind) {
        this.workerKind = workerKind;
        return this;
    }

    public WorkerDispatchExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public WorkerDispatchExceptionBuilder endpoint(Object endpoint) {
        this.endpoint = endpoint;
        return this;
    }

    public WorkerDispatchExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public WorkerDispatchExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are skipped.
     */
    public WorkerDispatchExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (endpoint={uri}, status={code}, durationMs={ms}, {key1}={val1}, ...) (worker: {kind})
     * </pre>
     *
     * @throws IllegalStateException if no worker kind was set
     */
    public WorkerUnavailableException build() {
        if (workerKind == null) {
            throw new IllegalStateException("worker kind must be set");
        }
        String detailed = buildDetailedMessage();
        return cause != null
                ? new WorkerUnavailableException(detailed, workerKind, cause)
                : new WorkerUnavailableException(detailed, workerKind);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (endpoint != null) {
            details.put("endpoint", String.valueOf(endpoint));
        }
        if (statusCode != null) {
            details.put("status", String.valueOf(statusCode));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
