package com.phillippitts.estatesearch.service.worker.message;

import com.phillippitts.estatesearch.service.worker.WorkerKind;

import java.time.Instant;
import java.util.Objects;

/**
 * Request sent to a worker. The worker must echo {@code correlationId} and
 * {@code sessionId} in its {@link WorkerReply}.
 *
 * @param correlationId unique id of this dispatch (a retry gets a fresh one)
 * @param sessionId     owning session
 * @param kind          addressed worker kind
 * @param propertyIndex index of the property this request enriches, {@code null} for session-level requests
 * @param payload       kind-specific body
 * @param issuedAt      dispatch time
 */
public record WorkerRequest(
        String correlationId,
        String sessionId,
        WorkerKind kind,
        Integer propertyIndex,
        RequestPayload payload,
        Instant issuedAt
) {

    public WorkerRequest {
        Objects.requireNonNull(correlationId, "correlationId must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(issuedAt, "issuedAt must not be null");
        if (!kind.accepts(payload)) {
            throw new IllegalArgumentException(
                    "Payload " + payload.getClass().getSimpleName() + " does not belong to worker " + kind);
        }
    }

    /** Copy of this request under a new correlation id, for a retry attempt. */
    public WorkerRequest withCorrelationId(String newCorrelationId, Instant reissuedAt) {
        return new WorkerRequest(newCorrelationId, sessionId, kind, propertyIndex, payload, reissuedAt);
    }
}
