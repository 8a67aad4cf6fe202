package com.phillippitts.estatesearch.service.session;

import com.phillippitts.estatesearch.service.worker.WorkerKind;
import com.phillippitts.estatesearch.service.worker.message.WorkerRequest;

import java.time.Instant;
import java.util.Objects;

/**
 * A dispatched worker request awaiting its reply.
 *
 * @param request  the request as sent (carries correlation id, kind and target index)
 * @param deadline instant after which the request resolves as timed out
 * @param attempt  1 for the first dispatch, incremented on each retry
 */
public record OutstandingRequest(WorkerRequest request, Instant deadline, int attempt) {

    public OutstandingRequest {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(deadline, "deadline must not be null");
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got: " + attempt);
        }
    }

    public String correlationId() {
        return request.correlationId();
    }

    public WorkerKind kind() {
        return request.kind();
    }

    /** Target property index, {@code null} for session-level requests. */
    public Integer propertyIndex() {
        return request.propertyIndex();
    }

    public Instant dispatchedAt() {
        return request.issuedAt();
    }

    public boolean isSessionLevel() {
        return request.propertyIndex() == null;
    }

    public boolean targets(WorkerKind kind, Integer propertyIndex) {
        return request.kind() == kind && Objects.equals(request.propertyIndex(), propertyIndex);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(deadline);
    }
}
