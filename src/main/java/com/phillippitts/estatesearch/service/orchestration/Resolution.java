package com.phillippitts.estatesearch.service.orchestration;

import com.phillippitts.estatesearch.service.session.OutstandingRequest;
import com.phillippitts.estatesearch.service.worker.WorkerKind;
import com.phillippitts.estatesearch.service.worker.message.ReplyPayload;

import java.util.Objects;

/**
 * How an outstanding request was resolved.
 *
 * @param request the resolved request
 * @param payload the committed result, {@code null} on failure
 * @param reason  failure category, {@code null} on success
 */
public record Resolution(OutstandingRequest request, ReplyPayload payload, FailureReason reason) {

    public Resolution {
        Objects.requireNonNull(request, "request must not be null");
        if ((payload == null) == (reason == null)) {
            throw new IllegalArgumentException("Exactly one of payload or reason must be set");
        }
    }

    public static Resolution succeeded(OutstandingRequest request, ReplyPayload payload) {
        return new Resolution(request, payload, null);
    }

    public static Resolution failed(OutstandingRequest request, FailureReason reason) {
        return new Resolution(request, null, reason);
    }

    public boolean isSuccess() {
        return payload != null;
    }

    public WorkerKind kind() {
        return request.kind();
    }

    public Integer propertyIndex() {
        return request.propertyIndex();
    }
}
