package com.phillippitts.estatesearch.exception;

/**
 * Thrown when a worker reply is structurally invalid: missing identifiers, a success
 * without a payload, or a payload that does not belong to the reply's worker kind.
 */
public class InvalidWorkerReplyException extends EstateSearchException {

    private final String correlationId;
    private final String reason;

    public InvalidWorkerReplyException(String correlationId, String reason) {
        super("Invalid worker reply " + correlationId + ": " + reason);
        this.correlationId = correlationId;
        this.reason = reason;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getReason() {
        return reason;
    }
}
