package com.phillippitts.estatesearch.exception;

/**
 * Thrown when a correlated message references a session the store does not hold.
 * For worker replies this indicates a correlation-id bug and is logged at ERROR.
 */
public class UnknownSessionException extends EstateSearchException {

    private final String sessionId;

    public UnknownSessionException(String sessionId) {
        super("No active session: " + sessionId);
        this.sessionId = sessionId;
    }

    public UnknownSessionException(String sessionId, String correlationId) {
        super("No active session " + sessionId + " for correlated reply " + correlationId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
