package com.phillippitts.estatesearch.exception;

import com.phillippitts.estatesearch.service.session.SessionPhase;

/**
 * Thrown on an illegal session phase transition. Always a programming error.
 */
public class SessionStateException extends EstateSearchException {

    private final SessionPhase from;
    private final SessionPhase to;

    public SessionStateException(String sessionId, SessionPhase from, SessionPhase to) {
        super("Illegal phase transition " + from + " -> " + to + " for session " + sessionId);
        this.from = from;
        this.to = to;
    }

    public SessionPhase getFrom() {
        return from;
    }

    public SessionPhase getTo() {
        return to;
    }
}
