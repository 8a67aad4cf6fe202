package com.phillippitts.estatesearch.service.orchestration;

/**
 * Advisory status returned when a user message is accepted.
 */
public enum SubmissionStatus {
    /** The session was idle; the message opens a new turn. */
    ACCEPTED,
    /** A turn is in flight; the message waits until it finishes. */
    QUEUED
}
