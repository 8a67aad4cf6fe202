package com.phillippitts.estatesearch.presentation.dto;

import com.phillippitts.estatesearch.service.orchestration.SubmissionStatus;

import java.time.Instant;

/**
 * Acknowledgement returned when a user message is accepted.
 *
 * @param sessionId  target session
 * @param status     {@code ACCEPTED}, or {@code QUEUED} when a turn was already in flight
 * @param receivedAt server receive time
 */
public record SubmissionReceipt(String sessionId, SubmissionStatus status, Instant receivedAt) {
}
