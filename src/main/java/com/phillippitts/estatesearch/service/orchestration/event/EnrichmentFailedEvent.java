package com.phillippitts.estatesearch.service.orchestration.event;

import com.phillippitts.estatesearch.service.orchestration.FailureReason;
import com.phillippitts.estatesearch.service.worker.WorkerKind;

import java.time.Instant;

/**
 * Emitted when an outstanding request resolves as a permanent failure. The corresponding
 * field is left absent; nothing else about the turn changes.
 *
 * @param sessionId     owning session
 * @param kind          worker kind that failed
 * @param propertyIndex affected property, {@code null} for session-level requests
 * @param reason        failure category
 * @param detail        worker or transport error text
 * @param timestamp     when the failure was recorded
 */
public record EnrichmentFailedEvent(
        String sessionId,
        WorkerKind kind,
        Integer propertyIndex,
        FailureReason reason,
        String detail,
        Instant timestamp
) {}
