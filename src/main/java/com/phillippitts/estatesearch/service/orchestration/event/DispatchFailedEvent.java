package com.phillippitts.estatesearch.service.orchestration.event;

import com.phillippitts.estatesearch.service.worker.WorkerKind;

import java.time.Instant;

/**
 * Emitted when a worker endpoint does not accept a request. The coordinator routes it back
 * into the owning session's mailbox where it is retried or recorded as failed.
 *
 * @param sessionId     owning session
 * @param correlationId correlation id of the failed dispatch
 * @param kind          target worker kind
 * @param message       transport error text
 * @param timestamp     when the failure was observed
 */
public record DispatchFailedEvent(
        String sessionId,
        String correlationId,
        WorkerKind kind,
        String message,
        Instant timestamp
) {}
