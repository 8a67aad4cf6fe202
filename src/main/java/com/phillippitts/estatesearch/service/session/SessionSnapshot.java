package com.phillippitts.estatesearch.service.session;

import java.time.Instant;

/**
 * Point-in-time view of a session, safe to hand out of the mailbox.
 */
public record SessionSnapshot(
        String sessionId,
        SessionPhase phase,
        int turn,
        int propertyCount,
        int outstandingCount,
        int pendingMessageCount,
        Instant createdAt,
        Instant lastActivity
) {
}
