package com.phillippitts.estatesearch.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted after an idle session has been removed from the session store. Per-session
 * resources held outside the store (buffered outbound messages) can be released.
 *
 * @param sessionId evicted session
 * @param timestamp when the eviction happened
 */
public record SessionEvictedEvent(String sessionId, Instant timestamp) {}
