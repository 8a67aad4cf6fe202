package com.phillippitts.estatesearch.service.events;

import com.phillippitts.estatesearch.service.orchestration.event.DispatchFailedEvent;
import com.phillippitts.estatesearch.service.orchestration.event.EnrichmentFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing summary of worker failures. Throttled per worker and failure category so a
 * worker that is down does not flood the log.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onEnrichmentFailed(EnrichmentFailedEvent e) {
        String key = "enrichment-" + e.kind() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Worker {} failing ({}): {}. Affected fields are left absent; "
                    + "check the worker's endpoint in estate.workers.endpoints.", e.kind(), e.reason().tag(), e.detail());
        }
    }

    @EventListener
    void onDispatchFailed(DispatchFailedEvent e) {
        String key = "dispatch-" + e.kind();
        if (shouldLog(key)) {
            LOG.warn("Worker {} not accepting requests: {}", e.kind(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
