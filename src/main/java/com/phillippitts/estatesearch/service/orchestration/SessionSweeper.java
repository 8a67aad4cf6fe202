package com.phillippitts.estatesearch.service.orchestration;

import com.phillippitts.estatesearch.service.session.Session;
import com.phillippitts.estatesearch.service.session.SessionPhase;
import com.phillippitts.estatesearch.service.session.SessionStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Periodic driver for request deadlines, enrichment windows and idle eviction.
 *
 * <p>Deadlines are enforced by polling rather than per-request timers, so worst-case turn
 * latency is the enrichment window plus one sweep interval.
 */
@Component
@ConditionalOnProperty(prefix = "estate.sweeper", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SessionSweeper {

    private static final Logger LOG = LogManager.getLogger(SessionSweeper.class);

    private final EstateSearchCoordinator coordinator;
    private final SessionStore store;

    public SessionSweeper(EstateSearchCoordinator coordinator, SessionStore store) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.store = Objects.requireNonNull(store, "store");
    }

    @Scheduled(fixedDelayString = "${estate.orchestration.sweep-interval-ms:1000}")
    public void sweep() {
        coordinator.sweep();
    }

    @Scheduled(fixedRate = 60_000)
    void logSessionSummary() {
        if (store.size() == 0) {
            return;
        }
        Map<SessionPhase, Integer> byPhase = new EnumMap<>(SessionPhase.class);
        int outstanding = 0;
        for (Session session : store.sessions()) {
            byPhase.merge(session.phase(), 1, Integer::sum);
            outstanding += session.outstandingCount();
        }
        LOG.info("Sessions: total={} byPhase={} outstandingRequests={}", store.size(), byPhase, outstanding);
    }
}
