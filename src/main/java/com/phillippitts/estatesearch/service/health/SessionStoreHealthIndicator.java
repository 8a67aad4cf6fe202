package com.phillippitts.estatesearch.service.health;

import com.phillippitts.estatesearch.config.properties.WorkerProperties;
import com.phillippitts.estatesearch.service.session.Session;
import com.phillippitts.estatesearch.service.session.SessionStore;
import com.phillippitts.estatesearch.service.worker.WorkerKind;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Health indicator for the orchestration engine.
 *
 * <p>Reports session store load and worker transport coverage:
 * <ul>
 *   <li>UP: every worker kind has a configured endpoint</li>
 *   <li>DEGRADED: some kinds are unconfigured; their enrichment fields will always be absent</li>
 *   <li>DOWN: Scoping or Research is unconfigured, so no turn can produce results</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SessionStoreHealthIndicator implements HealthIndicator {

    private final SessionStore store;
    private final WorkerProperties workerProperties;

    public SessionStoreHealthIndicator(SessionStore store, WorkerProperties workerProperties) {
        this.store = store;
        this.workerProperties = workerProperties;
    }

    @Override
    public Health health() {
        int busy = 0;
        int outstanding = 0;
        for (Session session : store.sessions()) {
            if (session.isBusy()) {
                busy++;
            }
            outstanding += session.outstandingCount();
        }

        List<WorkerKind> missing = new ArrayList<>();
        for (WorkerKind kind : WorkerKind.values()) {
            if (!workerProperties.getEndpoints().containsKey(kind)) {
                missing.add(kind);
            }
        }

        Health.Builder builder = new Health.Builder();
        if (missing.contains(WorkerKind.SCOPING) || missing.contains(WorkerKind.RESEARCH)) {
            builder.down().withDetail("status", "Core workers unconfigured");
        } else if (!missing.isEmpty()) {
            builder.status("DEGRADED").withDetail("status", "Partial worker availability");
        } else {
            builder.up().withDetail("status", "All workers configured");
        }
        return builder
                .withDetail("activeSessions", store.size())
                .withDetail("busySessions", busy)
                .withDetail("outstandingRequests", outstanding)
                .withDetail("unconfiguredWorkers", missing)
                .build();
    }
}
