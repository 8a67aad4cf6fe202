package com.phillippitts.estatesearch.service.metrics;

import com.phillippitts.estatesearch.domain.ResponseKind;
import com.phillippitts.estatesearch.service.orchestration.FailureReason;
import com.phillippitts.estatesearch.service.worker.WorkerKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Null-safe facade over {@link OrchestrationMetrics} used by the orchestration components.
 *
 * <p>{@link #NOOP} lets dispatcher, aggregator and coordinator run without a meter registry
 * in unit tests.
 */
@Component
public final class OrchestrationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(OrchestrationMetricsPublisher.class);

    /** No-op instance for tests and defaults. */
    public static final OrchestrationMetricsPublisher NOOP = new OrchestrationMetricsPublisher(null);

    private final OrchestrationMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public OrchestrationMetricsPublisher(OrchestrationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("OrchestrationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordDispatch(WorkerKind kind, int attempt) {
        if (metrics == null) {
            return;
        }
        metrics.incrementDispatch(tag(kind));
        if (attempt > 1) {
            metrics.incrementRetry(tag(kind));
        }
    }

    public void recordFailure(WorkerKind kind, FailureReason reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFailure(tag(kind), reason.tag());
    }

    public void recordTurn(ResponseKind outcome, Duration latency) {
        if (metrics == null) {
            return;
        }
        metrics.recordTurn(outcome.name().toLowerCase(Locale.ROOT), latency);
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    private static String tag(WorkerKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
