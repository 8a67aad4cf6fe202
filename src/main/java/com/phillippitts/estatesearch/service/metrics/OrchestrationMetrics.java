package com.phillippitts.estatesearch.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer instrumentation for the orchestration engine.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Worker dispatches per kind</li>
 *   <li>Permanent failures per kind and reason (dispatch, worker, timeout)</li>
 *   <li>Turn latency and turn counts per outcome (results, no_matches, answer)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class OrchestrationMetrics {

    private static final String METRIC_PREFIX = "estatesearch.orchestration";

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementDispatch(String kind) {
        Counter.builder(METRIC_PREFIX + ".dispatch")
                .description("Worker requests dispatched")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void incrementRetry(String kind) {
        Counter.builder(METRIC_PREFIX + ".retry")
                .description("Worker requests re-dispatched after a dispatch failure")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * @param kind   worker kind
     * @param reason dispatch, worker or timeout
     */
    public void incrementFailure(String kind, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Worker requests resolved as permanent failures")
                .tag("kind", kind)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordTurn(String outcome, Duration latency) {
        Timer.builder(METRIC_PREFIX + ".turn.latency")
                .description("Time from user message to delivered response")
                .tag("outcome", outcome)
                .register(registry)
                .record(latency);
        Counter.builder(METRIC_PREFIX + ".turns")
                .description("Completed session turns")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
