package com.phillippitts.estatesearch.config.properties;

import com.phillippitts.estatesearch.service.worker.WorkerKind;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Typed properties for the session orchestration engine.
 */
@Validated
@ConfigurationProperties(prefix = "estate.orchestration")
public class OrchestrationProperties {

    /** Enrichment kinds that may be switched per deployment. Geocoding is always dispatched. */
    public static final Set<WorkerKind> OPTIONAL_ENRICHMENTS =
            EnumSet.of(WorkerKind.LOCAL_DISCOVERY, WorkerKind.COMMUNITY_ANALYSIS, WorkerKind.PROBER);

    /**
     * Maximum time from SEARCHING to ENRICHING transition until the turn is finalized with
     * whatever has arrived.
     */
    @NotNull
    private final Duration enrichmentWindow;

    /** Deadline of each individual outstanding request. */
    @NotNull
    private final Duration requestTimeout;

    @Min(0)
    @Max(5)
    private final int maxRetries;

    /** Delay before the first retry; doubles on each further attempt. */
    @NotNull
    private final Duration retryBackoff;

    @NotNull
    private final Set<WorkerKind> enabledEnrichments;

    @Min(1)
    @Max(50)
    private final int maxProperties;

    @NotNull
    private final Duration sessionIdleTimeout;

    @ConstructorBinding
    public OrchestrationProperties(Duration enrichmentWindow,
                                   Duration requestTimeout,
                                   Integer maxRetries,
                                   Duration retryBackoff,
                                   Set<WorkerKind> enabledEnrichments,
                                   Integer maxProperties,
                                   Duration sessionIdleTimeout) {
        this.enrichmentWindow = enrichmentWindow == null ? Duration.ofSeconds(30) : enrichmentWindow;
        this.requestTimeout = requestTimeout == null ? Duration.ofSeconds(30) : requestTimeout;
        this.maxRetries = maxRetries == null ? 1 : maxRetries;
        this.retryBackoff = retryBackoff == null ? Duration.ofMillis(500) : retryBackoff;
        this.enabledEnrichments = enabledEnrichments == null
                ? EnumSet.copyOf(OPTIONAL_ENRICHMENTS)
                : copyEnrichments(enabledEnrichments);
        this.maxProperties = maxProperties == null ? 5 : maxProperties;
        this.sessionIdleTimeout = sessionIdleTimeout == null ? Duration.ofMinutes(30) : sessionIdleTimeout;
    }

    /**
     * Properties with every default applied.
     */
    public static OrchestrationProperties defaults() {
        return new OrchestrationProperties(null, null, null, null, null, null, null);
    }

    private static Set<WorkerKind> copyEnrichments(Set<WorkerKind> requested) {
        Set<WorkerKind> copy = EnumSet.noneOf(WorkerKind.class);
        for (WorkerKind kind : requested) {
            if (!OPTIONAL_ENRICHMENTS.contains(kind)) {
                throw new IllegalArgumentException(
                        "Not an optional enrichment: " + kind + " (allowed: " + OPTIONAL_ENRICHMENTS + ")");
            }
            copy.add(kind);
        }
        return copy;
    }

    public Duration getEnrichmentWindow() {
        return enrichmentWindow;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public Set<WorkerKind> getEnabledEnrichments() {
        return Collections.unmodifiableSet(enabledEnrichments);
    }

    public boolean isEnabled(WorkerKind kind) {
        return enabledEnrichments.contains(kind);
    }

    public int getMaxProperties() {
        return maxProperties;
    }

    public Duration getSessionIdleTimeout() {
        return sessionIdleTimeout;
    }
}
