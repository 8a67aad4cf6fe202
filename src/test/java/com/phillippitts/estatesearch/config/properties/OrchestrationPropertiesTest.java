package com.phillippitts.estatesearch.config.properties;

import com.phillippitts.estatesearch.service.worker.WorkerKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrchestrationPropertiesTest {

    @Test
    void defaultsApplyWhenUnset() {
        OrchestrationProperties props = OrchestrationProperties.defaults();

        assertThat(props.getEnrichmentWindow()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.getRequestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.getMaxRetries()).isEqualTo(1);
        assertThat(props.getRetryBackoff()).isEqualTo(Duration.ofMillis(500));
        assertThat(props.getMaxProperties()).isEqualTo(5);
        assertThat(props.getSessionIdleTimeout()).isEqualTo(Duration.ofMinutes(30));
        assertThat(props.getEnabledEnrichments()).containsExactlyInAnyOrderElementsOf(
                OrchestrationProperties.OPTIONAL_ENRICHMENTS);
    }

    @Test
    void explicitEmptySetDisablesOptionalEnrichment() {
        OrchestrationProperties props = new OrchestrationProperties(null, null, null, null,
                EnumSet.noneOf(WorkerKind.class), null, null);

        assertThat(props.isEnabled(WorkerKind.LOCAL_DISCOVERY)).isFalse();
        assertThat(props.isEnabled(WorkerKind.PROBER)).isFalse();
    }

    @Test
    void rejectsNonOptionalEnrichment() {
        assertThatThrownBy(() -> new OrchestrationProperties(null, null, null, null,
                Set.of(WorkerKind.GEOCODING), null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("GEOCODING");
    }

    @Test
    void enabledSetIsReadOnly() {
        OrchestrationProperties props = OrchestrationProperties.defaults();

        assertThatThrownBy(() -> props.getEnabledEnrichments().add(WorkerKind.INTERN))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
