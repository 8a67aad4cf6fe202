package com.phillippitts.estatesearch.domain;

import com.phillippitts.estatesearch.testutil.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainRecordsTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Test
    void requirementsCompleteOnlyWithBudgetLocationBedsAndBaths() {
        assertThat(Fixtures.completeRequirements().isComplete()).isTrue();
        assertThat(Fixtures.partialRequirements().isComplete()).isFalse();
        assertThat(Fixtures.partialRequirements().missingFields()).containsExactly("budget", "bathrooms");
        assertThat(new SearchRequirements(null, 900_000L, 2, 1.5, "  ", null).missingFields())
                .containsExactly("location");
    }

    @Test
    void requirementsRejectInvertedBudget() {
        assertThatThrownBy(() -> new SearchRequirements(2_000_000L, 1_000_000L, 3, 2.0, "Oakland", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void compositeResponseRequiresIncreasingIndices() {
        PropertySummary first = new PropertySummary(0, Fixtures.listing(1), null, null, null, null);
        PropertySummary second = new PropertySummary(1, Fixtures.listing(2), null, null, null, null);

        assertThatThrownBy(() -> new CompositeResponse("s1", 1, ResponseKind.RESULTS, null, 2,
                List.of(second, first), null, null, null, null, NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new CompositeResponse("s1", 1, ResponseKind.RESULTS, null, 2,
                List.of(first, second), null, null, null, null, NOW).properties()).hasSize(2);
    }

    @Test
    void propertyNumberIsOneBased() {
        assertThat(new PropertySummary(4, Fixtures.listing(5), null, null, null, null).number()).isEqualTo(5);
    }

    @Test
    void coordinatesRejectOutOfRange() {
        assertThatThrownBy(() -> new Coordinates(91.0, 0.0, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void negotiationSummaryPrefersCallSummary() {
        assertThat(new NegotiationOutcome("c", "done", "Call placed", "Seller agreed").summaryText())
                .isEqualTo("Seller agreed");
        assertThat(new NegotiationOutcome("c", "queued", "Call placed", " ").summaryText())
                .isEqualTo("Call placed");
    }

    @Test
    void listingLocationFallsBackToTitle() {
        Listing withAddress = new Listing("Sunny home", "1 Elm St", null, null, null, null, null, null);

        assertThat(withAddress.locationQuery()).isEqualTo("1 Elm St");
        assertThat(Fixtures.listing(1).locationQuery()).isEqualTo(Fixtures.listing(1).title());
    }
}
