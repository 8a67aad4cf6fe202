package com.phillippitts.estatesearch.domain;

import java.util.List;

/**
 * Negotiation-leverage analysis produced by the Prober worker for one property.
 *
 * @param leverageScore     overall 0-10 buyer leverage
 * @param overallAssessment narrative assessment
 * @param findings          individual findings, possibly empty
 */
public record LeverageReport(double leverageScore, String overallAssessment, List<LeverageFinding> findings) {

    public LeverageReport {
        if (leverageScore < 0.0 || leverageScore > 10.0) {
            throw new IllegalArgumentException("Leverage score must be between 0 and 10, got: " + leverageScore);
        }
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
