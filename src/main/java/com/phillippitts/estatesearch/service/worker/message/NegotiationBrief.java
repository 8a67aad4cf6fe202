package com.phillippitts.estatesearch.service.worker.message;

import com.phillippitts.estatesearch.domain.LeverageReport;
import com.phillippitts.estatesearch.domain.Listing;
import com.phillippitts.estatesearch.domain.SearchRequirements;

/**
 * Everything the Negotiator needs to place a call about one property.
 *
 * @param listing      property to negotiate on
 * @param leverage     prober findings for the property (nullable)
 * @param requirements buyer requirements for context (nullable)
 */
public record NegotiationBrief(Listing listing, LeverageReport leverage, SearchRequirements requirements)
        implements RequestPayload {
}
