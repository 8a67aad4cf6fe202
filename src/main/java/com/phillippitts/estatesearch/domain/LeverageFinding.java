package com.phillippitts.estatesearch.domain;

/**
 * A single negotiation-leverage fact, e.g. a price cut or long time on market.
 *
 * @param category      finding category such as {@code price_history}
 * @param summary       one-line summary
 * @param details       supporting details
 * @param leverageScore 0-10 strength of this point for the buyer
 * @param sourceUrl     where the fact was found (nullable)
 */
public record LeverageFinding(
        String category,
        String summary,
        String details,
        double leverageScore,
        String sourceUrl
) {
}
