package com.phillippitts.estatesearch.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured property-search requirements collected by the Scoping worker.
 *
 * <p>Every field is nullable because requirements arrive incrementally over several user
 * turns. {@link #isComplete()} is the explicit predicate the coordinator uses to leave
 * the requirements-collection phase.
 *
 * @param budgetMin      lower price bound in dollars (optional even when complete)
 * @param budgetMax      upper price bound in dollars
 * @param bedrooms       requested bedroom count
 * @param bathrooms      requested bathroom count (half baths allowed)
 * @param location       city or area to search in
 * @param additionalInfo free-form preferences passed through to Research
 */
public record SearchRequirements(
        Long budgetMin,
        Long budgetMax,
        Integer bedrooms,
        Double bathrooms,
        String location,
        String additionalInfo
) {

    public SearchRequirements {
        if (budgetMin != null && budgetMin < 0) {
            throw new IllegalArgumentException("budgetMin must not be negative, got: " + budgetMin);
        }
        if (budgetMin != null && budgetMax != null && budgetMin > budgetMax) {
            throw new IllegalArgumentException(
                    "budgetMin must not exceed budgetMax, got: " + budgetMin + " > " + budgetMax);
        }
    }

    /**
     * Returns {@code true} when budget, location, bedroom and bathroom counts are present.
     */
    public boolean isComplete() {
        return missingFields().isEmpty();
    }

    /**
     * Lists the human-readable names of the required fields that are still missing,
     * in a stable order suitable for a clarifying question.
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>(4);
        if (budgetMax == null) {
            missing.add("budget");
        }
        if (location == null || location.isBlank()) {
            missing.add("location");
        }
        if (bedrooms == null) {
            missing.add("bedrooms");
        }
        if (bathrooms == null) {
            missing.add("bathrooms");
        }
        return missing;
    }
}
