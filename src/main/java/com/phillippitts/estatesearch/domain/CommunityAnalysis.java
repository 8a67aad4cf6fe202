package com.phillippitts.estatesearch.domain;

import java.util.List;

/**
 * Community scores and highlights for a location.
 *
 * <p>Scores are on a 0-10 scale; any of them may be absent when the analysis worker
 * could not find supporting material.
 */
public record CommunityAnalysis(
        String location,
        Double overallScore,
        String overallExplanation,
        Double safetyScore,
        Double schoolRating,
        String schoolExplanation,
        Double housingPricePerSqft,
        Integer averageHouseSizeSqft,
        List<NewsStory> positiveStories,
        List<NewsStory> negativeStories
) {

    public CommunityAnalysis {
        positiveStories = positiveStories == null ? List.of() : List.copyOf(positiveStories);
        negativeStories = negativeStories == null ? List.of() : List.copyOf(negativeStories);
    }
}
