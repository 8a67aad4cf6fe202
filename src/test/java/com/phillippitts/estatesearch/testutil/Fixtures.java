package com.phillippitts.estatesearch.testutil;

import com.phillippitts.estatesearch.domain.CommunityAnalysis;
import com.phillippitts.estatesearch.domain.Coordinates;
import com.phillippitts.estatesearch.domain.LeverageFinding;
import com.phillippitts.estatesearch.domain.LeverageReport;
import com.phillippitts.estatesearch.domain.Listing;
import com.phillippitts.estatesearch.domain.NewsStory;
import com.phillippitts.estatesearch.domain.PointOfInterest;
import com.phillippitts.estatesearch.domain.SearchRequirements;
import com.phillippitts.estatesearch.service.worker.message.ScopingVerdict;

import java.util.ArrayList;
import java.util.List;

/**
 * Canned domain values shared by tests.
 */
public final class Fixtures {

    private Fixtures() {
        // Utility class
    }

    public static SearchRequirements completeRequirements() {
        return new SearchRequirements(null, 1_500_000L, 3, 2.0, "San Francisco", null);
    }

    public static SearchRequirements partialRequirements() {
        return new SearchRequirements(null, null, 3, null, "San Francisco", null);
    }

    public static ScopingVerdict searchVerdict() {
        return new ScopingVerdict("Great, let me search.", completeRequirements(), false, null, null, null);
    }

    public static ScopingVerdict clarifyVerdict(String question) {
        return new ScopingVerdict(question, partialRequirements(), false, null, null, null);
    }

    public static ScopingVerdict questionVerdict(String question) {
        return new ScopingVerdict(null, null, true, question, null, null);
    }

    public static ScopingVerdict negotiateVerdict(int propertyNumber) {
        return new ScopingVerdict(null, null, false, null, null, propertyNumber);
    }

    public static Listing listing(int n) {
        return new Listing(n + "00 Main St, San Francisco, CA", null, "$1,20" + n + ",000",
                "https://listings.example.com/" + n, 3, 2.0, 1500 + n, null);
    }

    public static List<Listing> listings(int count) {
        List<Listing> result = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            result.add(listing(i));
        }
        return result;
    }

    public static Coordinates coordinates(int n) {
        return new Coordinates(37.7 + n / 100.0, -122.4 - n / 100.0, n + "00 Main St");
    }

    public static List<PointOfInterest> pointsOfInterest() {
        return List.of(new PointOfInterest("Dolores Park", "park", "Dolores St", 350),
                new PointOfInterest("Rainbow Grocery", "grocery", null, 900));
    }

    public static CommunityAnalysis community(String location) {
        return new CommunityAnalysis(location, 8.0, "Lively, walkable neighborhood", 7.5, 8.0,
                "Strong public schools", 1100.0, 1800,
                List.of(new NewsStory("New park opens", "A new park opened downtown.", "https://news.example.com/1")),
                List.of(new NewsStory("Traffic study", "Congestion worsened.", null)));
    }

    public static LeverageReport leverage() {
        return new LeverageReport(7.0, "Motivated seller",
                List.of(new LeverageFinding("price_history", "Price cut twice", "Reduced by 5%", 8.0, null)));
    }
}
