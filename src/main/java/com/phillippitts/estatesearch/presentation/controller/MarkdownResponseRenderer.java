package com.phillippitts.estatesearch.presentation.controller;

import com.phillippitts.estatesearch.domain.CommunityAnalysis;
import com.phillippitts.estatesearch.domain.CompositeResponse;
import com.phillippitts.estatesearch.domain.Coordinates;
import com.phillippitts.estatesearch.domain.LeverageReport;
import com.phillippitts.estatesearch.domain.Listing;
import com.phillippitts.estatesearch.domain.NewsStory;
import com.phillippitts.estatesearch.domain.PointOfInterest;
import com.phillippitts.estatesearch.domain.PropertySummary;
import com.phillippitts.estatesearch.domain.ResponseKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link CompositeResponse} as chat markdown.
 *
 * <p>Layout for a result set: title and headline, static map, one section per property,
 * then the session-level community analysis and any commentary produced this turn.
 * Absent enrichment fields are simply left out.
 */
@Component
class MarkdownResponseRenderer {

    static final String TITLE = "# 🏠 Property Search Results";
    static final int MAX_POINTS_OF_INTEREST = 5;
    static final int MAX_STORIES = 3;

    private static final String RULE = "---\n\n";

    String render(CompositeResponse response) {
        StringBuilder md = new StringBuilder();
        if (response.kind() == ResponseKind.ANSWER) {
            appendText(md, response.generalAnswer());
            appendNegotiation(md, response.negotiationSummary());
            return md.toString().strip();
        }

        md.append(TITLE).append("\n\n");
        if (response.headline() != null) {
            md.append("**").append(response.headline()).append("**\n\n");
        }
        if (response.kind() == ResponseKind.NO_MATCHES) {
            return md.toString().strip();
        }

        md.append("Found **").append(response.totalFound()).append("** properties matching your criteria.\n\n");
        if (response.hasMap()) {
            md.append("## 📍 Map View\n\n");
            md.append("![Properties Map](").append(response.map().url()).append(")\n\n");
            md.append("*Numbered markers correspond to properties listed below*\n\n");
        }
        md.append(RULE);

        for (PropertySummary property : response.properties()) {
            appendProperty(md, property);
        }
        if (response.community() != null) {
            appendCommunity(md, response.community());
        }
        if (response.generalAnswer() != null) {
            md.append("## 💬 Answer\n\n");
            appendText(md, response.generalAnswer());
        }
        appendNegotiation(md, response.negotiationSummary());
        return md.toString().strip();
    }

    private void appendProperty(StringBuilder md, PropertySummary property) {
        Listing listing = property.listing();
        md.append("## Property ").append(property.number()).append("\n\n");
        md.append("### 📍 ").append(listing.title()).append("\n\n");
        if (listing.imageUrl() != null) {
            md.append("![Property Image](").append(listing.imageUrl()).append(")\n\n");
        }
        if (listing.price() != null) {
            md.append("**💰 Price:** ").append(listing.price()).append("\n\n");
        }

        List<String> details = new ArrayList<>(3);
        if (listing.beds() != null) {
            details.add(listing.beds() + " beds");
        }
        if (listing.baths() != null) {
            details.add(formatNumber(listing.baths()) + " baths");
        }
        if (listing.sqft() != null) {
            details.add(listing.sqft() + " sqft");
        }
        if (!details.isEmpty()) {
            md.append("**🏡 Details:** ").append(String.join(" | ", details)).append("\n\n");
        }

        Coordinates coordinates = property.coordinates();
        if (coordinates != null) {
            md.append("**📌 Coordinates:** ").append(coordinates.latitude()).append(", ")
                    .append(coordinates.longitude()).append("\n\n");
        }
        appendPointsOfInterest(md, property.pointsOfInterest());
        if (property.community() != null && property.community().overallScore() != null) {
            md.append("**🏘️ Community Score:** ").append(formatNumber(property.community().overallScore()))
                    .append("/10\n\n");
        }
        appendLeverage(md, property.leverage());
        if (listing.link() != null) {
            md.append("**🔗 Listing:** ").append(listing.link()).append("\n\n");
        }
        md.append(RULE);
    }

    private void appendPointsOfInterest(StringBuilder md, List<PointOfInterest> places) {
        if (places == null || places.isEmpty()) {
            return;
        }
        md.append("**🗺️ Nearby:**\n\n");
        places.stream().limit(MAX_POINTS_OF_INTEREST).forEach(place -> {
            md.append("- ").append(place.name());
            if (place.category() != null) {
                md.append(" (").append(place.category()).append(')');
            }
            if (place.distanceMeters() != null) {
                md.append(", ").append(place.distanceMeters()).append(" m");
            }
            md.append('\n');
        });
        md.append('\n');
    }

    private void appendLeverage(StringBuilder md, LeverageReport leverage) {
        if (leverage == null) {
            return;
        }
        md.append("**🤝 Negotiation Leverage:** ").append(formatNumber(leverage.leverageScore())).append("/10");
        if (leverage.overallAssessment() != null) {
            md.append(" - ").append(leverage.overallAssessment());
        }
        md.append("\n\n");
        leverage.findings().forEach(finding ->
                md.append("- ").append(finding.summary()).append('\n'));
        if (!leverage.findings().isEmpty()) {
            md.append('\n');
        }
    }

    private void appendCommunity(StringBuilder md, CommunityAnalysis community) {
        md.append("## 🏘️ Community Analysis");
        if (community.location() != null) {
            md.append(": ").append(community.location());
        }
        md.append("\n\n");
        if (community.overallScore() != null) {
            md.append("**Overall Score:** ").append(formatNumber(community.overallScore())).append("/10\n\n");
        }
        if (community.overallExplanation() != null) {
            md.append("**Overview:** ").append(community.overallExplanation()).append("\n\n");
        }
        if (community.safetyScore() != null) {
            md.append("**🛡️ Safety Score:** ").append(formatNumber(community.safetyScore())).append("/10\n\n");
        }
        if (community.schoolRating() != null) {
            md.append("**🎓 School Rating:** ").append(formatNumber(community.schoolRating())).append("/10\n");
            if (community.schoolExplanation() != null) {
                md.append("   *").append(community.schoolExplanation()).append("*\n");
            }
            md.append('\n');
        }
        if (community.housingPricePerSqft() != null) {
            md.append("**💵 Housing Price per Sqft:** $").append(formatNumber(community.housingPricePerSqft()))
                    .append("\n\n");
        }
        if (community.averageHouseSizeSqft() != null) {
            md.append("**📏 Average House Size:** ").append(community.averageHouseSizeSqft()).append(" sqft\n\n");
        }
        appendStories(md, "**✅ Positive Highlights:**", community.positiveStories());
        appendStories(md, "**⚠️ Considerations:**", community.negativeStories());
    }

    private void appendStories(StringBuilder md, String heading, List<NewsStory> stories) {
        if (stories.isEmpty()) {
            return;
        }
        md.append(heading).append("\n\n");
        stories.stream().limit(MAX_STORIES).forEach(story -> {
            md.append("- **").append(story.title() == null ? "News" : story.title()).append("**\n");
            if (story.summary() != null) {
                md.append("  ").append(story.summary()).append('\n');
            }
            if (story.url() != null) {
                md.append("  [Read more](").append(story.url()).append(")\n");
            }
            md.append('\n');
        });
    }

    private void appendNegotiation(StringBuilder md, String summary) {
        if (summary != null) {
            md.append("## 📞 Negotiation Update\n\n");
            appendText(md, summary);
        }
    }

    private static void appendText(StringBuilder md, String text) {
        if (text != null) {
            md.append(text).append("\n\n");
        }
    }

    /** Drops a trailing ".0" so whole scores read as "8/10". */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
