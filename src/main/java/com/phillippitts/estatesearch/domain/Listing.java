package com.phillippitts.estatesearch.domain;

/**
 * Source listing data returned by the Research worker for one candidate property.
 *
 * <p>Only {@code title} is mandatory; listing sites frequently omit the rest.
 *
 * @param title    listing headline, usually the street address
 * @param address  explicit street address when the listing provides one
 * @param price    display price as scraped (e.g. "$1,250,000")
 * @param link     URL of the listing page
 * @param beds     bedroom count
 * @param baths    bathroom count
 * @param sqft     interior square footage
 * @param imageUrl first image scraped from the listing page
 */
public record Listing(
        String title,
        String address,
        String price,
        String link,
        Integer beds,
        Double baths,
        Integer sqft,
        String imageUrl
) {

    public Listing {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Listing title must not be blank");
        }
    }

    /**
     * Text used to geocode or probe this listing: the explicit address when present,
     * otherwise the title.
     */
    public String locationQuery() {
        return address != null && !address.isBlank() ? address : title;
    }
}
