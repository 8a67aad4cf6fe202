package com.phillippitts.estatesearch.service.worker.message;

import com.phillippitts.estatesearch.domain.Listing;

import java.util.List;

/**
 * @param searchSummary short description of what was searched
 * @param totalFound    number of candidates the search matched (may exceed {@code listings})
 * @param listings      candidate listings in rank order
 */
public record ResearchResult(String searchSummary, int totalFound, List<Listing> listings) implements ReplyPayload {

    public ResearchResult {
        listings = listings == null ? List.of() : List.copyOf(listings);
    }
}
