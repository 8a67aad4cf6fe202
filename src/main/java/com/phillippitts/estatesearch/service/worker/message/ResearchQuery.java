package com.phillippitts.estatesearch.service.worker.message;

import com.phillippitts.estatesearch.domain.SearchRequirements;

public record ResearchQuery(SearchRequirements requirements, int maxResults) implements RequestPayload {
}
