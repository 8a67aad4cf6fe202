package com.phillippitts.estatesearch.service.worker.message;

import com.phillippitts.estatesearch.domain.CommunityAnalysis;

public record CommunityResult(CommunityAnalysis analysis) implements ReplyPayload {
}
