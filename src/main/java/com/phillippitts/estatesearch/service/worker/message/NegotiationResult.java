package com.phillippitts.estatesearch.service.worker.message;

import com.phillippitts.estatesearch.domain.NegotiationOutcome;

public record NegotiationResult(NegotiationOutcome outcome) implements ReplyPayload {
}
