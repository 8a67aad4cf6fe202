package com.phillippitts.estatesearch.service.worker.message;

import com.phillippitts.estatesearch.domain.Coordinates;

public record GeocodingResult(Coordinates coordinates) implements ReplyPayload {
}
