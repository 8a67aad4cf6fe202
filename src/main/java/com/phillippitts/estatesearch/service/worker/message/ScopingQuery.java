package com.phillippitts.estatesearch.service.worker.message;

/** Raw user message forwarded to the Scoping worker. */
public record ScopingQuery(String userMessage) implements RequestPayload {
}
