package com.phillippitts.estatesearch.service.worker.message;

public record ProbeQuery(String address) implements RequestPayload {
}
