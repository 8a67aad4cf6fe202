package com.phillippitts.estatesearch.service.worker.message;

public record GeneralQuestion(String question) implements RequestPayload {
}
