package com.phillippitts.estatesearch.service.worker.message;

public record GeneralAnswer(String answer) implements ReplyPayload {
}
