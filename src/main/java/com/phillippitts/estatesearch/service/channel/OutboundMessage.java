package com.phillippitts.estatesearch.service.channel;

import com.phillippitts.estatesearch.domain.CompositeResponse;

import java.time.Instant;

/**
 * One message waiting in a session's outbox.
 *
 * @param type      message category
 * @param text      acknowledgement or clarification text, {@code null} for responses
 * @param response  composite response, only for {@link Type#RESPONSE}
 * @param createdAt when the message was produced
 */
public record OutboundMessage(Type type, String text, CompositeResponse response, Instant createdAt) {

    public enum Type { ACKNOWLEDGEMENT, CLARIFICATION, RESPONSE }
}
