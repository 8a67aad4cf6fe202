package com.phillippitts.estatesearch.presentation.dto;

import com.phillippitts.estatesearch.domain.CompositeResponse;
import com.phillippitts.estatesearch.service.channel.OutboundMessage;

import java.time.Instant;

/**
 * One outbound chat message as returned to polling clients.
 *
 * <p>{@code text} holds the acknowledgement or clarification, or the markdown rendering of a
 * response; {@code response} carries the structured response for clients that render it
 * themselves.
 */
public record OutboundMessageView(
        OutboundMessage.Type type,
        String text,
        CompositeResponse response,
        Instant createdAt
) {
}
