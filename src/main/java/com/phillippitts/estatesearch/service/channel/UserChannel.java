package com.phillippitts.estatesearch.service.channel;

import com.phillippitts.estatesearch.domain.CompositeResponse;

/**
 * Outbound side of the chat surface.
 *
 * <p>Implementations must not block the caller: they are invoked from session mailboxes.
 */
public interface UserChannel {

    /** Progress note ("Searching for properties") or a still-processing acknowledgement. */
    void acknowledge(String sessionId, String text);

    /** Clarifying question or conversational reply that ends the turn without a response. */
    void clarify(String sessionId, String text);

    /** Final response for a turn. */
    void deliver(CompositeResponse response);
}
