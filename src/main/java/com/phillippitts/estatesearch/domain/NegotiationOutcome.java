package com.phillippitts.estatesearch.domain;

/**
 * Result of a Negotiator call placed to a listing agent.
 *
 * @param callId      telephony call identifier (nullable when the call was never placed)
 * @param status      provider status such as {@code queued} or {@code ended}
 * @param message     human-readable status message
 * @param callSummary summary of the conversation, once available
 */
public record NegotiationOutcome(String callId, String status, String message, String callSummary) {

    /**
     * Text shown to the user: the call summary when present, otherwise the status message.
     */
    public String summaryText() {
        return callSummary != null && !callSummary.isBlank() ? callSummary : message;
    }
}
