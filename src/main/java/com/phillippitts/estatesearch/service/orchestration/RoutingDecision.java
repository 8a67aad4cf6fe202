package com.phillippitts.estatesearch.service.orchestration;

/**
 * Outcome of routing a Scoping verdict.
 *
 * @param route   what the dispatcher did with the verdict
 * @param message text for the user (clarifying question or status note), may be {@code null}
 */
public record RoutingDecision(Route route, String message) {

    public enum Route {
        /** Nothing dispatched; the message is a clarifying question or a conversational reply. */
        CLARIFY,
        /** Research dispatched for a new result set. */
        SEARCH,
        /** Intern dispatched; its answer will be delivered as a standalone response. */
        ANSWER,
        /** Session re-entered enrichment for a question or negotiation on the current results. */
        FOLLOW_UP
    }
}
