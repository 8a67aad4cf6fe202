package com.phillippitts.estatesearch.service.worker.message;

import com.phillippitts.estatesearch.domain.SearchRequirements;

/**
 * Scoping worker's reading of the latest user message.
 *
 * <p>Whether a search can start is decided by {@link SearchRequirements#isComplete()}, not by
 * the worker.
 *
 * @param agentMessage            text to relay to the user (clarifying question or acknowledgement)
 * @param requirements            requirements extracted so far (nullable)
 * @param generalQuestion         whether the message is a general question rather than search input
 * @param question                the general question to forward to the Intern worker (nullable)
 * @param communityName           named community to analyse at session level (nullable)
 * @param negotiatePropertyNumber 1-based property number the user asked to negotiate on (nullable)
 */
public record ScopingVerdict(
        String agentMessage,
        SearchRequirements requirements,
        boolean generalQuestion,
        String question,
        String communityName,
        Integer negotiatePropertyNumber
) implements ReplyPayload {
}
