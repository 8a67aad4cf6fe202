package com.phillippitts.estatesearch.domain;

/**
 * What a {@link CompositeResponse} represents for the user.
 */
public enum ResponseKind {
    /** Properties found and enriched. */
    RESULTS,
    /** Research failed or returned no candidates. */
    NO_MATCHES,
    /** Answer to a general question asked before any result set exists. */
    ANSWER
}
