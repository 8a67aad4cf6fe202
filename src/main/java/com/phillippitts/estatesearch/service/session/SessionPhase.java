package com.phillippitts.estatesearch.service.session;

/**
 * Phase of a session's current turn.
 *
 * <pre>
 * COLLECTING_REQUIREMENTS → SEARCHING → ENRICHING → FINALIZED
 *                               └──────────────────→ FINALIZED  (no matches)
 * FINALIZED → COLLECTING_REQUIREMENTS  (new search or clarification)
 * FINALIZED → ENRICHING                (follow-up on the same result set)
 * </pre>
 */
public enum SessionPhase {
    COLLECTING_REQUIREMENTS,
    SEARCHING,
    ENRICHING,
    FINALIZED
}
