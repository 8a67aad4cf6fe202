package com.phillippitts.estatesearch.service.orchestration;

import com.phillippitts.estatesearch.exception.SessionStateException;
import com.phillippitts.estatesearch.service.session.Session;
import com.phillippitts.estatesearch.service.session.SessionPhase;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Validates and applies session phase transitions.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * COLLECTING_REQUIREMENTS → COLLECTING_REQUIREMENTS (clarifying question)
 * COLLECTING_REQUIREMENTS → SEARCHING               (requirements complete)
 * SEARCHING → ENRICHING                             (candidates found)
 * SEARCHING → FINALIZED                             (no matches or search failed)
 * ENRICHING → FINALIZED                             (completion predicate holds)
 * FINALIZED → COLLECTING_REQUIREMENTS               (new search)
 * FINALIZED → ENRICHING                             (follow-up on the same result set)
 * </pre>
 *
 * <p>Entering FINALIZED sets the session's finalized-this-turn flag; leaving it clears the
 * flag. Which branch to take out of FINALIZED is decided by the {@link Dispatcher}.
 *
 * <p><b>Thread Safety:</b> stateless; callers run on the session's mailbox.
 */
public final class SessionStateMachine {

    private static final Logger LOG = LogManager.getLogger(SessionStateMachine.class);

    private static final Map<SessionPhase, Set<SessionPhase>> ALLOWED = new EnumMap<>(SessionPhase.class);

    static {
        ALLOWED.put(SessionPhase.COLLECTING_REQUIREMENTS,
                EnumSet.of(SessionPhase.COLLECTING_REQUIREMENTS, SessionPhase.SEARCHING));
        ALLOWED.put(SessionPhase.SEARCHING, EnumSet.of(SessionPhase.ENRICHING, SessionPhase.FINALIZED));
        ALLOWED.put(SessionPhase.ENRICHING, EnumSet.of(SessionPhase.FINALIZED));
        ALLOWED.put(SessionPhase.FINALIZED,
                EnumSet.of(SessionPhase.COLLECTING_REQUIREMENTS, SessionPhase.ENRICHING));
    }

    /**
     * Moves the session to {@code next}.
     *
     * @throws SessionStateException if the move is not allowed from the current phase
     */
    public void transition(Session session, SessionPhase next) {
        SessionPhase current = session.phase();
        if (!canTransition(current, next)) {
            throw new SessionStateException(session.id(), current, next);
        }
        session.applyPhase(next, next == SessionPhase.FINALIZED);
        if (current != next) {
            LOG.debug("Session {} {} -> {}", session.id(), current, next);
        }
    }

    /**
     * Ensures the session is collecting requirements, leaving FINALIZED if needed.
     */
    public void reopen(Session session) {
        if (session.phase() != SessionPhase.COLLECTING_REQUIREMENTS) {
            transition(session, SessionPhase.COLLECTING_REQUIREMENTS);
        }
    }

    public boolean canTransition(SessionPhase from, SessionPhase to) {
        return ALLOWED.get(from).contains(to);
    }
}
