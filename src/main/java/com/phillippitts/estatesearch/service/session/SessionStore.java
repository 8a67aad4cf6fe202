package com.phillippitts.estatesearch.service.session;

import com.phillippitts.estatesearch.exception.UnknownSessionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Process-lifetime map from session id to session state and its mailbox.
 *
 * <p>The map itself is safe for concurrent use across sessions; everything that touches a
 * {@link Session} goes through {@link #submit(String, Consumer)} so per-session work is
 * serialized.
 */
public class SessionStore {

    private static final Logger LOG = LogManager.getLogger(SessionStore.class);

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
    private final Executor executor;
    private final Clock clock;

    public SessionStore(Executor executor, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs {@code task} on the session's mailbox, creating the session on first contact.
     */
    public void submitOrCreate(String sessionId, Consumer<Session> task) {
        while (true) {
            Entry entry = sessions.computeIfAbsent(sessionId, id -> {
                LOG.info("Created session {}", id);
                return new Entry(new Session(id, clock.instant()), new SessionMailbox(id, executor));
            });
            if (entry.submit(task)) {
                return;
            }
            // Closed by a concurrent eviction; start over with a fresh session
            sessions.remove(sessionId, entry);
        }
    }

    /**
     * Runs {@code task} on an existing session's mailbox.
     *
     * @throws UnknownSessionException if the store holds no such session
     */
    public void submit(String sessionId, Consumer<Session> task) {
        Entry entry = sessions.get(sessionId);
        if (entry == null || !entry.submit(task)) {
            throw new UnknownSessionException(sessionId);
        }
    }

    /**
     * Runs {@code task} if the session still exists.
     *
     * @return {@code false} if the session was evicted
     */
    public boolean submitIfPresent(String sessionId, Consumer<Session> task) {
        Entry entry = sessions.get(sessionId);
        return entry != null && entry.submit(task);
    }

    public boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    /** Read-only access for snapshots; callers must only read volatile state. */
    public Optional<Session> peek(String sessionId) {
        Entry entry = sessions.get(sessionId);
        return entry == null ? Optional.empty() : Optional.of(entry.session);
    }

    /** Sessions currently held, for read-only inspection. */
    public List<Session> sessions() {
        List<Session> result = new ArrayList<>(sessions.size());
        for (Entry entry : sessions.values()) {
            result.add(entry.session);
        }
        return result;
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Evicts sessions that are idle (no turn in flight, no mailbox task queued or running) and
     * inactive since {@code cutoff}. An evicted session's mailbox is closed first, so no task
     * can reach it afterwards; later messages for the same id start a new session.
     *
     * @return ids of the evicted sessions
     */
    public List<String> evictIdle(Instant cutoff) {
        List<String> evicted = new ArrayList<>();
        for (Map.Entry<String, Entry> e : sessions.entrySet()) {
            Entry entry = e.getValue();
            Session session = entry.session;
            if (entry.mailbox.closeIfIdle(() -> isIdleSince(session, cutoff))) {
                sessions.remove(e.getKey(), entry);
                evicted.add(e.getKey());
                LOG.info("Evicted idle session {} (last activity {})", e.getKey(), session.lastActivity());
            }
        }
        return evicted;
    }

    private static boolean isIdleSince(Session session, Instant cutoff) {
        return !session.isBusy()
                && session.pendingMessageCount() == 0
                && session.lastActivity().isBefore(cutoff);
    }

    private static final class Entry {
        private final Session session;
        private final SessionMailbox mailbox;

        private Entry(Session session, SessionMailbox mailbox) {
            this.session = session;
            this.mailbox = mailbox;
        }

        private boolean submit(Consumer<Session> task) {
            return mailbox.submit(() -> task.accept(session));
        }
    }
}
