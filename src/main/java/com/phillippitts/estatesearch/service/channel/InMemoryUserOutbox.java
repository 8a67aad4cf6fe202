package com.phillippitts.estatesearch.service.channel;

import com.phillippitts.estatesearch.domain.CompositeResponse;
import com.phillippitts.estatesearch.service.orchestration.event.SessionEvictedEvent;
import com.phillippitts.estatesearch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link UserChannel} that buffers messages per session until the chat client polls them.
 *
 * <p>Each session's buffer is bounded; the oldest messages are discarded first when a client
 * stops polling. A buffer exists only while it holds messages: draining removes it, as does
 * eviction of its session.
 */
public class InMemoryUserOutbox implements UserChannel {

    private static final Logger LOG = LogManager.getLogger(InMemoryUserOutbox.class);

    static final int MAX_MESSAGES_PER_SESSION = 100;

    private final Map<String, Deque<OutboundMessage>> outboxes = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryUserOutbox(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void acknowledge(String sessionId, String text) {
        LOG.debug("Ack to {}: {}", sessionId, LogSanitizer.preview(text));
        append(sessionId, new OutboundMessage(OutboundMessage.Type.ACKNOWLEDGEMENT, text, null, clock.instant()));
    }

    @Override
    public void clarify(String sessionId, String text) {
        LOG.debug("Clarification to {}: {}", sessionId, LogSanitizer.preview(text));
        append(sessionId, new OutboundMessage(OutboundMessage.Type.CLARIFICATION, text, null, clock.instant()));
    }

    @Override
    public void deliver(CompositeResponse response) {
        LOG.info("Delivering {} response for turn {} ({} properties)",
                response.kind(), response.turn(), response.properties().size());
        append(response.sessionId(),
                new OutboundMessage(OutboundMessage.Type.RESPONSE, null, response, clock.instant()));
    }

    /**
     * Removes and returns everything buffered for the session, oldest first.
     */
    public List<OutboundMessage> drain(String sessionId) {
        Deque<OutboundMessage> outbox = outboxes.remove(sessionId);
        return outbox == null ? new ArrayList<>() : new ArrayList<>(outbox);
    }

    /** Number of sessions with undrained messages. */
    int bufferedSessions() {
        return outboxes.size();
    }

    @EventListener
    public void onSessionEvicted(SessionEvictedEvent event) {
        Deque<OutboundMessage> discarded = outboxes.remove(event.sessionId());
        if (discarded != null) {
            LOG.info("Discarded {} undrained messages of evicted session {}", discarded.size(), event.sessionId());
        }
    }

    private void append(String sessionId, OutboundMessage message) {
        // compute() keeps the append atomic with a concurrent drain of the same session
        outboxes.compute(sessionId, (id, outbox) -> {
            Deque<OutboundMessage> target = outbox == null ? new ArrayDeque<>() : outbox;
            target.addLast(message);
            if (target.size() > MAX_MESSAGES_PER_SESSION) {
                LOG.warn("Outbox for session {} full, dropped {} message", id, target.pollFirst().type());
            }
            return target;
        });
    }
}
