package com.phillippitts.estatesearch.presentation.controller;

import com.phillippitts.estatesearch.exception.UnknownSessionException;
import com.phillippitts.estatesearch.presentation.dto.OutboundMessageView;
import com.phillippitts.estatesearch.presentation.dto.SubmissionReceipt;
import com.phillippitts.estatesearch.presentation.dto.UserMessageRequest;
import com.phillippitts.estatesearch.service.channel.InMemoryUserOutbox;
import com.phillippitts.estatesearch.service.channel.OutboundMessage;
import com.phillippitts.estatesearch.service.orchestration.EstateSearchCoordinator;
import com.phillippitts.estatesearch.service.orchestration.SubmissionStatus;
import com.phillippitts.estatesearch.service.session.SessionSnapshot;
import jakarta.validation.Valid;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

/**
 * Chat surface: accepts user messages and lets clients poll for what the coordinator sent back.
 */
@RestController
@RequestMapping("/api/sessions")
class ChatController {

    private static final Logger LOG = LogManager.getLogger(ChatController.class);

    private final EstateSearchCoordinator coordinator;
    private final InMemoryUserOutbox outbox;
    private final MarkdownResponseRenderer renderer;
    private final Clock clock;

    ChatController(EstateSearchCoordinator coordinator,
                   InMemoryUserOutbox outbox,
                   MarkdownResponseRenderer renderer,
                   Clock clock) {
        this.coordinator = coordinator;
        this.outbox = outbox;
        this.renderer = renderer;
        this.clock = clock;
    }

    @PostMapping("/{sessionId}/messages")
    ResponseEntity<SubmissionReceipt> postMessage(@PathVariable String sessionId,
                                                  @Valid @RequestBody UserMessageRequest request) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("sessionId", sessionId)) {
            SubmissionStatus status = coordinator.submitUserMessage(sessionId, request.text());
            LOG.debug("Message for session {} {}", sessionId, status);
            return ResponseEntity.accepted().body(new SubmissionReceipt(sessionId, status, clock.instant()));
        }
    }

    @GetMapping("/{sessionId}")
    ResponseEntity<SessionSnapshot> getSession(@PathVariable String sessionId) {
        SessionSnapshot snapshot = coordinator.snapshot(sessionId)
                .orElseThrow(() -> new UnknownSessionException(sessionId));
        return ResponseEntity.ok(snapshot);
    }

    /**
     * Drains everything buffered for the session. Each message is returned once.
     */
    @GetMapping("/{sessionId}/responses")
    ResponseEntity<List<OutboundMessageView>> drainResponses(@PathVariable String sessionId) {
        List<OutboundMessageView> views = outbox.drain(sessionId).stream()
                .map(this::toView)
                .toList();
        return ResponseEntity.ok(views);
    }

    private OutboundMessageView toView(OutboundMessage message) {
        if (message.type() == OutboundMessage.Type.RESPONSE) {
            return new OutboundMessageView(message.type(), renderer.render(message.response()),
                    message.response(), message.createdAt());
        }
        return new OutboundMessageView(message.type(), message.text(), null, message.createdAt());
    }
}
