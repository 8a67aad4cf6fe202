package com.phillippitts.estatesearch.presentation.controller;

import com.phillippitts.estatesearch.service.orchestration.EstateSearchCoordinator;
import com.phillippitts.estatesearch.service.worker.message.WorkerReply;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingress for asynchronous worker replies. Replies are validated and queued on the owning
 * session's mailbox; the 202 only means the reply was accepted for processing.
 */
@RestController
@RequestMapping("/api/worker-replies")
class WorkerReplyController {

    private static final Logger LOG = LogManager.getLogger(WorkerReplyController.class);

    private final EstateSearchCoordinator coordinator;

    WorkerReplyController(EstateSearchCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping
    ResponseEntity<Void> postReply(@RequestBody WorkerReply reply) {
        String sessionId = reply.sessionId() == null ? "" : reply.sessionId();
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("sessionId", sessionId)) {
            LOG.debug("{} reply {} (success={})", reply.kind(), reply.correlationId(), reply.success());
            coordinator.onWorkerReply(reply);
            return ResponseEntity.accepted().build();
        }
    }
}
