package com.phillippitts.estatesearch.service.worker.message;

import com.phillippitts.estatesearch.exception.InvalidWorkerReplyException;
import com.phillippitts.estatesearch.service.worker.WorkerKind;

/**
 * Reply a worker posts back for an earlier {@link WorkerRequest}.
 *
 * <p>Construction is lenient so that malformed replies can be deserialized and rejected with
 * a precise reason by {@link #validate()}.
 *
 * @param correlationId echoed request correlation id
 * @param sessionId     echoed session id
 * @param kind          replying worker kind
 * @param success       whether the worker produced a result
 * @param result        result payload, required when {@code success}
 * @param error         failure description when not {@code success}
 */
public record WorkerReply(
        String correlationId,
        String sessionId,
        WorkerKind kind,
        boolean success,
        ReplyPayload result,
        String error
) {

    public static WorkerReply success(WorkerRequest request, ReplyPayload result) {
        return new WorkerReply(request.correlationId(), request.sessionId(), request.kind(), true, result, null);
    }

    public static WorkerReply failure(WorkerRequest request, String error) {
        return new WorkerReply(request.correlationId(), request.sessionId(), request.kind(), false, null, error);
    }

    /**
     * Checks the reply's structure.
     *
     * @throws InvalidWorkerReplyException if identifiers are missing, a success carries no
     *                                     result, or the result does not belong to {@code kind}
     */
    public WorkerReply validate() {
        if (correlationId == null || correlationId.isBlank()) {
            throw new InvalidWorkerReplyException(correlationId, "missing correlationId");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new InvalidWorkerReplyException(correlationId, "missing sessionId");
        }
        if (kind == null) {
            throw new InvalidWorkerReplyException(correlationId, "missing worker kind");
        }
        if (success && result == null) {
            throw new InvalidWorkerReplyException(correlationId, "successful reply without result");
        }
        if (success && !kind.produces(result)) {
            throw new InvalidWorkerReplyException(correlationId,
                    "result " + result.getClass().getSimpleName() + " does not belong to worker " + kind);
        }
        return this;
    }

    /** Failure text for logs and events. */
    public String errorOrDefault() {
        return error == null || error.isBlank() ? "worker reported failure" : error;
    }
}
