package com.phillippitts.estatesearch.service.worker;

import com.phillippitts.estatesearch.service.worker.message.WorkerRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Sendable handle for one worker kind.
 *
 * <p>{@link #send(WorkerRequest)} is fire-and-forget: the returned future completes when the
 * worker has <em>accepted</em> the request, never when it has answered. The answer arrives
 * later as a {@link com.phillippitts.estatesearch.service.worker.message.WorkerReply}.
 * Implementations signal a dispatch failure by completing the future exceptionally (or
 * throwing synchronously); they must never block on the worker's answer.
 */
public interface WorkerEndpoint {

    WorkerKind kind();

    CompletableFuture<Void> send(WorkerRequest request);
}
