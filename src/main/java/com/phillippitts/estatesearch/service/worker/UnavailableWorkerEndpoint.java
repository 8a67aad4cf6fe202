package com.phillippitts.estatesearch.service.worker;

import com.phillippitts.estatesearch.exception.WorkerUnavailableException;
import com.phillippitts.estatesearch.service.worker.message.WorkerRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Placeholder endpoint for kinds with no configured transport. Every send fails.
 */
final class UnavailableWorkerEndpoint implements WorkerEndpoint {

    private final WorkerKind kind;

    UnavailableWorkerEndpoint(WorkerKind kind) {
        this.kind = kind;
    }

    @Override
    public WorkerKind kind() {
        return kind;
    }

    @Override
    public CompletableFuture<Void> send(WorkerRequest request) {
        return CompletableFuture.failedFuture(
                new WorkerUnavailableException("No endpoint configured", kind));
    }

    @Override
    public String toString() {
        return "unavailable";
    }
}
