package com.phillippitts.estatesearch.exception;

import com.phillippitts.estatesearch.service.worker.WorkerKind;

/**
 * Thrown (or used to complete a dispatch future exceptionally) when a worker cannot accept
 * a request: no endpoint configured, connection refused, non-2xx acceptance, and so on.
 */
public class WorkerUnavailableException extends EstateSearchException {

    private final WorkerKind workerKind;

    public WorkerUnavailableException(String message, WorkerKind workerKind) {
        super(message + " (worker: " + workerKind + ")");
        this.workerKind = workerKind;
    }

    public WorkerUnavailableException(String message, WorkerKind workerKind, Throwable cause) {
        super(message + " (worker: " + workerKind + ")", cause);
        this.workerKind = workerKind;
    }

    public WorkerKind getWorkerKind() {
        return workerKind;
    }
}
