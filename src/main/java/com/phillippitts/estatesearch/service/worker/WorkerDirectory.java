package com.phillippitts.estatesearch.service.worker;

/**
 * Injected directory that resolves a worker kind to its sendable endpoint.
 */
public interface WorkerDirectory {

    /**
     * Returns the endpoint for the given kind. Never {@code null}: kinds without a
     * registered endpoint resolve to one that reports itself unavailable on every send.
     */
    WorkerEndpoint endpointFor(WorkerKind kind);
}
