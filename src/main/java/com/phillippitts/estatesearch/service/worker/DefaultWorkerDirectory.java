package com.phillippitts.estatesearch.service.worker;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link WorkerDirectory} backed by the endpoint beans present in the context.
 */
public class DefaultWorkerDirectory implements WorkerDirectory {

    private static final Logger LOG = LogManager.getLogger(DefaultWorkerDirectory.class);

    private final Map<WorkerKind, WorkerEndpoint> endpoints = new EnumMap<>(WorkerKind.class);

    public DefaultWorkerDirectory(List<WorkerEndpoint> registered) {
        Objects.requireNonNull(registered, "registered");
        for (WorkerEndpoint endpoint : registered) {
            WorkerEndpoint previous = endpoints.put(endpoint.kind(), endpoint);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate endpoint for worker " + endpoint.kind());
            }
        }
        for (WorkerKind kind : WorkerKind.values()) {
            endpoints.computeIfAbsent(kind, UnavailableWorkerEndpoint::new);
        }
        LOG.info("Worker directory initialized: {}", endpoints);
    }

    @Override
    public WorkerEndpoint endpointFor(WorkerKind kind) {
        return endpoints.get(Objects.requireNonNull(kind, "kind"));
    }
}
