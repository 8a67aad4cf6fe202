package com.phillippitts.estatesearch.service.worker;

import com.phillippitts.estatesearch.exception.WorkerDispatchExceptionBuilder;
import com.phillippitts.estatesearch.service.worker.message.WorkerRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Posts JSON {@link WorkerRequest}s to a worker's HTTP inbox on a dedicated executor.
 *
 * <p>A 2xx response means the worker accepted the request; its answer is posted back to
 * the coordinator's reply endpoint later. Transport errors and non-2xx responses complete
 * the returned future exceptionally with a
 * {@link com.phillippitts.estatesearch.exception.WorkerUnavailableException}.
 */
public class HttpWorkerEndpoint implements WorkerEndpoint {

    private static final Logger LOG = LogManager.getLogger(HttpWorkerEndpoint.class);

    private final WorkerKind kind;
    private final URI uri;
    private final RestClient restClient;
    private final Executor executor;

    public HttpWorkerEndpoint(WorkerKind kind, URI uri, RestClient restClient, Executor executor) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public WorkerKind kind() {
        return kind;
    }

    @Override
    public CompletableFuture<Void> send(WorkerRequest request) {
        return CompletableFuture.runAsync(() -> post(request), executor);
    }

    private void post(WorkerRequest request) {
        long t0 = System.nanoTime();
        try {
            restClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .toBodilessEntity();
            LOG.debug("Dispatched {} to {} in {} ms", request.correlationId(), uri, elapsedMs(t0));
        } catch (RestClientResponseException e) {
            throw WorkerDispatchExceptionBuilder.create("Worker rejected request")
                    .worker(kind)
                    .endpoint(uri)
                    .statusCode(e.getStatusCode().value())
                    .durationMs(elapsedMs(t0))
                    .metadata("correlationId", request.correlationId())
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw WorkerDispatchExceptionBuilder.create("Worker unreachable")
                    .worker(kind)
                    .endpoint(uri)
                    .durationMs(elapsedMs(t0))
                    .metadata("correlationId", request.correlationId())
                    .cause(e)
                    .build();
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    @Override
    public String toString() {
        return uri.toString();
    }
}
