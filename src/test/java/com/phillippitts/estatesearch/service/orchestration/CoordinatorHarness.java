package com.phillippitts.estatesearch.service.orchestration;

import com.phillippitts.estatesearch.config.properties.MapProperties;
import com.phillippitts.estatesearch.config.properties.OrchestrationProperties;
import com.phillippitts.estatesearch.service.orchestration.event.DispatchFailedEvent;
import com.phillippitts.estatesearch.service.session.Session;
import com.phillippitts.estatesearch.service.session.SessionStore;
import com.phillippitts.estatesearch.service.worker.WorkerKind;
import com.phillippitts.estatesearch.service.worker.message.ReplyPayload;
import com.phillippitts.estatesearch.service.worker.message.ResearchResult;
import com.phillippitts.estatesearch.service.worker.message.WorkerReply;
import com.phillippitts.estatesearch.service.worker.message.WorkerRequest;
import com.phillippitts.estatesearch.testutil.CapturingUserChannel;
import com.phillippitts.estatesearch.testutil.Fixtures;
import com.phillippitts.estatesearch.testutil.ManualRetryScheduler;
import com.phillippitts.estatesearch.testutil.MutableClock;
import com.phillippitts.estatesearch.testutil.RecordingWorkerDirectory;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Wires a coordinator with synchronous mailboxes and recording test doubles, so a test drives
 * a whole conversation from one thread and inspects what was sent and delivered.
 */
final class CoordinatorHarness {

    static final String SESSION = "session-1";

    final MutableClock clock = MutableClock.startingAt("2025-03-01T12:00:00Z");
    final RecordingWorkerDirectory workers = new RecordingWorkerDirectory();
    final CapturingUserChannel channel = new CapturingUserChannel();
    final ManualRetryScheduler retries = new ManualRetryScheduler();
    final List<Object> events = new ArrayList<>();
    final OrchestrationProperties properties;
    final SessionStore store;
    final EstateSearchCoordinator coordinator;

    CoordinatorHarness() {
        this(OrchestrationProperties.defaults());
    }

    CoordinatorHarness(OrchestrationProperties properties) {
        this.properties = properties;
        this.store = new SessionStore(Runnable::run, clock);
        AtomicInteger ids = new AtomicInteger();
        EstateSearchCoordinator[] ref = new EstateSearchCoordinator[1];
        ApplicationEventPublisher publisher = event -> {
            events.add(event);
            if (event instanceof DispatchFailedEvent failed) {
                ref[0].onDispatchFailed(failed);
            }
        };
        SessionStateMachine stateMachine = new SessionStateMachine();
        Dispatcher dispatcher = new Dispatcher(workers, stateMachine, properties, publisher, null, clock,
                () -> "c" + ids.incrementAndGet());
        this.coordinator = EstateSearchCoordinator.builder()
                .sessionStore(store)
                .dispatcher(dispatcher)
                .aggregator(new Aggregator(properties, publisher, null, clock))
                .responseAssembler(new ResponseAssembler(new MapComposer(new MapProperties()), clock))
                .stateMachine(stateMachine)
                .userChannel(channel)
                .retryScheduler(retries)
                .properties(properties)
                .publisher(publisher)
                .clock(clock)
                .build();
        ref[0] = coordinator;
    }

    /** Properties with the given window, per-request timeout, retry bound and enrichments. */
    static OrchestrationProperties properties(Duration window, Duration requestTimeout, int maxRetries,
                                              Set<WorkerKind> enrichments) {
        Set<WorkerKind> enabled = enrichments.isEmpty()
                ? EnumSet.noneOf(WorkerKind.class)
                : EnumSet.copyOf(enrichments);
        return new OrchestrationProperties(window, requestTimeout, maxRetries, Duration.ofMillis(500),
                enabled, 5, Duration.ofMinutes(30));
    }

    /** Defaults with only geocoding enabled. */
    static OrchestrationProperties geocodingOnly() {
        return properties(Duration.ofSeconds(30), Duration.ofSeconds(30), 1, Set.of());
    }

    SubmissionStatus send(String text) {
        return coordinator.submitUserMessage(SESSION, text);
    }

    void reply(WorkerRequest request, ReplyPayload payload) {
        coordinator.onWorkerReply(WorkerReply.success(request, payload));
    }

    void fail(WorkerRequest request, String error) {
        coordinator.onWorkerReply(WorkerReply.failure(request, error));
    }

    Session session() {
        return store.peek(SESSION).orElseThrow();
    }

    /**
     * Runs a conversation up to the start of enrichment: one message, a complete Scoping
     * verdict and a Research result with {@code count} listings.
     */
    void startSearch(int count) {
        send("3 bed 2 bath in San Francisco under 1.5M");
        reply(workers.last(WorkerKind.SCOPING), Fixtures.searchVerdict());
        reply(workers.last(WorkerKind.RESEARCH),
                new ResearchResult("Found " + count + " homes in San Francisco", count, Fixtures.listings(count)));
    }

    <T> List<T> events(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }
}
