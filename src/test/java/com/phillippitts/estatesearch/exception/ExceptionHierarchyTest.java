package com.phillippitts.estatesearch.exception;

import com.phillippitts.estatesearch.service.session.SessionPhase;
import com.phillippitts.estatesearch.service.worker.WorkerKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHierarchyTest {

    @Test
    void estateSearchExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        EstateSearchException ex = new EstateSearchException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void allDomainExceptionsExtendBase() {
        assertThat(new WorkerUnavailableException("down", WorkerKind.PROBER)).isInstanceOf(EstateSearchException.class);
        assertThat(new UnknownSessionException("s1")).isInstanceOf(EstateSearchException.class);
        assertThat(new InvalidWorkerReplyException("c1", "bad")).isInstanceOf(EstateSearchException.class);
        assertThat(new SessionStateException("s1", SessionPhase.ENRICHING, SessionPhase.SEARCHING))
                .isInstanceOf(EstateSearchException.class);
    }

    @Test
    void workerUnavailableExceptionShouldIncludeWorkerKind() {
        WorkerUnavailableException ex = new WorkerUnavailableException("No endpoint configured", WorkerKind.GEOCODING);

        assertThat(ex.getMessage()).contains("No endpoint configured").contains("GEOCODING");
        assertThat(ex.getWorkerKind()).isEqualTo(WorkerKind.GEOCODING);
    }

    @Test
    void unknownSessionExceptionShouldIncludeCorrelationId() {
        UnknownSessionException ex = new UnknownSessionException("s-9", "c-77");

        assertThat(ex.getMessage()).contains("s-9").contains("c-77");
        assertThat(ex.getSessionId()).isEqualTo("s-9");
    }

    @Test
    void sessionStateExceptionShouldIncludeBothPhases() {
        SessionStateException ex = new SessionStateException("s1", SessionPhase.ENRICHING, SessionPhase.SEARCHING);

        assertThat(ex.getMessage()).contains("ENRICHING -> SEARCHING");
        assertThat(ex.getFrom()).isEqualTo(SessionPhase.ENRICHING);
        assertThat(ex.getTo()).isEqualTo(SessionPhase.SEARCHING);
    }

    @Test
    void dispatchBuilderShouldIncludeAllDetails() {
        RuntimeException cause = new RuntimeException("Connection refused");

        WorkerUnavailableException ex = WorkerDispatchExceptionBuilder.create("Worker unreachable")
                .worker(WorkerKind.RESEARCH)
                .endpoint(URI.create("http://localhost:8102/requests"))
                .statusCode(503)
                .durationMs(42)
                .metadata("correlationId", "c-1")
                .metadata("ignored", null)
                .cause(cause)
                .build();

        assertThat(ex.getMessage()).isEqualTo("Worker unreachable (endpoint=http://localhost:8102/requests, "
                + "status=503, durationMs=42, correlationId=c-1) (worker: RESEARCH)");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getWorkerKind()).isEqualTo(WorkerKind.RESEARCH);
    }

    @Test
    void dispatchBuilderWithoutDetailsKeepsMessage() {
        WorkerUnavailableException ex = WorkerDispatchExceptionBuilder.create("Rejected")
                .worker(WorkerKind.PROBER)
                .build();

        assertThat(ex.getMessage()).isEqualTo("Rejected (worker: PROBER)");
        assertThat(ex.getCause()).isNull();
    }

    @Test
    void dispatchBuilderRequiresWorkerAndMessage() {
        assertThatThrownBy(() -> WorkerDispatchExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WorkerDispatchExceptionBuilder.create("x").build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("worker kind");
    }
}
