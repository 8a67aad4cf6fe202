package com.phillippitts.estatesearch.presentation.controller;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Drives the HTTP surface end to end with the Scoping worker pointed at a closed port, so the
 * dispatch is refused, retried once and finally answered with an apology.
 */
@Tag("integration")
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "estate.sweeper.enabled=false",
        "estate.workers.endpoints.SCOPING=http://127.0.0.1:1/requests",
        "estate.workers.connect-timeout-ms=500",
        "estate.orchestration.retry-backoff=50ms"
    }
)
class ChatApiIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void unreachableScopingWorkerEndsTurnWithApology() {
        ResponseEntity<JsonNode> accepted = restTemplate.postForEntity("/api/sessions/it-1/messages",
                Map.of("text", "3 bed house in San Francisco"), JsonNode.class);

        assertThat(accepted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(accepted.getBody().path("status").asText()).isEqualTo("ACCEPTED");

        List<JsonNode> received = new CopyOnWriteArrayList<>();
        await().atMost(10, SECONDS).until(() -> {
            JsonNode drained = restTemplate.getForObject("/api/sessions/it-1/responses", JsonNode.class);
            drained.forEach(received::add);
            return received.stream().anyMatch(m -> "CLARIFICATION".equals(m.path("type").asText()));
        });

        assertThat(received.get(0).path("type").asText()).isEqualTo("ACKNOWLEDGEMENT");
        assertThat(received).anySatisfy(m -> assertThat(m.path("text").asText()).startsWith("Sorry"));

        ResponseEntity<JsonNode> snapshot = restTemplate.getForEntity("/api/sessions/it-1", JsonNode.class);
        assertThat(snapshot.getBody().path("phase").asText()).isEqualTo("COLLECTING_REQUIREMENTS");
        assertThat(snapshot.getBody().path("outstandingCount").asInt()).isZero();
    }

    @Test
    void blankMessageIsRejected() {
        ResponseEntity<JsonNode> response = restTemplate.postForEntity("/api/sessions/it-2/messages",
                Map.of("text", " "), JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().path("errorCode").asText()).isEqualTo("ValidationFailed");
    }

    @Test
    void unknownSessionIsNotFound() {
        ResponseEntity<JsonNode> response = restTemplate.getForEntity("/api/sessions/nobody", JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void replyForUnknownSessionIsNotFound() {
        Map<String, Object> reply = Map.of(
                "correlationId", "c-1",
                "sessionId", "nobody",
                "kind", "INTERN",
                "success", true,
                "result", Map.of("type", "INTERN", "answer", "42"));

        ResponseEntity<JsonNode> response = restTemplate.postForEntity("/api/worker-replies", reply,
                JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void malformedReplyIsBadRequest() {
        Map<String, Object> reply = Map.of(
                "correlationId", "c-1",
                "sessionId", "nobody",
                "kind", "INTERN",
                "success", true);

        ResponseEntity<JsonNode> response = restTemplate.postForEntity("/api/worker-replies", reply,
                JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }
}
