package com.phillippitts.estatesearch.service.worker.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.phillippitts.estatesearch.exception.InvalidWorkerReplyException;
import com.phillippitts.estatesearch.service.worker.WorkerKind;
import com.phillippitts.estatesearch.testutil.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerMessageJsonTest {

    private final ObjectMapper mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();

    @Test
    void readsGeocodingReply() throws Exception {
        String json = """
                {"correlationId":"c-7","sessionId":"s1","kind":"GEOCODING","success":true,
                 "result":{"type":"GEOCODING","coordinates":{"latitude":37.76,"longitude":-122.42,
                 "resolvedAddress":"100 Main St"}}}
                """;

        WorkerReply reply = mapper.readValue(json, WorkerReply.class).validate();

        assertThat(reply.result()).isInstanceOfSatisfying(GeocodingResult.class,
                r -> assertThat(r.coordinates().latitude()).isEqualTo(37.76));
    }

    @Test
    void readsScopingVerdictWithRequirements() throws Exception {
        String json = """
                {"correlationId":"c-1","sessionId":"s1","kind":"SCOPING","success":true,
                 "result":{"type":"SCOPING","agentMessage":"Searching now.",
                   "requirements":{"budgetMax":1500000,"bedrooms":3,"bathrooms":2.0,"location":"San Francisco"},
                   "generalQuestion":false}}
                """;

        WorkerReply reply = mapper.readValue(json, WorkerReply.class).validate();

        ScopingVerdict verdict = (ScopingVerdict) reply.result();
        assertThat(verdict.requirements()).isEqualTo(Fixtures.completeRequirements());
        assertThat(verdict.negotiatePropertyNumber()).isNull();
    }

    @Test
    void readsFailureWithoutResult() throws Exception {
        String json = """
                {"correlationId":"c-2","sessionId":"s1","kind":"PROBER","success":false,"error":"quota exceeded"}
                """;

        WorkerReply reply = mapper.readValue(json, WorkerReply.class).validate();

        assertThat(reply.errorOrDefault()).isEqualTo("quota exceeded");
    }

    @Test
    void resultOfAnotherKindFailsValidation() throws Exception {
        String json = """
                {"correlationId":"c-3","sessionId":"s1","kind":"PROBER","success":true,
                 "result":{"type":"INTERN","answer":"42"}}
                """;

        WorkerReply reply = mapper.readValue(json, WorkerReply.class);

        assertThatThrownBy(reply::validate)
                .isInstanceOf(InvalidWorkerReplyException.class)
                .hasMessageContaining("GeneralAnswer does not belong to worker PROBER");
    }

    @Test
    void unknownResultTypeIsRejectedByMapper() {
        String json = """
                {"correlationId":"c-4","sessionId":"s1","kind":"PROBER","success":true,
                 "result":{"type":"WEATHER","forecast":"sunny"}}
                """;

        assertThatThrownBy(() -> mapper.readValue(json, WorkerReply.class))
                .isInstanceOf(InvalidTypeIdException.class);
    }

    @Test
    void writesRequestWithPayloadDiscriminator() throws Exception {
        WorkerRequest request = new WorkerRequest("c-5", "s1", WorkerKind.LOCAL_DISCOVERY, 2,
                new DiscoveryQuery(37.7, -122.4), Instant.parse("2025-03-01T12:00:00Z"));

        JsonNode node = mapper.readTree(mapper.writeValueAsString(request));

        assertThat(node.path("kind").asText()).isEqualTo("LOCAL_DISCOVERY");
        assertThat(node.path("propertyIndex").asInt()).isEqualTo(2);
        assertThat(node.path("payload").path("type").asText()).isEqualTo("LOCAL_DISCOVERY");
        assertThat(node.path("payload").path("latitude").asDouble()).isEqualTo(37.7);
    }
}
