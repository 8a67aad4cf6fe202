package com.phillippitts.estatesearch.service.worker.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Kind-specific result carried by a successful {@link WorkerReply}. The JSON {@code type}
 * discriminator equals the producing
 * {@link com.phillippitts.estatesearch.service.worker.WorkerKind} name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ScopingVerdict.class, name = "SCOPING"),
        @JsonSubTypes.Type(value = ResearchResult.class, name = "RESEARCH"),
        @JsonSubTypes.Type(value = GeneralAnswer.class, name = "INTERN"),
        @JsonSubTypes.Type(value = GeocodingResult.class, name = "GEOCODING"),
        @JsonSubTypes.Type(value = DiscoveryResult.class, name = "LOCAL_DISCOVERY"),
        @JsonSubTypes.Type(value = CommunityResult.class, name = "COMMUNITY_ANALYSIS"),
        @JsonSubTypes.Type(value = ProbeResult.class, name = "PROBER"),
        @JsonSubTypes.Type(value = NegotiationResult.class, name = "NEGOTIATOR")
})
public interface ReplyPayload {
}
