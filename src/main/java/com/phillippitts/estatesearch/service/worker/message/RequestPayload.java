package com.phillippitts.estatesearch.service.worker.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Kind-specific body of a {@link WorkerRequest}. The JSON {@code type} discriminator equals
 * the owning {@link com.phillippitts.estatesearch.service.worker.WorkerKind} name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ScopingQuery.class, name = "SCOPING"),
        @JsonSubTypes.Type(value = ResearchQuery.class, name = "RESEARCH"),
        @JsonSubTypes.Type(value = GeneralQuestion.class, name = "INTERN"),
        @JsonSubTypes.Type(value = GeocodingQuery.class, name = "GEOCODING"),
        @JsonSubTypes.Type(value = DiscoveryQuery.class, name = "LOCAL_DISCOVERY"),
        @JsonSubTypes.Type(value = CommunityQuery.class, name = "COMMUNITY_ANALYSIS"),
        @JsonSubTypes.Type(value = ProbeQuery.class, name = "PROBER"),
        @JsonSubTypes.Type(value = NegotiationBrief.class, name = "NEGOTIATOR")
})
public interface RequestPayload {
}
