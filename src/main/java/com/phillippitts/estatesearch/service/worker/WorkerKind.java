package com.phillippitts.estatesearch.service.worker;

import com.phillippitts.estatesearch.service.worker.message.CommunityQuery;
import com.phillippitts.estatesearch.service.worker.message.CommunityResult;
import com.phillippitts.estatesearch.service.worker.message.DiscoveryQuery;
import com.phillippitts.estatesearch.service.worker.message.DiscoveryResult;
import com.phillippitts.estatesearch.service.worker.message.GeneralAnswer;
import com.phillippitts.estatesearch.service.worker.message.GeneralQuestion;
import com.phillippitts.estatesearch.service.worker.message.GeocodingQuery;
import com.phillippitts.estatesearch.service.worker.message.GeocodingResult;
import com.phillippitts.estatesearch.service.worker.message.NegotiationBrief;
import com.phillippitts.estatesearch.service.worker.message.NegotiationResult;
import com.phillippitts.estatesearch.service.worker.message.ProbeQuery;
import com.phillippitts.estatesearch.service.worker.message.ProbeResult;
import com.phillippitts.estatesearch.service.worker.message.ReplyPayload;
import com.phillippitts.estatesearch.service.worker.message.RequestPayload;
import com.phillippitts.estatesearch.service.worker.message.ResearchQuery;
import com.phillippitts.estatesearch.service.worker.message.ResearchResult;
import com.phillippitts.estatesearch.service.worker.message.ScopingQuery;
import com.phillippitts.estatesearch.service.worker.message.ScopingVerdict;

/**
 * Worker specialties the coordinator can address, each bound to exactly one request and one
 * reply payload type.
 */
public enum WorkerKind {
    SCOPING(ScopingQuery.class, ScopingVerdict.class),
    RESEARCH(ResearchQuery.class, ResearchResult.class),
    INTERN(GeneralQuestion.class, GeneralAnswer.class),
    GEOCODING(GeocodingQuery.class, GeocodingResult.class),
    LOCAL_DISCOVERY(DiscoveryQuery.class, DiscoveryResult.class),
    COMMUNITY_ANALYSIS(CommunityQuery.class, CommunityResult.class),
    PROBER(ProbeQuery.class, ProbeResult.class),
    NEGOTIATOR(NegotiationBrief.class, NegotiationResult.class);

    private final Class<? extends RequestPayload> requestType;
    private final Class<? extends ReplyPayload> replyType;

    WorkerKind(Class<? extends RequestPayload> requestType, Class<? extends ReplyPayload> replyType) {
        this.requestType = requestType;
        this.replyType = replyType;
    }

    public boolean accepts(RequestPayload payload) {
        return requestType.isInstance(payload);
    }

    public boolean produces(ReplyPayload payload) {
        return replyType.isInstance(payload);
    }
}
