package com.phillippitts.estatesearch.service.session;

import com.phillippitts.estatesearch.domain.CommunityAnalysis;
import com.phillippitts.estatesearch.domain.Listing;
import com.phillippitts.estatesearch.domain.SearchRequirements;
import com.phillippitts.estatesearch.service.worker.WorkerKind;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Working state of one user's conversation.
 *
 * <p><b>Threading:</b> a session is mutated only by tasks running on its
 * {@link SessionMailbox}, one at a time. The few fields read from other threads
 * (phase, counters, activity timestamp) are volatile so that snapshots, health checks and
 * the sweeper see recent values without entering the mailbox.
 */
public final class Session {

    private final String id;
    private final Instant createdAt;
    private volatile Instant lastActivity;

    private volatile SessionPhase phase = SessionPhase.COLLECTING_REQUIREMENTS;
    private boolean finalizedThisTurn;
    private volatile int turn;
    private Instant turnStartedAt;
    private String currentMessage;

    private SearchRequirements requirements;
    private SearchRequirements searchedRequirements;

    private final List<PropertyRecord> properties = new ArrayList<>();
    private volatile int propertyCount;
    private int resultSet;
    private String searchSummary;
    private int totalFound;
    private CommunityAnalysis community;
    private Instant enrichmentDeadline;

    private String generalAnswer;
    private String negotiationSummary;

    private final Map<String, OutstandingRequest> outstanding = new LinkedHashMap<>();
    private volatile int outstandingCount;

    private final Deque<String> pendingMessages = new ArrayDeque<>();
    private volatile int pendingCount;

    public Session(String id, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.lastActivity = createdAt;
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    public SessionPhase phase() {
        return phase;
    }

    /** Raw phase write. Use {@code SessionStateMachine#transition}, which validates the move. */
    public void applyPhase(SessionPhase next, boolean finalized) {
        this.phase = next;
        this.finalizedThisTurn = finalized;
    }

    public boolean isFinalizedThisTurn() {
        return finalizedThisTurn;
    }

    /**
     * A busy session has a turn in flight: a search, an enrichment or any unanswered
     * worker request. New user messages are queued while busy.
     */
    public boolean isBusy() {
        SessionPhase current = phase;
        return current == SessionPhase.SEARCHING
                || current == SessionPhase.ENRICHING
                || outstandingCount > 0;
    }

    /** Whether the sweeper has anything to check: deadlines or an enrichment window. */
    public boolean needsSweep() {
        return outstandingCount > 0 || phase == SessionPhase.ENRICHING;
    }

    /**
     * Starts a user turn: records the message and clears the previous turn's commentary.
     */
    public void beginTurn(Instant now, String message) {
        this.turnStartedAt = now;
        this.currentMessage = message;
        this.generalAnswer = null;
        this.negotiationSummary = null;
    }

    public Instant turnStartedAt() {
        return turnStartedAt;
    }

    /** User message that opened the current turn. */
    public String currentMessage() {
        return currentMessage;
    }

    /** Advances and returns the 1-based number of the response being emitted. */
    public int completeTurn() {
        turn = turn + 1;
        return turn;
    }

    public int turn() {
        return turn;
    }

    public SearchRequirements requirements() {
        return requirements;
    }

    public void setRequirements(SearchRequirements requirements) {
        this.requirements = requirements;
    }

    /** Requirements the current result set was searched with, {@code null} before the first search. */
    public SearchRequirements searchedRequirements() {
        return searchedRequirements;
    }

    /**
     * Discards the current result set and everything still outstanding for it. Replies to
     * dropped requests no longer correlate and are ignored.
     *
     * @param searched requirements the new result set is searched with
     * @return the dropped outstanding requests
     */
    public List<OutstandingRequest> startNewResultSet(SearchRequirements searched) {
        searchedRequirements = searched;
        properties.clear();
        propertyCount = 0;
        resultSet++;
        searchSummary = null;
        totalFound = 0;
        community = null;
        enrichmentDeadline = null;
        return dropOutstanding();
    }

    /**
     * Creates one record per listing, indexed by position. Indices are assigned once per
     * result set and never reused within it. A new search starts a new result set
     * ({@link #startNewResultSet}) whose indices start again at 0; replies addressed to the
     * previous set no longer correlate, so an index never refers to two listings at once.
     *
     * @throws IllegalStateException if the current result set already has records
     */
    public List<PropertyRecord> createPropertyRecords(List<Listing> listings) {
        if (!properties.isEmpty()) {
            throw new IllegalStateException("Result set " + resultSet + " of session " + id
                    + " already holds " + properties.size() + " properties");
        }
        for (int i = 0; i < listings.size(); i++) {
            properties.add(new PropertyRecord(i, listings.get(i)));
        }
        propertyCount = properties.size();
        return properties();
    }

    public List<PropertyRecord> properties() {
        return Collections.unmodifiableList(properties);
    }

    public Optional<PropertyRecord> property(int index) {
        if (index < 0 || index >= properties.size()) {
            return Optional.empty();
        }
        return Optional.of(properties.get(index));
    }

    public boolean hasResultSet() {
        return !properties.isEmpty();
    }

    public int propertyCount() {
        return propertyCount;
    }

    public int resultSet() {
        return resultSet;
    }

    public String searchSummary() {
        return searchSummary;
    }

    public int totalFound() {
        return totalFound;
    }

    public void setSearchOutcome(String searchSummary, int totalFound) {
        this.searchSummary = searchSummary;
        this.totalFound = totalFound;
    }

    public CommunityAnalysis community() {
        return community;
    }

    public void setCommunity(CommunityAnalysis community) {
        this.community = community;
    }

    public Instant enrichmentDeadline() {
        return enrichmentDeadline;
    }

    public void setEnrichmentDeadline(Instant enrichmentDeadline) {
        this.enrichmentDeadline = enrichmentDeadline;
    }

    public String generalAnswer() {
        return generalAnswer;
    }

    public void setGeneralAnswer(String generalAnswer) {
        this.generalAnswer = generalAnswer;
    }

    public String negotiationSummary() {
        return negotiationSummary;
    }

    public void setNegotiationSummary(String negotiationSummary) {
        this.negotiationSummary = negotiationSummary;
    }

    public void track(OutstandingRequest request) {
        OutstandingRequest previous = outstanding.putIfAbsent(request.correlationId(), request);
        if (previous != null) {
            throw new IllegalStateException("Correlation id already tracked: " + request.correlationId());
        }
        outstandingCount = outstanding.size();
    }

    public Optional<OutstandingRequest> outstanding(String correlationId) {
        return Optional.ofNullable(outstanding.get(correlationId));
    }

    /** Removes and returns the request, or empty if it was already resolved. */
    public Optional<OutstandingRequest> resolve(String correlationId) {
        OutstandingRequest removed = outstanding.remove(correlationId);
        outstandingCount = outstanding.size();
        return Optional.ofNullable(removed);
    }

    /**
     * Finds an unresolved request of the given kind for the given property
     * ({@code null} index for session-level requests).
     */
    public Optional<OutstandingRequest> findOutstanding(WorkerKind kind, Integer propertyIndex) {
        for (OutstandingRequest request : outstanding.values()) {
            if (request.targets(kind, propertyIndex)) {
                return Optional.of(request);
            }
        }
        return Optional.empty();
    }

    /** Unresolved requests in dispatch order. */
    public List<OutstandingRequest> outstandingRequests() {
        return List.copyOf(outstanding.values());
    }

    public int outstandingCount() {
        return outstandingCount;
    }

    public List<OutstandingRequest> dropOutstanding() {
        List<OutstandingRequest> dropped = List.copyOf(outstanding.values());
        outstanding.clear();
        outstandingCount = 0;
        return dropped;
    }

    public void enqueueMessage(String text) {
        pendingMessages.addLast(text);
        pendingCount = pendingMessages.size();
    }

    public Optional<String> pollPendingMessage() {
        String next = pendingMessages.pollFirst();
        pendingCount = pendingMessages.size();
        return Optional.ofNullable(next);
    }

    public int pendingMessageCount() {
        return pendingCount;
    }

    public SessionSnapshot snapshot() {
        return new SessionSnapshot(id, phase, turn, propertyCount, outstandingCount, pendingCount,
                createdAt, lastActivity);
    }

    @Override
    public String toString() {
        return "Session{" + id + ", phase=" + phase + ", turn=" + turn + ", properties=" + propertyCount
                + ", outstanding=" + outstandingCount + '}';
    }
}
