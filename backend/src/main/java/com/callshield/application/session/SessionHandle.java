package com.callshield.application.session;

import com.callshield.domain.intel.model.ExtractedEntity;
import com.callshield.domain.session.model.CallSession;
import com.callshield.domain.session.model.Speaker;
import com.callshield.infrastructure.persona.PersonaEngagement;
import com.callshield.infrastructure.threat.ThreatScoringState;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Arena slot for one call: the session plus everything needed to serialize work on it.
 * Every field except the lock is read and written only while holding {@link #getLock()}.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
class SessionHandle {

    record PendingFragment(long sequenceNumber, Speaker speaker, String text,
                           List<ExtractedEntity> entities, OptionalDouble classifierProbability) {}

    private final CallSession session;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();
    private final ThreatScoringState scoringState = new ThreatScoringState();

    // Fragments that arrived ahead of a gap, keyed by sequence number
    private final TreeMap<Long, PendingFragment> reorderBuffer = new TreeMap<>();
    // Fragments between reservation and application, awaiting the classifier
    private final Map<Long, CompletableFuture<OptionalDouble>> inFlight = new HashMap<>();
    private long nextSequence = 1;

    private PersonaEngagement engagement;
    private String pendingCallerUtterance;
    private boolean ending;
    private boolean submitting;

    SessionHandle(CallSession session) {
        this.session = session;
    }

    String sessionId() {
        return session.getSessionId();
    }

    void advanceSequence() {
        nextSequence++;
    }

    boolean isKnownSequence(long sequenceNumber) {
        return sequenceNumber < nextSequence
                || reorderBuffer.containsKey(sequenceNumber)
                || inFlight.containsKey(sequenceNumber);
    }

    int pendingCount() {
        return reorderBuffer.size() + inFlight.size();
    }
}
