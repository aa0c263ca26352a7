package com.callshield.domain.session.model;

import com.callshield.domain.evidence.model.EvidenceMetadata;
import com.callshield.domain.intel.model.ExtractedEntity;
import com.callshield.domain.persona.model.PersonaProfile;
import com.callshield.domain.threat.model.ThreatLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-call aggregate. Not thread-safe: every mutation happens under the owning session's lock.
 */
@Getter
public class CallSession {

    private final String sessionId;
    private final String phoneId;
    private final CallDirection direction;
    private final String audioReference;
    private final Instant startedAt;

    private CallState state = CallState.IDLE;
    private double runningScore;
    private ThreatLevel level = ThreatLevel.SAFE;
    private final List<TranscriptEntry> transcript = new ArrayList<>();
    private final Map<String, ExtractedEntity> entities = new LinkedHashMap<>();

    private boolean personaActive;
    private PersonaProfile persona;
    private boolean personaEverEngaged;
    private CallOutcome outcome;

    // Artifacts of a threat alert; never reset once set
    private Instant threatDetectedAt;
    private int alertCount;
    private boolean alertArmed = true;
    private double peakScore;
    private ThreatLevel peakLevel = ThreatLevel.SAFE;

    private Instant endedAt;
    private String endReason;
    private String evidencePackageId;
    private Instant lastActivityAt;

    public CallSession(String sessionId, String phoneId, CallDirection direction,
                       String audioReference, Instant startedAt) {
        this.sessionId = sessionId;
        this.phoneId = phoneId;
        this.direction = direction;
        this.audioReference = audioReference;
        this.startedAt = startedAt;
        this.lastActivityAt = startedAt;
    }

    /**
     * Moves to {@code next} and returns the previous state.
     *
     * @throws IllegalStateException if the edge is not allowed
     */
    public CallState transitionTo(CallState next, Instant at) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(state + " -> " + next + " is not a valid transition");
        }
        CallState previous = state;
        state = next;
        lastActivityAt = at;
        return previous;
    }

    public void applyScore(double score, ThreatLevel newLevel) {
        runningScore = score;
        level = newLevel;
        if (score > peakScore) {
            peakScore = score;
        }
        if (newLevel.compareTo(peakLevel) > 0) {
            peakLevel = newLevel;
        }
    }

    /**
     * Spends the armed alert edge. The first alert timestamp is kept for the session lifetime.
     */
    public void recordAlert(Instant at) {
        alertArmed = false;
        alertCount++;
        if (threatDetectedAt == null) {
            threatDetectedAt = at;
        }
    }

    public void rearmAlert() {
        alertArmed = true;
    }

    public TranscriptEntry appendTranscript(Long sequenceNumber, Speaker speaker, String text, Instant at) {
        TranscriptEntry entry = new TranscriptEntry(transcript.size(), sequenceNumber, speaker, text, runningScore);
        transcript.add(entry);
        lastActivityAt = at;
        return entry;
    }

    /**
     * Records entities, deduplicated by type and original value.
     *
     * @return the entities not seen before in this session
     */
    public List<ExtractedEntity> recordEntities(List<ExtractedEntity> found) {
        List<ExtractedEntity> added = new ArrayList<>();
        for (ExtractedEntity entity : found) {
            String key = entity.type() + "|" + entity.originalValue();
            if (entities.putIfAbsent(key, entity) == null) {
                added.add(entity);
            }
        }
        return added;
    }

    public void engagePersona(PersonaProfile profile) {
        persona = profile;
        personaActive = true;
        personaEverEngaged = true;
    }

    public void releasePersona() {
        personaActive = false;
    }

    public void markEnded(String reason, Instant at) {
        endReason = reason;
        endedAt = at;
        personaActive = false;
        if (personaEverEngaged) {
            outcome = CallOutcome.PERSONA_ENGAGED;
        } else if (threatDetectedAt != null) {
            outcome = CallOutcome.THREAT_SUSPECTED;
        } else {
            outcome = CallOutcome.NO_THREAT;
        }
    }

    public void attachEvidence(String packageId) {
        evidencePackageId = packageId;
    }

    public boolean hasEvidence() {
        return evidencePackageId != null;
    }

    public List<TranscriptEntry> getTranscript() {
        return List.copyOf(transcript);
    }

    public List<ExtractedEntity> getEntities() {
        return List.copyOf(entities.values());
    }

    public EvidenceMetadata toEvidenceMetadata() {
        return new EvidenceMetadata(
                sessionId,
                phoneId,
                direction,
                audioReference,
                startedAt,
                endedAt,
                endReason,
                outcome,
                peakScore,
                peakLevel,
                persona != null ? persona.id() : null
        );
    }
}
