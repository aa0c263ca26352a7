package com.callshield.application.session;

import com.callshield.domain.intel.model.EntityView;
import com.callshield.domain.session.model.CallDirection;
import com.callshield.domain.session.model.CallOutcome;
import com.callshield.domain.session.model.CallState;
import com.callshield.domain.session.model.TranscriptEntry;
import com.callshield.domain.threat.model.ThreatLevel;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of a session for outside callers. Transcript text is redacted and entities are masked.
 */
public record SessionView(
        String sessionId,
        String phoneId,
        CallDirection direction,
        CallState state,
        double score,
        ThreatLevel level,
        List<TranscriptEntry> transcript,
        List<EntityView> entities,
        boolean personaActive,
        String personaId,
        CallOutcome outcome,
        Instant startedAt,
        Instant endedAt,
        Instant threatDetectedAt,
        int alertCount,
        double peakScore,
        String evidencePackageId
) {
    public SessionView {
        transcript = List.copyOf(transcript);
        entities = List.copyOf(entities);
    }
}
