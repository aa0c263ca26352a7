package com.callshield.domain.evidence.model;

import com.callshield.domain.intel.model.EntityType;
import com.callshield.domain.intel.model.EntityView;
import com.callshield.domain.session.model.CallDirection;
import com.callshield.domain.session.model.CallOutcome;
import com.callshield.domain.threat.model.ThreatLevel;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Export form of an evidence package for the adjudicating authority.
 * Identifiers and entities appear in masked form; originals stay in the signed package.
 */
public record SubmissionDocument(
        String caseReference,
        Instant generatedAt,
        CallDetails call,
        ThreatSummary threatAssessment,
        Map<EntityType, List<String>> suspectIdentifiers,
        List<EntityView> extractedIntelligence,
        Integrity integrity,
        List<CustodyEntry> custodyLog,
        SubmissionStatus status
) {
    public record CallDetails(
            String sessionId,
            String phoneId,
            CallDirection direction,
            Instant startedAt,
            Instant endedAt,
            String endReason,
            int transcriptEntries
    ) {}

    public record ThreatSummary(
            double peakScore,
            ThreatLevel peakLevel,
            CallOutcome outcome,
            String personaId
    ) {}

    public record Integrity(
            String audioHash,
            String transcriptHash,
            String entityHash,
            String packageHash,
            String signature,
            String signatureAlgorithm
    ) {}
}
