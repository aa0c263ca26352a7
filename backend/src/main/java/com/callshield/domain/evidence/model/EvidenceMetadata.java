package com.callshield.domain.evidence.model;

import com.callshield.domain.session.model.CallDirection;
import com.callshield.domain.session.model.CallOutcome;
import com.callshield.domain.threat.model.ThreatLevel;

import java.time.Instant;

/**
 * Session metadata folded into the package hash.
 */
public record EvidenceMetadata(
        String sessionId,
        String phoneId,
        CallDirection direction,
        String audioReference,
        Instant startedAt,
        Instant endedAt,
        String endReason,
        CallOutcome outcome,
        double peakScore,
        ThreatLevel peakLevel,
        String personaId
) {}
