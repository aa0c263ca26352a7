package com.callshield.application.profile;

import com.callshield.domain.intel.model.EntityType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Profile as shown to reviewers. Identifiers are masked.
 */
public record ScammerProfileView(
        String profileId,
        Map<EntityType, List<String>> identifiers,
        List<String> sessionIds,
        int callCount,
        int reportedCount,
        double riskScore,
        Instant firstSeen,
        Instant lastSeen
) {}
