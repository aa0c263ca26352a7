package com.callshield.domain.profile.model;

import com.callshield.domain.intel.model.EntityType;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Identifiers and counters correlated across calls that share at least one identifier.
 * Mutated only by the profile service under its own lock.
 */
@Getter
public class ScammerProfile {

    private final String profileId;
    private final Map<EntityType, Set<String>> identifiers = new EnumMap<>(EntityType.class);
    private final Set<String> sessionIds = new LinkedHashSet<>();
    private int callCount;
    private int reportedCount;
    private double riskScore;
    private Instant firstSeen;
    private Instant lastSeen;

    public ScammerProfile(String profileId, Instant firstSeen) {
        this.profileId = profileId;
        this.firstSeen = firstSeen;
        this.lastSeen = firstSeen;
    }

    public boolean sharesIdentifier(Map<EntityType, Set<String>> candidate) {
        for (Map.Entry<EntityType, Set<String>> entry : candidate.entrySet()) {
            Set<String> known = identifiers.get(entry.getKey());
            if (known != null && !Collections.disjoint(known, entry.getValue())) {
                return true;
            }
        }
        return false;
    }

    public void recordCall(String sessionId, Map<EntityType, Set<String>> ids, double score, Instant seenAt) {
        ids.forEach((type, values) ->
                identifiers.computeIfAbsent(type, t -> new LinkedHashSet<>()).addAll(values));
        if (sessionIds.add(sessionId)) {
            callCount++;
        }
        riskScore = Math.max(riskScore, score);
        if (seenAt.isAfter(lastSeen)) {
            lastSeen = seenAt;
        }
    }

    public void absorb(ScammerProfile other) {
        other.identifiers.forEach((type, values) ->
                identifiers.computeIfAbsent(type, t -> new LinkedHashSet<>()).addAll(values));
        for (String sessionId : other.sessionIds) {
            if (sessionIds.add(sessionId)) {
                callCount++;
            }
        }
        reportedCount += other.reportedCount;
        riskScore = Math.max(riskScore, other.riskScore);
        if (other.firstSeen.isBefore(firstSeen)) {
            firstSeen = other.firstSeen;
        }
        if (other.lastSeen.isAfter(lastSeen)) {
            lastSeen = other.lastSeen;
        }
    }

    public void recordReport() {
        reportedCount++;
    }

    public Map<EntityType, Set<String>> getIdentifiers() {
        Map<EntityType, Set<String>> copy = new EnumMap<>(EntityType.class);
        identifiers.forEach((type, values) -> copy.put(type, Set.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    public Set<String> getSessionIds() {
        return Set.copyOf(sessionIds);
    }
}
