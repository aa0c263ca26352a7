package com.callshield.domain.threat.model;

import java.util.List;

/**
 * Result of folding one fragment into a session's running threat state.
 *
 * @param signal         the fragment's signal vector
 * @param runningScore   post-fusion running session score
 * @param level          level derived from the running score
 * @param previousLevel  level before this fragment
 * @param indicators     matched lexicon categories and behavioral flags, in detection order
 */
public record ThreatAssessment(
        ScoreSignal signal,
        double runningScore,
        ThreatLevel level,
        ThreatLevel previousLevel,
        List<String> indicators
) {
    public ThreatAssessment {
        indicators = List.copyOf(indicators);
    }

    public boolean levelChanged() {
        return level != previousLevel;
    }
}
