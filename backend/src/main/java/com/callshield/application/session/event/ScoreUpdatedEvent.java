package com.callshield.application.session.event;

import com.callshield.domain.threat.model.ScoreSignal;
import com.callshield.domain.threat.model.ThreatLevel;

import java.util.List;

/**
 * Running score after one fragment. {@code signal} carries the sub-score breakdown for reviewers;
 * the level is derived from {@code score} alone.
 */
public record ScoreUpdatedEvent(
        String sessionId,
        long sequenceNumber,
        double score,
        ThreatLevel level,
        ScoreSignal signal,
        List<String> indicators,
        String recommendedAction
) implements SessionEvent {

    public ScoreUpdatedEvent {
        indicators = List.copyOf(indicators);
    }

    @Override
    public String eventType() {
        return "score_updated";
    }
}
