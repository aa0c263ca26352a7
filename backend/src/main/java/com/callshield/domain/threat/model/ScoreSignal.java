package com.callshield.domain.threat.model;

/**
 * Per-fragment signal vector. Never persisted on its own; folded into the session's running score.
 *
 * @param keywordPressure        category-weighted lexical pressure (0-1, saturating)
 * @param urgency                urgency and threat markers (0-1)
 * @param financialRequest       financial and credential request markers (0-1)
 * @param impersonation          authority impersonation markers (0-1)
 * @param behavioralEscalation   escalation sequences within the turn window (0-1)
 * @param classifierProbability  external classifier probability, null when absent or timed out
 * @param entityBoost            fixed boost for high-sensitivity entities in the fragment
 * @param fused                  weighted fusion of the above, normalized to [0, 1]
 */
public record ScoreSignal(
        double keywordPressure,
        double urgency,
        double financialRequest,
        double impersonation,
        double behavioralEscalation,
        Double classifierProbability,
        double entityBoost,
        double fused
) {
    public boolean hasClassifierSignal() {
        return classifierProbability != null;
    }
}
