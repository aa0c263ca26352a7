package com.callshield.domain.threat.model;

/**
 * Discrete threat level derived from the running score.
 * Boundaries are half-open: a level covers [lowerBound, next level's lowerBound).
 */
public enum ThreatLevel {
    SAFE(0.0),
    LOW(0.1),
    MEDIUM(0.3),
    HIGH(0.6),
    CRITICAL(0.85);

    private final double lowerBound;

    ThreatLevel(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public static ThreatLevel fromScore(double score) {
        if (score >= CRITICAL.lowerBound) return CRITICAL;
        if (score >= HIGH.lowerBound) return HIGH;
        if (score >= MEDIUM.lowerBound) return MEDIUM;
        if (score >= LOW.lowerBound) return LOW;
        return SAFE;
    }

    /**
     * True for HIGH and CRITICAL, the levels that raise a threat alert.
     */
    public boolean isAlerting() {
        return this == HIGH || this == CRITICAL;
    }

    public String recommendedAction() {
        return switch (this) {
            case CRITICAL -> "handoff_to_ai";
            case HIGH -> "alert_user";
            case MEDIUM -> "increase_monitoring";
            case LOW, SAFE -> "continue_monitoring";
        };
    }
}
