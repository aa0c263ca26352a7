package com.callshield.domain.persona.model;

/**
 * Engagement stage, advanced by the number of persona turns taken.
 */
public enum EngagementStage {
    INITIAL,
    BUILDING_TRUST,
    EXTRACTING,
    TERMINATING;

    public static EngagementStage forTurnCount(int turns) {
        if (turns < 3) return INITIAL;
        if (turns < 8) return BUILDING_TRUST;
        if (turns < 15) return EXTRACTING;
        return TERMINATING;
    }
}
