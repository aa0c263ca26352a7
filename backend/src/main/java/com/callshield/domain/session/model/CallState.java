package com.callshield.domain.session.model;

/**
 * Lifecycle of a monitored call.
 */
public enum CallState {
    IDLE,
    CONNECTING,
    MONITORING,
    THREAT_DETECTED,
    AI_HANDOFF,
    ENDED,
    REPORTED;

    /**
     * Allowed lifecycle edges. ENDED is reachable from every non-terminal state.
     */
    public boolean canTransitionTo(CallState next) {
        if (next == ENDED) {
            return !isTerminal();
        }
        return switch (this) {
            case IDLE -> next == CONNECTING;
            case CONNECTING -> next == MONITORING;
            case MONITORING -> next == THREAT_DETECTED;
            case THREAT_DETECTED -> next == MONITORING || next == AI_HANDOFF;
            case AI_HANDOFF -> next == MONITORING;
            case ENDED -> next == REPORTED;
            case REPORTED -> false;
        };
    }

    public boolean isTerminal() {
        return this == ENDED || this == REPORTED;
    }
}
