package com.callshield.domain.session.model;

public enum CallOutcome {
    NO_THREAT,
    THREAT_SUSPECTED,
    PERSONA_ENGAGED
}
