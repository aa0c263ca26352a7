package com.callshield.domain.persona.model;

/**
 * What the caller's utterance is trying to get, as seen by the persona.
 */
public enum ReplyIntent {
    IDENTITY_PROBE,
    FINANCIAL_REQUEST,
    THREAT,
    URGENCY,
    TECH_REQUEST,
    VERIFICATION_REQUEST,
    PRIZE_OFFER,
    GENERAL
}
