package com.callshield.domain.persona.model;

public enum ReplyIssueType {
    SYNTHETIC_DISCLOSURE,
    SENSITIVE_DIGITS,
    EMPTY_REPLY,
    LENGTH_OVEREXPANSION
}
