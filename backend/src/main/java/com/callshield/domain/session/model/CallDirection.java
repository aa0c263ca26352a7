package com.callshield.domain.session.model;

public enum CallDirection {
    INBOUND,
    OUTBOUND
}
