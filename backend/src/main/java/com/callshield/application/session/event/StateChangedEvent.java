package com.callshield.application.session.event;

import com.callshield.domain.session.model.CallState;

import java.time.Instant;

public record StateChangedEvent(
        String sessionId,
        CallState oldState,
        CallState newState,
        Instant at
) implements SessionEvent {

    @Override
    public String eventType() {
        return "state_changed";
    }
}
