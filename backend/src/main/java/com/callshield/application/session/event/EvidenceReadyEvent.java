package com.callshield.application.session.event;

public record EvidenceReadyEvent(
        String packageId,
        String sessionId
) implements SessionEvent {

    @Override
    public String eventType() {
        return "evidence_ready";
    }
}
