package com.callshield.application.session.event;

public record PersonaReplyEvent(
        String sessionId,
        String text,
        String personaId,
        int turn
) implements SessionEvent {

    @Override
    public String eventType() {
        return "persona_reply";
    }
}
