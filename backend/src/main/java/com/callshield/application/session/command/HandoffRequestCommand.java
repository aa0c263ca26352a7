package com.callshield.application.session.command;

public record HandoffRequestCommand(
        String sessionId,
        String personaId
) implements SessionCommand {

    @Override
    public String commandType() {
        return "handoff_request";
    }
}
