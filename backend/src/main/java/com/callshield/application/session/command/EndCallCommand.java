package com.callshield.application.session.command;

public record EndCallCommand(
        String sessionId,
        String reason
) implements SessionCommand {

    @Override
    public String commandType() {
        return "end_call";
    }
}
