package com.callshield.application.session.command;

public record HandoffTerminateCommand(
        String sessionId
) implements SessionCommand {

    @Override
    public String commandType() {
        return "handoff_terminate";
    }
}
