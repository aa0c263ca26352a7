package com.callshield.application.session.command;

public record SubmitEvidenceCommand(
        String sessionId
) implements SessionCommand {

    @Override
    public String commandType() {
        return "submit_evidence";
    }
}
