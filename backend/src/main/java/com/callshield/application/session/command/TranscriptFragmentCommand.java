package com.callshield.application.session.command;

import com.callshield.domain.session.model.Speaker;

/**
 * @param sequenceNumber 1-based, per session
 */
public record TranscriptFragmentCommand(
        String sessionId,
        Speaker speaker,
        String text,
        Long sequenceNumber
) implements SessionCommand {

    @Override
    public String commandType() {
        return "transcript_fragment";
    }
}
