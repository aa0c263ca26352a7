package com.callshield.application.session.command;

import com.callshield.domain.session.model.CallDirection;

/**
 * @param audioRef reference to the retained call audio (nullable)
 */
public record StartCommand(
        String sessionId,
        String phoneId,
        CallDirection direction,
        String audioRef
) implements SessionCommand {

    @Override
    public String commandType() {
        return "start";
    }
}
