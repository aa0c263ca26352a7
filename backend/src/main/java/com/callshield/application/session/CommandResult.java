package com.callshield.application.session;

import com.callshield.application.session.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Typed outcome of a session command: accepted with an optional payload, or rejected with a reason.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResult(
        boolean accepted,
        String command,
        String sessionId,
        ErrorCode errorCode,
        String message,
        Object payload
) {
    public static CommandResult accepted(String command, String sessionId, Object payload) {
        return new CommandResult(true, command, sessionId, null, null, payload);
    }

    public static CommandResult rejected(String command, String sessionId, ErrorCode errorCode, String message) {
        return new CommandResult(false, command, sessionId, errorCode, message, null);
    }
}
