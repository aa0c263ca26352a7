package com.callshield.application.session.exception;

public class UnknownSessionException extends CallPipelineException {

    public UnknownSessionException(String sessionId) {
        super(ErrorCode.UNKNOWN_SESSION, "No session with id " + sessionId);
    }
}
