package com.callshield.application.session.exception;

public class DuplicateSessionException extends CallPipelineException {

    public DuplicateSessionException(String sessionId) {
        super(ErrorCode.DUPLICATE_SESSION, "Session " + sessionId + " already exists");
    }
}
