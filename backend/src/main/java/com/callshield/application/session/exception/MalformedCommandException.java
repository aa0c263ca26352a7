package com.callshield.application.session.exception;

public class MalformedCommandException extends CallPipelineException {

    public MalformedCommandException(String message) {
        super(ErrorCode.MALFORMED_COMMAND, message);
    }
}
