package com.callshield.application.session.exception;

public class InvalidTransitionException extends CallPipelineException {

    public InvalidTransitionException(String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
    }
}
